package org.javai.units.text;

import java.nio.ByteBuffer;
import java.nio.CharBuffer;
import java.nio.charset.CharacterCodingException;
import java.nio.charset.CharsetEncoder;
import java.nio.charset.CodingErrorAction;
import java.nio.charset.StandardCharsets;
import java.util.Objects;

/**
 * Single-byte Latin-1 encoding used for exchanging unit text with other systems.
 * Every byte maps to exactly one character, so character offsets reported by the
 * parser are also byte offsets into the encoded text.
 */
public final class Latin1Text {

	private Latin1Text() {
		// Utility class - no instantiation
	}

	public static String decode(byte[] bytes) {
		Objects.requireNonNull(bytes, "bytes must not be null");
		return new String(bytes, StandardCharsets.ISO_8859_1);
	}

	/**
	 * @throws IllegalArgumentException if the text contains a character outside Latin-1
	 */
	public static byte[] encode(String text) {
		Objects.requireNonNull(text, "text must not be null");
		CharsetEncoder encoder = StandardCharsets.ISO_8859_1.newEncoder()
				.onMalformedInput(CodingErrorAction.REPORT)
				.onUnmappableCharacter(CodingErrorAction.REPORT);
		try {
			ByteBuffer buffer = encoder.encode(CharBuffer.wrap(text));
			byte[] bytes = new byte[buffer.remaining()];
			buffer.get(bytes);
			return bytes;
		} catch (CharacterCodingException e) {
			throw new IllegalArgumentException("Text is not representable in Latin-1: " + text, e);
		}
	}

	public static boolean isRepresentable(String text) {
		return text != null && StandardCharsets.ISO_8859_1.newEncoder().canEncode(text);
	}
}

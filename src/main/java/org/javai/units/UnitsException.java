package org.javai.units;

/**
 * Base exception for every failure raised by the units engine.
 * <p>
 * Parse-time failures carry the character offset of the failure in the input
 * text. Under the single-byte Latin-1 interchange encoding the character offset
 * is also the byte offset. Failures unrelated to a position report {@code -1}.
 */
public class UnitsException extends RuntimeException {

	public static final int NO_OFFSET = -1;

	private final int offset;

	public UnitsException(String message) {
		this(message, NO_OFFSET);
	}

	public UnitsException(String message, Throwable cause) {
		super(message, cause);
		this.offset = NO_OFFSET;
	}

	public UnitsException(String message, int offset) {
		super(offset >= 0 ? message + " at offset " + offset : message);
		this.offset = offset;
	}

	public UnitsException(String message, int offset, Throwable cause) {
		super(offset >= 0 ? message + " at offset " + offset : message, cause);
		this.offset = offset;
	}

	/**
	 * Offset of the failure in the input text, or {@link #NO_OFFSET}.
	 */
	public int offset() {
		return offset;
	}

	public boolean hasOffset() {
		return offset >= 0;
	}
}

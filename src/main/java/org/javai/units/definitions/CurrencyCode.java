package org.javai.units.definitions;

import java.util.Objects;
import java.util.regex.Pattern;

/**
 * An ISO-style three letter currency code.
 */
public record CurrencyCode(String code) {

	/** Shape every currency code must have, listed or not. */
	public static final Pattern SHAPE = Pattern.compile("[A-Z]{3}");

	public CurrencyCode {
		Objects.requireNonNull(code, "code must not be null");
		if (!SHAPE.matcher(code).matches()) {
			throw new IllegalArgumentException("Currency code must be three upper-case letters: " + code);
		}
	}

	public static boolean hasCurrencyShape(String candidate) {
		return candidate != null && SHAPE.matcher(candidate).matches();
	}
}

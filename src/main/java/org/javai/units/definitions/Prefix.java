package org.javai.units.definitions;

import java.util.Objects;

/**
 * A decimal prefix such as {@code k} (10^3) or {@code µ} (10^-6).
 *
 * @param symbol the prefix symbol as written in unit text
 * @param scale the base-10 exponent the prefix contributes
 * @param name optional descriptive name, may be null
 */
public record Prefix(String symbol, int scale, String name) {

	public Prefix {
		Objects.requireNonNull(symbol, "symbol must not be null");
		if (symbol.isEmpty()) {
			throw new IllegalArgumentException("Prefix symbol must not be empty");
		}
	}

	public Prefix(String symbol, int scale) {
		this(symbol, scale, null);
	}
}

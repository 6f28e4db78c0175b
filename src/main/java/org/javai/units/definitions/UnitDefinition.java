package org.javai.units.definitions;

import java.util.Objects;

/**
 * A unit known to the definitions table. The engine treats a unit as a labelled
 * atom; any physical meaning is left to the embedding application.
 *
 * @param symbol the unit symbol as written in unit text
 * @param name optional descriptive name, may be null
 */
public record UnitDefinition(String symbol, String name) {

	public UnitDefinition {
		Objects.requireNonNull(symbol, "symbol must not be null");
		if (symbol.isEmpty()) {
			throw new IllegalArgumentException("Unit symbol must not be empty");
		}
	}

	public UnitDefinition(String symbol) {
		this(symbol, null);
	}
}

package org.javai.units.parse;

import org.javai.units.UnitsException;

/**
 * A symbol could not be split into listed prefixes and a listed unit.
 */
public class UnrecognizedUnitException extends UnitsException {

	private final String symbol;

	public UnrecognizedUnitException(String symbol, int offset) {
		super("Unrecognized unit '" + symbol + "'", offset);
		this.symbol = symbol;
	}

	public String symbol() {
		return symbol;
	}
}

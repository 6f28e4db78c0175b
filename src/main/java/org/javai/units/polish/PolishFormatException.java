package org.javai.units.polish;

import org.javai.units.UnitsException;

/**
 * Raised when Polish-notation text is malformed or does not describe a unit expression.
 */
public class PolishFormatException extends UnitsException {

	public PolishFormatException(String message, int offset) {
		super(message, offset);
	}

	public PolishFormatException(String message) {
		super(message);
	}
}

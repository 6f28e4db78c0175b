package org.javai.units.parse;

import org.javai.units.UnitsException;

/**
 * A number or exponent does not follow the numeric grammar.
 */
public class MalformedNumberException extends UnitsException {

	public MalformedNumberException(String message, int offset) {
		super(message, offset);
	}

	public MalformedNumberException(String message, int offset, Throwable cause) {
		super(message, offset, cause);
	}
}

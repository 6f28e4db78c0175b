package org.javai.units.parse;

import org.javai.units.UnitsException;

/**
 * A braced mark has no closing brace.
 */
public class UnterminatedMarkException extends UnitsException {

	public UnterminatedMarkException(String message, int offset) {
		super(message, offset);
	}
}

package org.javai.units.parse;

import org.javai.units.UnitsException;

/**
 * The token sequence violates the unit expression grammar: double division, unbalanced
 * parentheses, an empty term list or a stray character.
 */
public class UnitSyntaxException extends UnitsException {

	public UnitSyntaxException(String message, int offset) {
		super(message, offset);
	}
}

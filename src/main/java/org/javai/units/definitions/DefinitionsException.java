package org.javai.units.definitions;

import org.javai.units.UnitsException;

/**
 * Raised when a definitions table cannot be built (duplicate symbols, malformed
 * source document) or when parsed text names a currency code the table does not list.
 */
public class DefinitionsException extends UnitsException {

	public DefinitionsException(String message) {
		super(message);
	}

	public DefinitionsException(String message, Throwable cause) {
		super(message, cause);
	}

	public DefinitionsException(String message, int offset) {
		super(message, offset);
	}
}

package org.javai.units.conformance;

import org.javai.units.UnitsException;

/**
 * Raised when a conformance fixture or one of its fields is malformed.
 */
public class ConformanceFormatException extends UnitsException {

	public ConformanceFormatException(String message) {
		super(message);
	}

	public ConformanceFormatException(String message, int offset) {
		super(message, offset);
	}

	public ConformanceFormatException(String message, Throwable cause) {
		super(message, cause);
	}
}

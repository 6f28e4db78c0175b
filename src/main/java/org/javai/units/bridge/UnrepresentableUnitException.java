package org.javai.units.bridge;

import org.javai.units.UnitsException;

/**
 * Raised by a {@link NativeUnitBridge} when an expression has no counterpart in
 * the native unit system.
 */
public class UnrepresentableUnitException extends UnitsException {

	public UnrepresentableUnitException(String message) {
		super(message);
	}

	public UnrepresentableUnitException(String message, Throwable cause) {
		super(message, cause);
	}
}

package org.javai.units.bridge;

import java.util.Optional;
import org.javai.units.ast.Expression;

/**
 * Converts parsed expressions into the unit objects of a host library or
 * application.
 *
 * @param <T> the native unit type
 */
public interface NativeUnitBridge<T> {

	/**
	 * Convert an expression to its native counterpart.
	 *
	 * @throws UnrepresentableUnitException if the native system has no equivalent
	 */
	T toNative(Expression expression);

	/**
	 * Convert if possible, returning empty instead of throwing when the expression
	 * has no native equivalent.
	 */
	default Optional<T> tryToNative(Expression expression) {
		try {
			return Optional.of(toNative(expression));
		}
		catch (UnrepresentableUnitException e) {
			return Optional.empty();
		}
	}
}

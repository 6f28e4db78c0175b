package org.javai.units.parse;

import java.util.Objects;
import org.javai.units.ast.Factor;

/**
 * A token of unit expression text.
 *
 * @param type the token type
 * @param factor the factor carried by NUMBER, PREFIXED_UNIT and MARK tokens, otherwise null
 * @param position the offset of the first character of the token in the input
 */
public record UnitToken(TokenType type, Factor factor, int position) {

	public enum TokenType {
		NUMBER,
		PREFIXED_UNIT,
		MARK,
		SLASH,
		LPAREN,
		RPAREN,
		EOF;

		public boolean isFactor() {
			return this == NUMBER || this == PREFIXED_UNIT || this == MARK;
		}
	}

	public UnitToken {
		Objects.requireNonNull(type, "type must not be null");
		if (type.isFactor() != (factor != null)) {
			throw new IllegalArgumentException("Only factor tokens carry a factor: " + type);
		}
	}

	public static UnitToken structural(TokenType type, int position) {
		return new UnitToken(type, null, position);
	}

	public boolean isType(TokenType expectedType) {
		return this.type == expectedType;
	}

	public boolean isFactor() {
		return type.isFactor();
	}

	/**
	 * Equal apart from position.
	 */
	public boolean sameAs(UnitToken other) {
		return other != null && type == other.type && Objects.equals(factor, other.factor);
	}

	@Override
	public String toString() {
		return switch (type) {
			case NUMBER, PREFIXED_UNIT, MARK -> type + "(" + factor.value() + (factor.hasExponent() ? "^" + factor.exponent() : "") + ")";
			default -> type.toString();
		};
	}
}

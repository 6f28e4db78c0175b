package org.javai.units.ast;

import java.math.BigDecimal;
import java.util.List;
import java.util.Objects;
import org.javai.units.definitions.Prefix;
import org.javai.units.definitions.UnitDefinition;

/**
 * A leaf of the expression tree: a number, prefixed unit or mark, optionally
 * raised to an exponent.
 *
 * @param value what is being raised
 * @param exponent the exponent, or null when none was written
 */
public record Factor(FactorValue value, BigDecimal exponent) implements Term {

	public Factor {
		Objects.requireNonNull(value, "value must not be null");
	}

	public static Factor number(BigDecimal value) {
		return new Factor(new FactorValue.NumberValue(value), null);
	}

	public static Factor number(String value) {
		return number(new BigDecimal(value));
	}

	public static Factor unit(UnitDefinition unit) {
		return new Factor(new FactorValue.PrefixedUnit(List.of(), unit), null);
	}

	public static Factor prefixedUnit(List<Prefix> prefixes, UnitDefinition unit) {
		return new Factor(new FactorValue.PrefixedUnit(prefixes, unit), null);
	}

	public static Factor mark(MarkKind kind, String payload) {
		return new Factor(new FactorValue.OtherMark(kind, payload), null);
	}

	public Factor withExponent(BigDecimal exponent) {
		return new Factor(value, exponent);
	}

	public Factor withExponent(long exponent) {
		return withExponent(BigDecimal.valueOf(exponent));
	}

	public boolean hasExponent() {
		return exponent != null;
	}

	@Override
	public <R> R accept(ExpressionVisitor<R> visitor) {
		return visitor.visitFactor(value, exponent);
	}
}

package org.javai.units.ast;

import java.util.List;
import java.util.Objects;

/**
 * A unit expression: numerator terms multiplied together, optionally divided by
 * a single denominator.
 * <p>
 * The denominator is either one {@link Factor} or a parenthesized expression.
 * Each node owns its children exclusively; the tree has no shared subtrees.
 *
 * @param numerator the terms multiplied together, never empty
 * @param denominator the divisor, or null
 */
public record Expression(List<Term> numerator, Term denominator) implements Term {

	public Expression {
		Objects.requireNonNull(numerator, "numerator must not be null");
		if (numerator.isEmpty()) {
			throw new IllegalArgumentException("An expression needs at least one numerator term");
		}
		numerator = List.copyOf(numerator);
	}

	public static Expression of(Term... numerator) {
		return new Expression(List.of(numerator), null);
	}

	public Expression dividedBy(Term divisor) {
		Objects.requireNonNull(divisor, "divisor must not be null");
		if (denominator != null) {
			throw new IllegalStateException("Expression already has a denominator");
		}
		return new Expression(numerator, divisor);
	}

	public boolean hasDenominator() {
		return denominator != null;
	}

	@Override
	public <R> R accept(ExpressionVisitor<R> visitor) {
		return visitor.visitExpression(numerator, denominator);
	}
}

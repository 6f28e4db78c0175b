package org.javai.units.ast;

import java.math.BigDecimal;
import java.util.List;

/**
 * Visitor over unit expression trees, used for rendering, canonicalization and
 * Polish-notation export.
 *
 * @param <R> the result type
 */
public interface ExpressionVisitor<R> {

	/**
	 * @param numerator the multiplied terms, never empty
	 * @param denominator the divisor, or null
	 */
	R visitExpression(List<Term> numerator, Term denominator);

	/**
	 * @param value the number, unit or mark
	 * @param exponent the exponent, or null
	 */
	R visitFactor(FactorValue value, BigDecimal exponent);
}

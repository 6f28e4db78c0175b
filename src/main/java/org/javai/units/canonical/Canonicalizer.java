package org.javai.units.canonical;

import java.math.BigDecimal;
import java.util.List;
import org.javai.units.ast.FactorValue;
import org.javai.units.ast.Term;
import org.javai.units.ast.ExpressionVisitor;

/**
 * Reduces expression trees to {@link CanonicalForm}s.
 * <p>
 * Numerator terms are multiplied together; a denominator is canonicalized on its
 * own and divided out, which negates its atom exponents and inverts its
 * coefficient. Numbers and prefix scales fold into the coefficient; units and
 * marks become atoms keyed by kind and symbol or payload.
 */
public final class Canonicalizer implements ExpressionVisitor<CanonicalForm> {

	private static final Canonicalizer INSTANCE = new Canonicalizer();

	private Canonicalizer() {
	}

	/**
	 * @throws ArithmeticException if the expression divides by zero or raises zero
	 * to a negative power
	 */
	public static CanonicalForm canonicalize(Term term) {
		return term.accept(INSTANCE);
	}

	/**
	 * Re-canonicalize an existing form. Canonical forms are already merged, so this
	 * is a fixed point: the result equals the argument.
	 */
	public static CanonicalForm canonicalize(CanonicalForm form) {
		return new CanonicalForm(form.coefficient(), form.atoms());
	}

	public static boolean equivalent(Term left, Term right) {
		return canonicalize(left).equals(canonicalize(right));
	}

	@Override
	public CanonicalForm visitExpression(List<Term> numerator, Term denominator) {
		CanonicalForm result = CanonicalForm.ONE;
		for (Term term : numerator) {
			result = result.multiply(term.accept(this));
		}
		if (denominator != null) {
			result = result.divide(denominator.accept(this));
		}
		return result;
	}

	@Override
	public CanonicalForm visitFactor(FactorValue value, BigDecimal exponent) {
		CanonicalForm base;
		if (value instanceof FactorValue.NumberValue number) {
			base = CanonicalForm.of(Coefficient.of(Rational.valueOf(number.value())));
		} else if (value instanceof FactorValue.PrefixedUnit unit) {
			base = CanonicalForm.of(Coefficient.powerOfTen(Rational.of(unit.totalScale())))
					.multiply(CanonicalForm.of(unit.atom().orElseThrow()));
		} else {
			base = CanonicalForm.of(value.atom().orElseThrow());
		}
		return exponent == null ? base : base.pow(Rational.valueOf(exponent));
	}
}

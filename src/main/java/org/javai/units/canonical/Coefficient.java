package org.javai.units.canonical;

import java.math.BigInteger;
import java.util.Collections;
import java.util.Map;
import java.util.Objects;
import java.util.SortedMap;
import java.util.StringJoiner;
import java.util.TreeMap;

/**
 * Exact numeric coefficient of a canonical form.
 * <p>
 * The value is an exact {@link Rational} times a product of radical powers
 * {@code base^e} with {@code 0 < e < 1}. Radical bases are primes, or {@code -1}
 * for the sign of a negative number under a fractional exponent: every base is
 * factored before it is recorded, so {@code 100^(1/2)} becomes the exact {@code 10}
 * and {@code 10^(3/2)} becomes {@code 10 * 2^(1/2) * 5^(1/2)}. Integer parts of
 * radical exponents are always folded into the rational part, and a zero
 * coefficient has no radicals, so equal values compare equal.
 * <p>
 * Factors below {@value #TRIAL_DIVISION_LIMIT} are found by trial division. A
 * remainder without such factors is recorded as the smallest integer it is a perfect
 * power of; a remainder made of two or more distinct primes above the limit stays
 * a single base.
 */
public final class Coefficient {

	public static final Coefficient ONE = new Coefficient(Rational.ONE, Collections.emptySortedMap());

	static final int TRIAL_DIVISION_LIMIT = 10_000;

	private static final BigInteger MINUS_ONE = BigInteger.ONE.negate();
	private static final int TRIAL_DIVISION_BITS = BigInteger.valueOf(TRIAL_DIVISION_LIMIT).bitLength() - 1;

	private final Rational rational;
	private final SortedMap<BigInteger, Rational> radicals;

	private Coefficient(Rational rational, SortedMap<BigInteger, Rational> radicals) {
		this.rational = rational;
		this.radicals = radicals;
	}

	public static Coefficient of(Rational rational) {
		return new Coefficient(Objects.requireNonNull(rational, "rational must not be null"), Collections.emptySortedMap());
	}

	/**
	 * {@code 10^exponent}.
	 */
	public static Coefficient powerOfTen(Rational exponent) {
		return of(Rational.of(10)).pow(exponent);
	}

	public Rational rational() {
		return rational;
	}

	public SortedMap<BigInteger, Rational> radicals() {
		return radicals;
	}

	public boolean isExact() {
		return radicals.isEmpty();
	}

	public boolean isOne() {
		return radicals.isEmpty() && rational.equals(Rational.ONE);
	}

	public Coefficient multiply(Coefficient other) {
		if (rational.isZero() || other.rational.isZero()) {
			return of(Rational.ZERO);
		}
		Accumulator acc = new Accumulator(rational.multiply(other.rational));
		radicals.forEach(acc::addRadical);
		other.radicals.forEach(acc::addRadical);
		return acc.build();
	}

	public Coefficient reciprocal() {
		return pow(Rational.MINUS_ONE);
	}

	public Coefficient divide(Coefficient other) {
		return multiply(other.reciprocal());
	}

	/**
	 * Raise to a rational power.
	 *
	 * @throws ArithmeticException for zero to a negative power
	 */
	public Coefficient pow(Rational exponent) {
		if (exponent.isZero()) {
			return ONE;
		}
		if (rational.isZero()) {
			if (exponent.signum() < 0) {
				throw new ArithmeticException("Zero raised to a negative power");
			}
			return this;
		}
		Accumulator acc = new Accumulator(Rational.ONE);
		if (exponent.isInteger()) {
			acc.multiplyExact(rational.pow(exponent.numerator()));
		} else {
			if (rational.signum() < 0) {
				acc.addRadical(MINUS_ONE, exponent);
			}
			acc.addRadical(rational.numerator().abs(), exponent);
			acc.addRadical(rational.denominator(), exponent.negate());
		}
		radicals.forEach((base, e) -> acc.addRadical(base, e.multiply(exponent)));
		return acc.build();
	}

	@Override
	public boolean equals(Object o) {
		if (this == o) {
			return true;
		}
		if (!(o instanceof Coefficient other)) {
			return false;
		}
		return rational.equals(other.rational) && radicals.equals(other.radicals);
	}

	@Override
	public int hashCode() {
		return Objects.hash(rational, radicals);
	}

	@Override
	public String toString() {
		if (radicals.isEmpty()) {
			return rational.toString();
		}
		StringJoiner joiner = new StringJoiner(" * ");
		if (!rational.equals(Rational.ONE)) {
			joiner.add(rational.toString());
		}
		for (Map.Entry<BigInteger, Rational> radical : radicals.entrySet()) {
			joiner.add(radical.getKey() + "^(" + radical.getValue() + ")");
		}
		return joiner.toString();
	}

	/**
	 * Largest integer {@code r} with {@code r^k <= n}, for {@code n > 0} and {@code k >= 2}.
	 */
	static BigInteger integerRoot(BigInteger n, int k) {
		if (k == 2) {
			return n.sqrt();
		}
		BigInteger degree = BigInteger.valueOf(k);
		BigInteger degreeMinusOne = BigInteger.valueOf(k - 1);
		BigInteger x = BigInteger.ONE.shiftLeft(n.bitLength() / k + 1);
		while (true) {
			BigInteger next = degreeMinusOne.multiply(x).add(n.divide(x.pow(k - 1))).divide(degree);
			if (next.compareTo(x) >= 0) {
				return x;
			}
			x = next;
		}
	}

	private static final class Accumulator {
		private Rational exact;
		private final TreeMap<BigInteger, Rational> exponents = new TreeMap<>();

		Accumulator(Rational exact) {
			this.exact = exact;
		}

		void multiplyExact(Rational value) {
			exact = exact.multiply(value);
		}

		void addRadical(BigInteger base, Rational exponent) {
			if (base.equals(BigInteger.ONE) || exponent.isZero()) {
				return;
			}
			if (base.equals(MINUS_ONE)) {
				exponents.merge(MINUS_ONE, exponent, Rational::add);
				return;
			}
			BigInteger rest = base;
			int d = 2;
			while (d < TRIAL_DIVISION_LIMIT && rest.compareTo(BigInteger.ONE) > 0) {
				BigInteger divisor = BigInteger.valueOf(d);
				if (divisor.multiply(divisor).compareTo(rest) > 0) {
					break;
				}
				int multiplicity = 0;
				BigInteger[] division = rest.divideAndRemainder(divisor);
				while (division[1].signum() == 0) {
					rest = division[0];
					multiplicity++;
					division = rest.divideAndRemainder(divisor);
				}
				if (multiplicity > 0) {
					exponents.merge(divisor, exponent.multiply(Rational.of(multiplicity)), Rational::add);
				}
				d = d == 2 ? 3 : d + 2;
			}
			if (rest.compareTo(BigInteger.ONE) > 0) {
				addRemainder(rest, exponent);
			}
		}

		// rest has no factor below the trial division limit, so a k-th root of it is at least that large
		private void addRemainder(BigInteger rest, Rational exponent) {
			for (int k = rest.bitLength() / TRIAL_DIVISION_BITS; k >= 2; k--) {
				BigInteger root = integerRoot(rest, k);
				if (root.pow(k).equals(rest)) {
					exponents.merge(root, exponent.multiply(Rational.of(k)), Rational::add);
					return;
				}
			}
			exponents.merge(rest, exponent, Rational::add);
		}

		Coefficient build() {
			TreeMap<BigInteger, Rational> folded = new TreeMap<>();
			for (Map.Entry<BigInteger, Rational> entry : exponents.entrySet()) {
				BigInteger base = entry.getKey();
				Rational exponent = entry.getValue();
				BigInteger whole = exponent.floor();
				if (whole.signum() != 0) {
					exact = exact.multiply(Rational.of(base, BigInteger.ONE).pow(whole));
				}
				Rational fraction = exponent.fractionalPart();
				if (!fraction.isZero()) {
					folded.put(base, fraction);
				}
			}
			if (exact.isZero()) {
				return of(Rational.ZERO);
			}
			return new Coefficient(exact, Collections.unmodifiableSortedMap(folded));
		}
	}
}

package org.javai.units.canonical;

import java.math.BigDecimal;
import java.math.BigInteger;
import java.math.MathContext;
import java.util.Objects;

/**
 * Exact rational number, always held in lowest terms with a positive denominator.
 * Used for canonical exponents and for the exact part of canonical coefficients.
 */
public final class Rational implements Comparable<Rational> {

	/** Largest decimal scale or integer power accepted, keeping arithmetic bounded. */
	public static final int MAX_MAGNITUDE = 10_000;

	public static final Rational ZERO = new Rational(BigInteger.ZERO, BigInteger.ONE);
	public static final Rational ONE = new Rational(BigInteger.ONE, BigInteger.ONE);
	public static final Rational MINUS_ONE = new Rational(BigInteger.ONE.negate(), BigInteger.ONE);

	private final BigInteger numerator;
	private final BigInteger denominator;

	private Rational(BigInteger numerator, BigInteger denominator) {
		this.numerator = numerator;
		this.denominator = denominator;
	}

	public static Rational of(long value) {
		return of(BigInteger.valueOf(value), BigInteger.ONE);
	}

	public static Rational of(long numerator, long denominator) {
		return of(BigInteger.valueOf(numerator), BigInteger.valueOf(denominator));
	}

	public static Rational of(BigInteger numerator, BigInteger denominator) {
		Objects.requireNonNull(numerator, "numerator must not be null");
		Objects.requireNonNull(denominator, "denominator must not be null");
		if (denominator.signum() == 0) {
			throw new ArithmeticException("Division by zero");
		}
		if (numerator.signum() == 0) {
			return ZERO;
		}
		if (denominator.signum() < 0) {
			numerator = numerator.negate();
			denominator = denominator.negate();
		}
		BigInteger gcd = numerator.gcd(denominator);
		return new Rational(numerator.divide(gcd), denominator.divide(gcd));
	}

	/**
	 * The exact value of a decimal.
	 *
	 * @throws ArithmeticException if the decimal exponent exceeds {@link #MAX_MAGNITUDE}
	 */
	public static Rational valueOf(BigDecimal value) {
		Objects.requireNonNull(value, "value must not be null");
		int scale = value.scale();
		if (Math.abs((long) scale) > MAX_MAGNITUDE) {
			throw new ArithmeticException("Decimal exponent out of range: " + value);
		}
		if (scale >= 0) {
			return of(value.unscaledValue(), BigInteger.TEN.pow(scale));
		}
		return of(value.unscaledValue().multiply(BigInteger.TEN.pow(-scale)), BigInteger.ONE);
	}

	public BigInteger numerator() {
		return numerator;
	}

	public BigInteger denominator() {
		return denominator;
	}

	public int signum() {
		return numerator.signum();
	}

	public boolean isZero() {
		return numerator.signum() == 0;
	}

	public boolean isInteger() {
		return denominator.equals(BigInteger.ONE);
	}

	public Rational add(Rational other) {
		return of(numerator.multiply(other.denominator).add(other.numerator.multiply(denominator)),
				denominator.multiply(other.denominator));
	}

	public Rational subtract(Rational other) {
		return add(other.negate());
	}

	public Rational multiply(Rational other) {
		return of(numerator.multiply(other.numerator), denominator.multiply(other.denominator));
	}

	public Rational divide(Rational other) {
		if (other.isZero()) {
			throw new ArithmeticException("Division by zero");
		}
		return of(numerator.multiply(other.denominator), denominator.multiply(other.numerator));
	}

	public Rational negate() {
		return new Rational(numerator.negate(), denominator);
	}

	public Rational abs() {
		return signum() < 0 ? negate() : this;
	}

	/**
	 * Largest integer not greater than this value.
	 */
	public BigInteger floor() {
		BigInteger[] qr = numerator.divideAndRemainder(denominator);
		return numerator.signum() < 0 && qr[1].signum() != 0 ? qr[0].subtract(BigInteger.ONE) : qr[0];
	}

	/**
	 * This value minus its floor, in {@code [0, 1)}.
	 */
	public Rational fractionalPart() {
		return subtract(of(floor(), BigInteger.ONE));
	}

	/**
	 * Integer power; negative powers invert.
	 *
	 * @throws ArithmeticException for zero to a negative power or a power beyond {@link #MAX_MAGNITUDE}
	 */
	public Rational pow(BigInteger exponent) {
		if (exponent.abs().compareTo(BigInteger.valueOf(MAX_MAGNITUDE)) > 0) {
			throw new ArithmeticException("Exponent out of range: " + exponent);
		}
		int n = exponent.intValue();
		if (n >= 0) {
			return of(numerator.pow(n), denominator.pow(n));
		}
		if (isZero()) {
			throw new ArithmeticException("Zero raised to a negative power");
		}
		return of(denominator.pow(-n), numerator.pow(-n));
	}

	public Rational pow(int exponent) {
		return pow(BigInteger.valueOf(exponent));
	}

	public BigDecimal toBigDecimal(MathContext context) {
		return new BigDecimal(numerator).divide(new BigDecimal(denominator), context);
	}

	@Override
	public int compareTo(Rational other) {
		return numerator.multiply(other.denominator).compareTo(other.numerator.multiply(denominator));
	}

	@Override
	public boolean equals(Object o) {
		if (this == o) {
			return true;
		}
		if (!(o instanceof Rational other)) {
			return false;
		}
		return numerator.equals(other.numerator) && denominator.equals(other.denominator);
	}

	@Override
	public int hashCode() {
		return Objects.hash(numerator, denominator);
	}

	@Override
	public String toString() {
		return isInteger() ? numerator.toString() : numerator + "/" + denominator;
	}
}

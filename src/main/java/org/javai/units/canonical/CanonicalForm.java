package org.javai.units.canonical;

import java.util.Collections;
import java.util.Map;
import java.util.Objects;
import java.util.SortedMap;
import java.util.StringJoiner;
import java.util.TreeMap;
import org.javai.units.ast.Atom;

/**
 * The fully merged meaning of a unit expression: a numeric coefficient and the
 * combined exponent of every atom. Atoms whose exponents cancel are dropped, so
 * two expressions are equivalent exactly when their canonical forms are equal.
 *
 * @param coefficient the product of all numbers and prefix scales
 * @param atoms atom to non-zero exponent, sorted by kind then symbol
 */
public record CanonicalForm(Coefficient coefficient, SortedMap<Atom, Rational> atoms) {

	public static final CanonicalForm ONE = new CanonicalForm(Coefficient.ONE, Collections.emptySortedMap());

	public CanonicalForm {
		Objects.requireNonNull(coefficient, "coefficient must not be null");
		Objects.requireNonNull(atoms, "atoms must not be null");
		TreeMap<Atom, Rational> kept = new TreeMap<>();
		atoms.forEach((atom, exponent) -> {
			if (!exponent.isZero()) {
				kept.put(atom, exponent);
			}
		});
		atoms = Collections.unmodifiableSortedMap(kept);
	}

	public static CanonicalForm of(Coefficient coefficient) {
		return new CanonicalForm(coefficient, Collections.emptySortedMap());
	}

	public static CanonicalForm of(Atom atom) {
		TreeMap<Atom, Rational> atoms = new TreeMap<>();
		atoms.put(atom, Rational.ONE);
		return new CanonicalForm(Coefficient.ONE, atoms);
	}

	public CanonicalForm multiply(CanonicalForm other) {
		TreeMap<Atom, Rational> merged = new TreeMap<>(atoms);
		other.atoms.forEach((atom, exponent) -> merged.merge(atom, exponent, Rational::add));
		return new CanonicalForm(coefficient.multiply(other.coefficient), merged);
	}

	public CanonicalForm divide(CanonicalForm other) {
		return multiply(other.pow(Rational.MINUS_ONE));
	}

	public CanonicalForm pow(Rational exponent) {
		TreeMap<Atom, Rational> raised = new TreeMap<>();
		atoms.forEach((atom, e) -> raised.put(atom, e.multiply(exponent)));
		return new CanonicalForm(coefficient.pow(exponent), raised);
	}

	/**
	 * Exponent of {@code atom}, zero when absent.
	 */
	public Rational exponentOf(Atom atom) {
		return atoms.getOrDefault(atom, Rational.ZERO);
	}

	public boolean hasNoAtoms() {
		return atoms.isEmpty();
	}

	@Override
	public String toString() {
		StringJoiner joiner = new StringJoiner(" ");
		if (!coefficient.isOne() || atoms.isEmpty()) {
			joiner.add(coefficient.toString());
		}
		for (Map.Entry<Atom, Rational> entry : atoms.entrySet()) {
			Rational exponent = entry.getValue();
			joiner.add(exponent.equals(Rational.ONE)
					? entry.getKey().toString()
					: entry.getKey() + "^" + (exponent.isInteger() ? exponent.toString() : "(" + exponent + ")"));
		}
		return joiner.toString();
	}
}

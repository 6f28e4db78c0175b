package org.javai.units.ast;

import java.util.ArrayList;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;
import java.util.function.Consumer;

/**
 * Traversal helpers for expression trees.
 */
public final class ExpressionWalker {

	private ExpressionWalker() {
		// Utility class - no instantiation
	}

	/**
	 * Visit every factor in source order: numerator terms left to right, then the
	 * denominator.
	 */
	public static void forEachFactor(Term term, Consumer<Factor> action) {
		if (term instanceof Factor factor) {
			action.accept(factor);
		} else if (term instanceof Expression expression) {
			for (Term child : expression.numerator()) {
				forEachFactor(child, action);
			}
			if (expression.denominator() != null) {
				forEachFactor(expression.denominator(), action);
			}
		}
	}

	public static List<Factor> factors(Term term) {
		List<Factor> factors = new ArrayList<>();
		forEachFactor(term, factors::add);
		return factors;
	}

	/**
	 * Distinct atoms in order of first appearance.
	 */
	public static Set<Atom> atoms(Term term) {
		Set<Atom> atoms = new LinkedHashSet<>();
		forEachFactor(term, f -> f.value().atom().ifPresent(atoms::add));
		return atoms;
	}

	/**
	 * Depth of parenthesized nesting; a flat expression has depth 1.
	 */
	public static int depth(Term term) {
		if (term instanceof Expression expression) {
			int deepest = 0;
			for (Term child : expression.numerator()) {
				deepest = Math.max(deepest, depth(child));
			}
			if (expression.denominator() != null) {
				deepest = Math.max(deepest, depth(expression.denominator()));
			}
			return deepest + 1;
		}
		return 0;
	}
}

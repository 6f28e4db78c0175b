package org.javai.units.ast;

import java.util.Comparator;
import java.util.Objects;

/**
 * Identity of a non-numeric factor as seen by canonicalization and by bridges
 * into native unit systems: its kind and its symbol or payload.
 */
public record Atom(AtomKind kind, String symbol) implements Comparable<Atom> {

	private static final Comparator<Atom> ORDER = Comparator.comparing(Atom::kind).thenComparing(Atom::symbol);

	public Atom {
		Objects.requireNonNull(kind, "kind must not be null");
		Objects.requireNonNull(symbol, "symbol must not be null");
	}

	public static Atom unit(String symbol) {
		return new Atom(AtomKind.UNIT, symbol);
	}

	@Override
	public int compareTo(Atom other) {
		return ORDER.compare(this, other);
	}

	@Override
	public String toString() {
		return switch (kind) {
			case UNIT -> symbol;
			case CHEMICAL -> MarkKind.CHEMICAL.render(symbol);
			case CURRENCY -> MarkKind.CURRENCY.render(symbol);
			case USER -> MarkKind.USER.render(symbol);
		};
	}
}

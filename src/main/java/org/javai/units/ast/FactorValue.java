package org.javai.units.ast;

import java.math.BigDecimal;
import java.util.List;
import java.util.Objects;
import java.util.Optional;
import org.javai.units.definitions.Prefix;
import org.javai.units.definitions.UnitDefinition;

/**
 * The thing a {@link Factor} raises to its exponent.
 */
public sealed interface FactorValue {

	/**
	 * The atom this value contributes to a canonical form. Numbers have none.
	 */
	Optional<Atom> atom();

	/**
	 * A bare decimal number.
	 */
	record NumberValue(BigDecimal value) implements FactorValue {
		public NumberValue {
			Objects.requireNonNull(value, "value must not be null");
		}

		@Override
		public Optional<Atom> atom() {
			return Optional.empty();
		}
	}

	/**
	 * A unit with zero or more prefixes, outermost first.
	 */
	record PrefixedUnit(List<Prefix> prefixes, UnitDefinition unit) implements FactorValue {
		public PrefixedUnit {
			prefixes = prefixes != null ? List.copyOf(prefixes) : List.of();
			Objects.requireNonNull(unit, "unit must not be null");
		}

		public int totalScale() {
			return prefixes.stream().mapToInt(Prefix::scale).sum();
		}

		/**
		 * The symbol as written: prefix symbols followed by the unit symbol.
		 */
		public String symbol() {
			StringBuilder sb = new StringBuilder();
			prefixes.forEach(p -> sb.append(p.symbol()));
			return sb.append(unit.symbol()).toString();
		}

		@Override
		public Optional<Atom> atom() {
			return Optional.of(new Atom(AtomKind.UNIT, unit.symbol()));
		}
	}

	/**
	 * A braced extension atom. The payload excludes the kind tag, so
	 * {@code {chem: CO2}} carries payload {@code CO2}.
	 */
	record OtherMark(MarkKind kind, String payload) implements FactorValue {
		public OtherMark {
			Objects.requireNonNull(kind, "kind must not be null");
			Objects.requireNonNull(payload, "payload must not be null");
		}

		@Override
		public Optional<Atom> atom() {
			return Optional.of(new Atom(kind.atomKind(), payload));
		}
	}
}

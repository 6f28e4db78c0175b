package org.javai.units.definitions;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.List;
import java.util.Objects;
import java.util.Optional;

/**
 * Splits a run of symbol characters into prefixes and a unit.
 * <p>
 * Resolution is an explicit first-match-wins scan over the table lists:
 * <ol>
 *   <li>If the whole symbol is a listed unit, that unit wins with no prefix.</li>
 *   <li>Otherwise units are tried in table order; a unit matches when the symbol
 *   ends with it and the remainder decomposes into listed prefixes. The first
 *   matching unit wins, regardless of how long its prefix part is.</li>
 *   <li>If nothing matches the symbol is unresolved.</li>
 * </ol>
 * The prefix part is decomposed left to right trying prefixes in table order,
 * backtracking only when a choice leaves an undecomposable remainder.
 */
public final class SymbolResolver {

	private final DefinitionsTable table;
	private final boolean allowCompoundPrefixes;

	public SymbolResolver(DefinitionsTable table, boolean allowCompoundPrefixes) {
		this.table = Objects.requireNonNull(table, "table must not be null");
		this.allowCompoundPrefixes = allowCompoundPrefixes;
	}

	public SymbolResolver(DefinitionsTable table) {
		this(table, true);
	}

	public Optional<ResolvedSymbol> resolve(String symbol) {
		if (symbol == null || symbol.isEmpty()) {
			return Optional.empty();
		}
		List<UnitDefinition> candidates = table.unitsEndingWith(symbol);
		for (UnitDefinition unit : candidates) {
			if (unit.symbol().length() == symbol.length()) {
				return Optional.of(new ResolvedSymbol(List.of(), unit));
			}
		}
		for (UnitDefinition unit : candidates) {
			String prefixPart = symbol.substring(0, symbol.length() - unit.symbol().length());
			Optional<List<Prefix>> prefixes = decompose(prefixPart);
			if (prefixes.isPresent()) {
				return Optional.of(new ResolvedSymbol(prefixes.get(), unit));
			}
		}
		return Optional.empty();
	}

	/**
	 * Decompose {@code text} into one or more prefixes, or empty if impossible.
	 */
	Optional<List<Prefix>> decompose(String text) {
		Deque<Prefix> chosen = new ArrayDeque<>();
		if (decompose(text, 0, chosen)) {
			return Optional.of(new ArrayList<>(chosen));
		}
		return Optional.empty();
	}

	private boolean decompose(String text, int from, Deque<Prefix> chosen) {
		if (from == text.length()) {
			return !chosen.isEmpty();
		}
		if (!allowCompoundPrefixes && !chosen.isEmpty()) {
			return false;
		}
		for (Prefix prefix : table.prefixesAt(text, from)) {
			chosen.addLast(prefix);
			if (decompose(text, from + prefix.symbol().length(), chosen)) {
				return true;
			}
			chosen.removeLast();
		}
		return false;
	}
}

package org.javai.units.definitions;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.Set;

/**
 * Immutable, ordered catalogue of prefixes, units and currency codes.
 * <p>
 * List order is priority order: whenever the tokenizer finds more than one way
 * to read a symbol, the entry listed first wins. A table is validated in full
 * before it is created, so a failed build never yields a partial table. Instances
 * are safe for unlimited concurrent reads.
 *
 * <pre>{@code
 * DefinitionsTable table = DefinitionsTable.builder()
 *         .prefix("k", 3)
 *         .unit("kg")
 *         .unit("g")
 *         .currency("USD")
 *         .build();
 * }</pre>
 */
public final class DefinitionsTable {

	/** Characters that delimit factors or belong to numbers and may never appear in a symbol. */
	static final String RESERVED_CHARACTERS = "/(){}^-.0123456789";

	private final List<Prefix> prefixes;
	private final List<UnitDefinition> units;
	private final List<CurrencyCode> currencies;
	private final Map<String, Prefix> prefixesBySymbol;
	private final Map<String, UnitDefinition> unitsBySymbol;
	private final Set<String> currencyCodes;
	private final Set<Character> extraSymbolCharacters;

	private DefinitionsTable(List<Prefix> prefixes, List<UnitDefinition> units, List<CurrencyCode> currencies) {
		this.prefixes = List.copyOf(prefixes);
		this.units = List.copyOf(units);
		this.currencies = List.copyOf(currencies);
		this.prefixesBySymbol = indexPrefixes(this.prefixes);
		this.unitsBySymbol = indexUnits(this.units);
		this.currencyCodes = indexCurrencies(this.currencies);
		this.extraSymbolCharacters = collectSymbolCharacters(this.prefixes, this.units);
	}

	/**
	 * Build a table from ordered lists.
	 *
	 * @throws DefinitionsException if any list contains the same symbol twice or a
	 * symbol uses a reserved character
	 */
	public static DefinitionsTable of(List<Prefix> prefixes, List<UnitDefinition> units, List<CurrencyCode> currencies) {
		Objects.requireNonNull(prefixes, "prefixes must not be null");
		Objects.requireNonNull(units, "units must not be null");
		Objects.requireNonNull(currencies, "currencies must not be null");
		return new DefinitionsTable(prefixes, units, currencies);
	}

	public static DefinitionsTable empty() {
		return new DefinitionsTable(List.of(), List.of(), List.of());
	}

	public static Builder builder() {
		return new Builder();
	}

	/**
	 * Append the entries of {@code extension} after this table's entries. The
	 * receiver keeps priority over the extension.
	 *
	 * @throws DefinitionsException if the extension redefines a symbol already listed here
	 */
	public DefinitionsTable merge(DefinitionsTable extension) {
		Objects.requireNonNull(extension, "extension must not be null");
		List<Prefix> mergedPrefixes = new ArrayList<>(prefixes);
		mergedPrefixes.addAll(extension.prefixes);
		List<UnitDefinition> mergedUnits = new ArrayList<>(units);
		mergedUnits.addAll(extension.units);
		List<CurrencyCode> mergedCurrencies = new ArrayList<>(currencies);
		mergedCurrencies.addAll(extension.currencies);
		return new DefinitionsTable(mergedPrefixes, mergedUnits, mergedCurrencies);
	}

	public Optional<UnitDefinition> lookupUnit(String symbol) {
		return Optional.ofNullable(unitsBySymbol.get(symbol));
	}

	public Optional<Prefix> lookupPrefix(String symbol) {
		return Optional.ofNullable(prefixesBySymbol.get(symbol));
	}

	public boolean isCurrencyCode(String symbol) {
		return currencyCodes.contains(symbol);
	}

	/**
	 * Units whose symbol is a suffix of {@code text}, in table order.
	 */
	public List<UnitDefinition> unitsEndingWith(String text) {
		List<UnitDefinition> matches = new ArrayList<>();
		for (UnitDefinition unit : units) {
			if (text.endsWith(unit.symbol())) {
				matches.add(unit);
			}
		}
		return matches;
	}

	/**
	 * Prefixes that occur in {@code text} starting at {@code from}, in table order.
	 */
	public List<Prefix> prefixesAt(String text, int from) {
		List<Prefix> matches = new ArrayList<>();
		for (Prefix prefix : prefixes) {
			if (text.startsWith(prefix.symbol(), from)) {
				matches.add(prefix);
			}
		}
		return matches;
	}

	/**
	 * Whether {@code c} may appear inside a prefix or unit symbol. Letters always
	 * may; other characters only when some listed symbol uses them.
	 */
	public boolean isSymbolCharacter(char c) {
		if (Character.isWhitespace(c) || RESERVED_CHARACTERS.indexOf(c) >= 0) {
			return false;
		}
		return Character.isLetter(c) || extraSymbolCharacters.contains(c);
	}

	public List<Prefix> prefixes() {
		return prefixes;
	}

	public List<UnitDefinition> units() {
		return units;
	}

	public List<CurrencyCode> currencies() {
		return currencies;
	}

	@Override
	public String toString() {
		return "DefinitionsTable[prefixes=" + prefixes.size() + ", units=" + units.size()
				+ ", currencies=" + currencies.size() + "]";
	}

	private static Map<String, Prefix> indexPrefixes(List<Prefix> prefixes) {
		Map<String, Prefix> index = new LinkedHashMap<>();
		for (Prefix prefix : prefixes) {
			checkSymbol("prefix", prefix.symbol());
			if (index.putIfAbsent(prefix.symbol(), prefix) != null) {
				throw new DefinitionsException("Duplicate prefix definition: " + prefix.symbol());
			}
		}
		return Collections.unmodifiableMap(index);
	}

	private static Map<String, UnitDefinition> indexUnits(List<UnitDefinition> units) {
		Map<String, UnitDefinition> index = new LinkedHashMap<>();
		for (UnitDefinition unit : units) {
			checkSymbol("unit", unit.symbol());
			if (index.putIfAbsent(unit.symbol(), unit) != null) {
				throw new DefinitionsException("Duplicate unit definition: " + unit.symbol());
			}
		}
		return Collections.unmodifiableMap(index);
	}

	private static Set<String> indexCurrencies(List<CurrencyCode> currencies) {
		Set<String> index = new LinkedHashSet<>();
		for (CurrencyCode currency : currencies) {
			if (!index.add(currency.code())) {
				throw new DefinitionsException("Duplicate currency code: " + currency.code());
			}
		}
		return Collections.unmodifiableSet(index);
	}

	private static void checkSymbol(String role, String symbol) {
		for (int i = 0; i < symbol.length(); i++) {
			char c = symbol.charAt(i);
			if (Character.isWhitespace(c) || RESERVED_CHARACTERS.indexOf(c) >= 0) {
				throw new DefinitionsException("The " + role + " symbol '" + symbol
						+ "' contains the reserved character '" + c + "'");
			}
		}
	}

	private static Set<Character> collectSymbolCharacters(List<Prefix> prefixes, List<UnitDefinition> units) {
		Set<Character> chars = new LinkedHashSet<>();
		prefixes.forEach(p -> addNonLetters(p.symbol(), chars));
		units.forEach(u -> addNonLetters(u.symbol(), chars));
		return Collections.unmodifiableSet(chars);
	}

	private static void addNonLetters(String symbol, Set<Character> chars) {
		for (int i = 0; i < symbol.length(); i++) {
			char c = symbol.charAt(i);
			if (!Character.isLetter(c)) {
				chars.add(c);
			}
		}
	}

	/**
	 * Collects entries in priority order. Validation happens in {@link #build()}.
	 */
	public static final class Builder {
		private final List<Prefix> prefixes = new ArrayList<>();
		private final List<UnitDefinition> units = new ArrayList<>();
		private final List<CurrencyCode> currencies = new ArrayList<>();

		private Builder() {}

		public Builder prefix(String symbol, int scale) {
			prefixes.add(new Prefix(symbol, scale));
			return this;
		}

		public Builder prefix(Prefix prefix) {
			prefixes.add(Objects.requireNonNull(prefix, "prefix must not be null"));
			return this;
		}

		public Builder unit(String symbol) {
			units.add(new UnitDefinition(symbol));
			return this;
		}

		public Builder unit(UnitDefinition unit) {
			units.add(Objects.requireNonNull(unit, "unit must not be null"));
			return this;
		}

		public Builder currency(String code) {
			currencies.add(new CurrencyCode(code));
			return this;
		}

		public DefinitionsTable build() {
			return new DefinitionsTable(prefixes, units, currencies);
		}
	}
}

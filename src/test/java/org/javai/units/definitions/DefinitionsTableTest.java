package org.javai.units.definitions;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import java.util.List;
import org.junit.jupiter.api.Test;

class DefinitionsTableTest {

	private final DefinitionsTable table = DefinitionsTable.builder()
			.prefix("k", 3)
			.prefix("m", -3)
			.unit("kg")
			.unit("m")
			.unit("g")
			.currency("USD")
			.build();

	@Test
	void looksUpEntriesBySymbol() {
		assertThat(table.lookupUnit("kg")).map(UnitDefinition::symbol).contains("kg");
		assertThat(table.lookupUnit("lb")).isEmpty();
		assertThat(table.lookupPrefix("k")).map(Prefix::scale).contains(3);
		assertThat(table.isCurrencyCode("USD")).isTrue();
		assertThat(table.isCurrencyCode("EUR")).isFalse();
	}

	@Test
	void scansKeepTableOrder() {
		assertThat(table.unitsEndingWith("kg")).extracting(UnitDefinition::symbol).containsExactly("kg", "g");
		assertThat(table.prefixesAt("mkg", 0)).extracting(Prefix::symbol).containsExactly("m");
		assertThat(table.prefixesAt("mkg", 1)).extracting(Prefix::symbol).containsExactly("k");
	}

	@Test
	void rejectsDuplicateSymbols() {
		assertThatThrownBy(() -> DefinitionsTable.builder().unit("m").unit("m").build())
				.isInstanceOf(DefinitionsException.class)
				.hasMessageContaining("Duplicate unit definition: m");
		assertThatThrownBy(() -> DefinitionsTable.builder().prefix("k", 3).prefix("k", 4).build())
				.isInstanceOf(DefinitionsException.class)
				.hasMessageContaining("Duplicate prefix");
		assertThatThrownBy(() -> DefinitionsTable.builder().currency("USD").currency("USD").build())
				.isInstanceOf(DefinitionsException.class)
				.hasMessageContaining("Duplicate currency code");
	}

	@Test
	void sameSymbolMayBeBothPrefixAndUnit() {
		assertThat(table.lookupPrefix("m")).isPresent();
		assertThat(table.lookupUnit("m")).isPresent();
	}

	@Test
	void rejectsReservedCharactersInSymbols() {
		assertThatThrownBy(() -> DefinitionsTable.builder().unit("m2").build())
				.isInstanceOf(DefinitionsException.class)
				.hasMessageContaining("reserved character '2'");
		assertThatThrownBy(() -> DefinitionsTable.builder().unit("m/s").build())
				.isInstanceOf(DefinitionsException.class);
		assertThatThrownBy(() -> DefinitionsTable.builder().prefix("k k", 3).build())
				.isInstanceOf(DefinitionsException.class);
	}

	@Test
	void nonLetterSymbolCharactersComeFromTheTable() {
		DefinitionsTable withPercent = DefinitionsTable.builder().unit("%").build();

		assertThat(withPercent.isSymbolCharacter('%')).isTrue();
		assertThat(table.isSymbolCharacter('%')).isFalse();
		assertThat(table.isSymbolCharacter('x')).isTrue();
		assertThat(table.isSymbolCharacter('^')).isFalse();
		assertThat(table.isSymbolCharacter(' ')).isFalse();
	}

	@Test
	void mergeAppendsExtensionAfterReceiver() {
		DefinitionsTable extension = DefinitionsTable.builder().unit("lb").currency("EUR").build();

		DefinitionsTable merged = table.merge(extension);

		assertThat(merged.units()).extracting(UnitDefinition::symbol).containsExactly("kg", "m", "g", "lb");
		assertThat(merged.isCurrencyCode("EUR")).isTrue();
		assertThat(table.lookupUnit("lb")).isEmpty();
	}

	@Test
	void mergeRejectsRedefinitions() {
		DefinitionsTable extension = DefinitionsTable.builder().unit("g").build();

		assertThatThrownBy(() -> table.merge(extension))
				.isInstanceOf(DefinitionsException.class)
				.hasMessageContaining("g");
	}

	@Test
	void listsAreImmutable() {
		assertThatThrownBy(() -> table.units().add(new UnitDefinition("x")))
				.isInstanceOf(UnsupportedOperationException.class);
	}

	@Test
	void emptyTableHasNoEntries() {
		DefinitionsTable empty = DefinitionsTable.empty();

		assertThat(empty.prefixes()).isEmpty();
		assertThat(empty.units()).isEmpty();
		assertThat(empty.currencies()).isEmpty();
		assertThat(DefinitionsTable.of(List.of(), List.of(), List.of()).toString())
				.isEqualTo("DefinitionsTable[prefixes=0, units=0, currencies=0]");
	}

	@Test
	void currencyCodesNeedThreeUpperCaseLetters() {
		assertThatThrownBy(() -> new CurrencyCode("usd")).isInstanceOf(IllegalArgumentException.class);
		assertThat(CurrencyCode.hasCurrencyShape("EUR")).isTrue();
		assertThat(CurrencyCode.hasCurrencyShape("EURO")).isFalse();
	}
}

package org.javai.units.parse;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import java.math.BigDecimal;
import java.util.List;
import org.javai.units.UnitsException;
import org.javai.units.ast.FactorValue;
import org.javai.units.ast.MarkKind;
import org.javai.units.definitions.DefinitionsException;
import org.javai.units.definitions.DefinitionsRegistry;
import org.javai.units.definitions.DefinitionsTable;
import org.javai.units.definitions.Prefix;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

/**
 * Tests for the unit text tokenizer. The tokenizer only splits text into numbers,
 * prefixed units, marks and structural tokens; grouping is left to the parser.
 */
class UnitTokenizerTest {

	private static final DefinitionsTable TABLE = DefinitionsRegistry.bundled();

	private static List<UnitToken> tokenize(String input) {
		return new UnitTokenizer(input, TABLE).tokenize();
	}

	private static List<UnitToken> tokenizeLegacy(String input) {
		TokenizerOptions legacy = TokenizerOptions.builder().legacyDigitExponents(true).build();
		return new UnitTokenizer(input, TABLE, legacy).tokenize();
	}

	private static List<UnitToken.TokenType> types(List<UnitToken> tokens) {
		return tokens.stream().map(UnitToken::type).toList();
	}

	@Test
	void emptyInputYieldsOnlyEof() {
		List<UnitToken> tokens = tokenize("   ");

		assertThat(types(tokens)).containsExactly(UnitToken.TokenType.EOF);
		assertThat(tokens.get(0).position()).isEqualTo(3);
	}

	@Test
	void structuralTokensCarryPositions() {
		List<UnitToken> tokens = tokenize("W/(m K)");

		assertThat(types(tokens)).containsExactly(
				UnitToken.TokenType.PREFIXED_UNIT,
				UnitToken.TokenType.SLASH,
				UnitToken.TokenType.LPAREN,
				UnitToken.TokenType.PREFIXED_UNIT,
				UnitToken.TokenType.PREFIXED_UNIT,
				UnitToken.TokenType.RPAREN,
				UnitToken.TokenType.EOF);
		assertThat(tokens).extracting(UnitToken::position).containsExactly(0, 1, 2, 3, 5, 6, 7);
	}

	@Test
	void whitespaceBetweenFactorsIsOptional() {
		List<UnitToken> spaced = tokenize("3 m");
		List<UnitToken> joined = tokenize("3m");

		assertThat(types(joined)).isEqualTo(types(spaced));
		assertThat(joined.get(1).sameAs(spaced.get(1))).isTrue();
	}

	@Nested
	class Numbers {

		@Test
		void readsSignedDecimalsWithExponents() {
			assertThat(numberOf("42")).isEqualByComparingTo("42");
			assertThat(numberOf("-0.25")).isEqualByComparingTo("-0.25");
			assertThat(numberOf("1.5e3")).isEqualByComparingTo("1500");
			assertThat(numberOf("1E-3")).isEqualByComparingTo("0.001");
		}

		@Test
		void letterEAfterANumberMayStartAUnit() {
			List<UnitToken> tokens = tokenize("2eV");

			assertThat(types(tokens)).containsExactly(
					UnitToken.TokenType.NUMBER, UnitToken.TokenType.PREFIXED_UNIT, UnitToken.TokenType.EOF);
			assertThat(((FactorValue.PrefixedUnit) tokens.get(1).factor().value()).symbol()).isEqualTo("eV");
		}

		@Test
		void rejectsMalformedNumbers() {
			assertThatThrownBy(() -> tokenize("-"))
					.isInstanceOf(MalformedNumberException.class)
					.satisfies(e -> assertThat(((UnitsException) e).offset()).isEqualTo(1));
			assertThatThrownBy(() -> tokenize("-m")).isInstanceOf(MalformedNumberException.class);
			assertThatThrownBy(() -> tokenize("1e-"))
					.isInstanceOf(MalformedNumberException.class)
					.hasMessageContaining("Digit expected in exponent");
			assertThatThrownBy(() -> tokenize("1.2.3"))
					.isInstanceOf(MalformedNumberException.class)
					.hasMessage("Unexpected '.' in number at offset 3");
		}

		@Test
		void rejectsNumbersBeyondDecimalRange() {
			assertThatThrownBy(() -> tokenize("1e99999999999 m"))
					.isInstanceOf(MalformedNumberException.class)
					.hasMessage("Number out of range: 1e99999999999 at offset 0")
					.hasCauseInstanceOf(NumberFormatException.class);
			assertThatThrownBy(() -> tokenize("m 2e-99999999999"))
					.isInstanceOf(MalformedNumberException.class)
					.satisfies(e -> assertThat(((UnitsException) e).offset()).isEqualTo(2));
		}

		private BigDecimal numberOf(String input) {
			UnitToken token = tokenize(input).get(0);
			assertThat(token.type()).isEqualTo(UnitToken.TokenType.NUMBER);
			return ((FactorValue.NumberValue) token.factor().value()).value();
		}
	}

	@Nested
	class Units {

		@Test
		void resolvesPrefixesAndUnits() {
			FactorValue.PrefixedUnit km = unitOf("km");

			assertThat(km.prefixes()).extracting(Prefix::symbol).containsExactly("k");
			assertThat(km.unit().symbol()).isEqualTo("m");
		}

		@Test
		void readsNonLetterSymbolsFromTheTable() {
			assertThat(unitOf("°C").unit().symbol()).isEqualTo("°C");
			assertThat(unitOf("%").unit().symbol()).isEqualTo("%");
		}

		@Test
		void reportsUnrecognizedSymbolsWithOffset() {
			assertThatThrownBy(() -> tokenize("m furlong"))
					.isInstanceOf(UnrecognizedUnitException.class)
					.satisfies(e -> {
						UnrecognizedUnitException unrecognized = (UnrecognizedUnitException) e;
						assertThat(unrecognized.symbol()).isEqualTo("furlong");
						assertThat(unrecognized.offset()).isEqualTo(2);
					});
		}

		@Test
		void rejectsStrayCharacters() {
			assertThatThrownBy(() -> tokenize("m * s"))
					.isInstanceOf(UnitSyntaxException.class)
					.hasMessage("Unexpected character '*' at offset 2");
		}

		private FactorValue.PrefixedUnit unitOf(String input) {
			UnitToken token = tokenize(input).get(0);
			assertThat(token.type()).isEqualTo(UnitToken.TokenType.PREFIXED_UNIT);
			return (FactorValue.PrefixedUnit) token.factor().value();
		}
	}

	@Nested
	class Exponents {

		@Test
		void caretAttachesExponentToPrecedingFactor() {
			UnitToken token = tokenize("s^-2").get(0);

			assertThat(token.factor().exponent()).isEqualByComparingTo("-2");
		}

		@Test
		void exponentsMayBeFractional() {
			assertThat(tokenize("m^0.5").get(0).factor().exponent()).isEqualByComparingTo("0.5");
			assertThat(tokenize("2^3").get(0).factor().exponent()).isEqualByComparingTo("3");
			assertThat(tokenize("{beats}^2").get(0).factor().exponent()).isEqualByComparingTo("2");
		}

		@Test
		void caretNeedsANumber() {
			assertThatThrownBy(() -> tokenize("m^"))
					.isInstanceOf(MalformedNumberException.class)
					.hasMessageContaining("Exponent expected");
			assertThatThrownBy(() -> tokenize("m^s")).isInstanceOf(MalformedNumberException.class);
		}

		@Test
		void exponentsDoNotChain() {
			assertThatThrownBy(() -> tokenize("m^2^3"))
					.isInstanceOf(UnitSyntaxException.class)
					.hasMessageContaining("already has an exponent");
			assertThatThrownBy(() -> tokenize("^2"))
					.isInstanceOf(UnitSyntaxException.class)
					.hasMessage("Exponent without a factor at offset 0");
		}

		@Test
		void trailingDigitsAreASeparateNumberByDefault() {
			List<UnitToken> tokens = tokenize("m2");

			assertThat(types(tokens)).containsExactly(
					UnitToken.TokenType.PREFIXED_UNIT, UnitToken.TokenType.NUMBER, UnitToken.TokenType.EOF);
			assertThat(tokens.get(0).factor().hasExponent()).isFalse();
		}

		@Test
		void legacyGrammarReadsTrailingDigitsAsExponent() {
			List<UnitToken> tokens = tokenizeLegacy("m2 s-1");

			assertThat(types(tokens)).containsExactly(
					UnitToken.TokenType.PREFIXED_UNIT, UnitToken.TokenType.PREFIXED_UNIT, UnitToken.TokenType.EOF);
			assertThat(tokens.get(0).factor().exponent()).isEqualByComparingTo("2");
			assertThat(tokens.get(1).factor().exponent()).isEqualByComparingTo("-1");
		}

		@Test
		void legacyGrammarStillAcceptsCaret() {
			assertThat(tokenizeLegacy("m^3").get(0).factor().exponent()).isEqualByComparingTo("3");
		}
	}

	@Nested
	class Marks {

		@Test
		void classifiesMarks() {
			assertThat(markOf("{chem: CO2}")).isEqualTo(new FactorValue.OtherMark(MarkKind.CHEMICAL, "CO2"));
			assertThat(markOf("{currency: EUR}")).isEqualTo(new FactorValue.OtherMark(MarkKind.CURRENCY, "EUR"));
			assertThat(markOf("{beats}")).isEqualTo(new FactorValue.OtherMark(MarkKind.USER, "beats"));
		}

		@Test
		void bracesMayNest() {
			assertThat(markOf("{a {b} c}")).isEqualTo(new FactorValue.OtherMark(MarkKind.USER, "a {b} c"));
		}

		@Test
		void unterminatedMarkReportsOpeningBrace() {
			assertThatThrownBy(() -> tokenize("m {chem: CO2"))
					.isInstanceOf(UnterminatedMarkException.class)
					.satisfies(e -> assertThat(((UnitsException) e).offset()).isEqualTo(2));
		}

		@Test
		void unlistedCurrencyIsADefinitionsFailure() {
			assertThatThrownBy(() -> tokenize("{currency: XYZ}"))
					.isInstanceOf(DefinitionsException.class)
					.hasMessageContaining("XYZ")
					.satisfies(e -> assertThat(((UnitsException) e).offset()).isEqualTo(0));
		}

		private FactorValue.OtherMark markOf(String input) {
			UnitToken token = tokenize(input).get(0);
			assertThat(token.type()).isEqualTo(UnitToken.TokenType.MARK);
			return (FactorValue.OtherMark) token.factor().value();
		}
	}

	@Test
	void tokenizingIsRepeatable() {
		List<UnitToken> first = tokenize("kg m s^-2");
		List<UnitToken> second = tokenize("kg m s^-2");

		assertThat(second).isEqualTo(first);
	}
}

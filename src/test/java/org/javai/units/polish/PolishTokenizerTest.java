package org.javai.units.polish;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import java.util.List;
import org.junit.jupiter.api.Test;

class PolishTokenizerTest {

	@Test
	void tokenizeListWithSymbolsNumbersAndStrings() {
		List<PolishToken> tokens = new PolishTokenizer("(* 3 (chem 'CO2') (^ s -2))").tokenize();

		assertThat(tokens).extracting(PolishToken::type).containsExactly(
				PolishToken.TokenType.LPAREN,
				PolishToken.TokenType.SYMBOL,
				PolishToken.TokenType.NUMBER,
				PolishToken.TokenType.LPAREN,
				PolishToken.TokenType.SYMBOL,
				PolishToken.TokenType.STRING,
				PolishToken.TokenType.RPAREN,
				PolishToken.TokenType.LPAREN,
				PolishToken.TokenType.SYMBOL,
				PolishToken.TokenType.SYMBOL,
				PolishToken.TokenType.NUMBER,
				PolishToken.TokenType.RPAREN,
				PolishToken.TokenType.RPAREN,
				PolishToken.TokenType.EOF);
		assertThat(tokens.get(5).value()).isEqualTo("CO2");
		assertThat(tokens.get(10).value()).isEqualTo("-2");
	}

	@Test
	void tokenizeBigDecimalNotation() {
		List<PolishToken> tokens = new PolishTokenizer("1E+3 -").tokenize();

		assertThat(tokens.get(0)).isEqualTo(new PolishToken(PolishToken.TokenType.NUMBER, "1E+3", 0));
		assertThat(tokens.get(1)).isEqualTo(new PolishToken(PolishToken.TokenType.SYMBOL, "-", 5));
	}

	@Test
	void tokenizeEscapedQuotes() {
		List<PolishToken> tokens = new PolishTokenizer("'it\\'s'").tokenize();

		assertThat(tokens.get(0).value()).isEqualTo("it's");
	}

	@Test
	void tokenizeNonAsciiSymbols() {
		List<PolishToken> tokens = new PolishTokenizer("(prefix µ m) °C %").tokenize();

		assertThat(tokens).extracting(PolishToken::value).contains("µ", "°C", "%");
	}

	@Test
	void unterminatedStringFails() {
		assertThatThrownBy(() -> new PolishTokenizer("(user 'beats)").tokenize())
				.isInstanceOf(PolishFormatException.class)
				.hasMessage("Unterminated string at offset 6");
	}
}

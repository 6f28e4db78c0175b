package org.javai.units.polish;

import java.util.ArrayList;
import java.util.List;

/**
 * Tokenizer for Polish-notation fixture text.
 * Converts input string into a stream of tokens.
 */
public class PolishTokenizer {

	private final String input;
	private int pos = 0;

	public PolishTokenizer(String input) {
		this.input = input != null ? input : "";
	}

	/**
	 * Tokenizes the entire input string.
	 *
	 * @return list of tokens (includes EOF token at end)
	 * @throws PolishFormatException if an unterminated string is encountered
	 */
	public List<PolishToken> tokenize() {
		List<PolishToken> tokens = new ArrayList<>();

		while (!isAtEnd()) {
			skipWhitespace();
			if (isAtEnd()) break;

			tokens.add(nextToken());
		}

		tokens.add(new PolishToken(PolishToken.TokenType.EOF, "", pos));
		return tokens;
	}

	private PolishToken nextToken() {
		int start = pos;
		char c = peek();

		return switch (c) {
			case '(' -> {
				advance();
				yield new PolishToken(PolishToken.TokenType.LPAREN, "(", start);
			}
			case ')' -> {
				advance();
				yield new PolishToken(PolishToken.TokenType.RPAREN, ")", start);
			}
			case '\'' -> scanString();
			default -> {
				if (isDigit(c) || ((c == '-' || c == '+') && isDigit(charAt(pos + 1)))) {
					yield scanNumber();
				} else {
					yield scanSymbol();
				}
			}
		};
	}

	private PolishToken scanString() {
		int start = pos;
		advance(); // consume opening '

		StringBuilder sb = new StringBuilder();
		while (!isAtEnd() && peek() != '\'') {
			char c = advance();
			if (c == '\\' && !isAtEnd()) {
				sb.append(advance());
			} else {
				sb.append(c);
			}
		}

		if (isAtEnd()) {
			throw new PolishFormatException("Unterminated string", start);
		}

		advance(); // consume closing '
		return new PolishToken(PolishToken.TokenType.STRING, sb.toString(), start);
	}

	private PolishToken scanNumber() {
		int start = pos;
		advance();
		while (!isAtEnd() && isNumberChar(peek())) {
			advance();
		}
		return new PolishToken(PolishToken.TokenType.NUMBER, input.substring(start, pos), start);
	}

	private PolishToken scanSymbol() {
		int start = pos;
		while (!isAtEnd() && isSymbolChar(peek())) {
			advance();
		}
		return new PolishToken(PolishToken.TokenType.SYMBOL, input.substring(start, pos), start);
	}

	private void skipWhitespace() {
		while (!isAtEnd() && Character.isWhitespace(peek())) {
			advance();
		}
	}

	private char peek() {
		return isAtEnd() ? '\0' : input.charAt(pos);
	}

	private char charAt(int index) {
		return index < input.length() ? input.charAt(index) : '\0';
	}

	private char advance() {
		return input.charAt(pos++);
	}

	private boolean isAtEnd() {
		return pos >= input.length();
	}

	private boolean isDigit(char c) {
		return c >= '0' && c <= '9';
	}

	private boolean isNumberChar(char c) {
		return isDigit(c) || c == '.' || c == 'e' || c == 'E' || c == '+' || c == '-';
	}

	private boolean isSymbolChar(char c) {
		return !Character.isWhitespace(c) && c != '(' && c != ')' && c != '\'';
	}
}

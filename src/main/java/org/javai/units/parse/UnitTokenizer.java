package org.javai.units.parse;

import java.math.BigDecimal;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import org.javai.units.ast.Factor;
import org.javai.units.ast.FactorValue;
import org.javai.units.definitions.DefinitionsTable;
import org.javai.units.definitions.ResolvedSymbol;
import org.javai.units.definitions.SymbolResolver;

/**
 * Converts unit expression text into a stream of tokens.
 * <p>
 * Whitespace between factors is optional and skipped; whitespace is never part of
 * a factor. A factor is one of
 * <ul>
 *   <li>a number, {@code -?[0-9]+(\.[0-9]*)?([eE]-?[0-9]+)?}</li>
 *   <li>a braced mark, {@code {chem: CO2}}, {@code {currency: EUR}}, {@code {anything}}</li>
 *   <li>a run of symbol characters resolved into prefixes and a unit</li>
 * </ul>
 * each optionally followed by {@code ^} and a number. Tokenizing is a pure function
 * of the input and the definitions table.
 */
public class UnitTokenizer {

	private final String input;
	private final DefinitionsTable table;
	private final TokenizerOptions options;
	private final SymbolResolver resolver;
	private final MarkClassifier classifier;
	private int pos = 0;

	public UnitTokenizer(String input, DefinitionsTable table, TokenizerOptions options) {
		this.input = input != null ? input : "";
		this.table = Objects.requireNonNull(table, "table must not be null");
		this.options = options != null ? options : TokenizerOptions.defaults();
		this.resolver = new SymbolResolver(table, this.options.allowCompoundPrefixes());
		this.classifier = new MarkClassifier(table);
	}

	public UnitTokenizer(String input, DefinitionsTable table) {
		this(input, table, TokenizerOptions.defaults());
	}

	/**
	 * Tokenizes the entire input.
	 *
	 * @return the tokens, ending with an EOF token
	 */
	public List<UnitToken> tokenize() {
		List<UnitToken> tokens = new ArrayList<>();
		UnitToken token;
		do {
			token = nextToken();
			tokens.add(token);
		} while (!token.isType(UnitToken.TokenType.EOF));
		return tokens;
	}

	/**
	 * Reads the token at the cursor and advances past it.
	 */
	public UnitToken nextToken() {
		skipWhitespace();
		if (isAtEnd()) {
			return UnitToken.structural(UnitToken.TokenType.EOF, pos);
		}
		int start = pos;
		char c = peek();
		return switch (c) {
			case '/' -> {
				advance();
				yield UnitToken.structural(UnitToken.TokenType.SLASH, start);
			}
			case '(' -> {
				advance();
				yield UnitToken.structural(UnitToken.TokenType.LPAREN, start);
			}
			case ')' -> {
				advance();
				yield UnitToken.structural(UnitToken.TokenType.RPAREN, start);
			}
			case '{' -> withExponent(UnitToken.TokenType.MARK, scanMark(), start, false);
			case '^' -> throw new UnitSyntaxException("Exponent without a factor", start);
			default -> {
				if (isDigit(c) || c == '-') {
					yield withExponent(UnitToken.TokenType.NUMBER, new FactorValue.NumberValue(scanNumber()), start, false);
				} else if (table.isSymbolCharacter(c)) {
					yield withExponent(UnitToken.TokenType.PREFIXED_UNIT, scanSymbol(), start, options.legacyDigitExponents());
				} else {
					throw new UnitSyntaxException("Unexpected character '" + c + "'", start);
				}
			}
		};
	}

	/**
	 * Current cursor offset.
	 */
	public int position() {
		return pos;
	}

	private UnitToken withExponent(UnitToken.TokenType type, FactorValue value, int start, boolean digitExponent) {
		BigDecimal exponent = null;
		if (!isAtEnd() && peek() == '^') {
			advance();
			if (isAtEnd() || !(isDigit(peek()) || peek() == '-')) {
				throw new MalformedNumberException("Exponent expected after '^'", pos);
			}
			exponent = scanNumber();
		} else if (digitExponent && startsInteger()) {
			exponent = scanInteger();
		}
		if (!isAtEnd() && peek() == '^') {
			throw new UnitSyntaxException("Factor already has an exponent", pos);
		}
		return new UnitToken(type, new Factor(value, exponent), start);
	}

	private FactorValue.PrefixedUnit scanSymbol() {
		int start = pos;
		while (!isAtEnd() && table.isSymbolCharacter(peek())) {
			advance();
		}
		String symbol = input.substring(start, pos);
		ResolvedSymbol resolved = resolver.resolve(symbol)
				.orElseThrow(() -> new UnrecognizedUnitException(symbol, start));
		return new FactorValue.PrefixedUnit(resolved.prefixes(), resolved.unit());
	}

	private FactorValue.OtherMark scanMark() {
		int start = pos;
		advance(); // consume '{'
		int depth = 1;
		while (!isAtEnd()) {
			char c = advance();
			if (c == '{') {
				depth++;
			} else if (c == '}' && --depth == 0) {
				return classifier.classify(input.substring(start + 1, pos - 1), start);
			}
		}
		throw new UnterminatedMarkException("Unterminated mark", start);
	}

	private BigDecimal scanNumber() {
		int start = pos;
		if (peek() == '-') {
			advance();
		}
		if (isAtEnd() || !isDigit(peek())) {
			throw new MalformedNumberException("Digit expected", pos);
		}
		skipDigits();
		if (!isAtEnd() && peek() == '.') {
			advance();
			skipDigits();
		}
		if (!isAtEnd() && (peek() == 'e' || peek() == 'E')) {
			char next = charAt(pos + 1);
			if (isDigit(next)) {
				advance();
				skipDigits();
			} else if (next == '-') {
				if (!isDigit(charAt(pos + 2))) {
					throw new MalformedNumberException("Digit expected in exponent", pos + 2);
				}
				advance();
				advance();
				skipDigits();
			}
			// otherwise the letter starts the next factor, as in "2eV"
		}
		if (!isAtEnd() && peek() == '.') {
			throw new MalformedNumberException("Unexpected '.' in number", pos);
		}
		return decimal(start);
	}

	private boolean startsInteger() {
		if (isAtEnd()) {
			return false;
		}
		return isDigit(peek()) || (peek() == '-' && isDigit(charAt(pos + 1)));
	}

	private BigDecimal scanInteger() {
		int start = pos;
		if (peek() == '-') {
			advance();
		}
		skipDigits();
		return decimal(start);
	}

	// well-formed text can still exceed BigDecimal's int scale, as in "1e99999999999"
	private BigDecimal decimal(int start) {
		String text = input.substring(start, pos);
		try {
			return new BigDecimal(text);
		} catch (NumberFormatException e) {
			throw new MalformedNumberException("Number out of range: " + text, start, e);
		}
	}

	private void skipDigits() {
		while (!isAtEnd() && isDigit(peek())) {
			advance();
		}
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
}

package org.javai.units.polish;

/**
 * Represents a token of Polish-notation fixture text.
 *
 * @param type the token type
 * @param value the token value (text content)
 * @param position the character position in the input string
 */
public record PolishToken(TokenType type, String value, int position) {

	public enum TokenType {
		SYMBOL,        // operators, unit and prefix symbols, mark tags
		STRING,        // 'quoted payloads'
		NUMBER,        // decimal numbers, BigDecimal syntax
		LPAREN,        // (
		RPAREN,        // )
		EOF            // end of input
	}

	@Override
	public String toString() {
		return switch (type) {
			case STRING -> "STRING('" + value + "')";
			case NUMBER, SYMBOL -> type + "(" + value + ")";
			default -> type.toString();
		};
	}

	public boolean isType(TokenType expectedType) {
		return this.type == expectedType;
	}
}

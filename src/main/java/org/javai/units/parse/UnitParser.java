package org.javai.units.parse;

import java.util.ArrayList;
import java.util.List;
import org.javai.units.ast.Expression;
import org.javai.units.ast.Term;

/**
 * Recursive descent parser for unit expressions, one token of lookahead.
 *
 * <pre>
 * Expression  := Term+ ('/' Denominator)?
 * Term        := Factor | '(' Expression ')'
 * Denominator := Factor | '(' Expression ')'
 * </pre>
 *
 * Nothing may follow a denominator except the end of the enclosing group: a
 * further {@code /} or another factor is a syntax error, and multiplication in a
 * denominator must be parenthesized. Each parenthesized group starts afresh. The
 * parser only builds structure; it neither evaluates numbers nor merges atoms.
 *
 * <pre>{@code
 * List<UnitToken> tokens = new UnitTokenizer("W/(m K)", table).tokenize();
 * Expression expression = new UnitParser(tokens).parse();
 * }</pre>
 */
public class UnitParser {

	private final List<UnitToken> tokens;
	private int index = 0;

	public UnitParser(List<UnitToken> tokens) {
		if (tokens == null || tokens.isEmpty() || !tokens.get(tokens.size() - 1).isType(UnitToken.TokenType.EOF)) {
			throw new IllegalArgumentException("Token list must end with an EOF token");
		}
		this.tokens = tokens;
	}

	/**
	 * Parses the whole token list into one expression.
	 *
	 * @throws UnitSyntaxException on any grammar violation; no partial tree is returned
	 */
	public Expression parse() {
		Expression expression = parseExpression();
		UnitToken trailing = peek();
		if (trailing.isType(UnitToken.TokenType.RPAREN)) {
			throw new UnitSyntaxException("Unmatched ')'", trailing.position());
		}
		expect(UnitToken.TokenType.EOF);
		return expression;
	}

	private Expression parseExpression() {
		List<Term> numerator = new ArrayList<>();
		while (startsTerm(peek())) {
			numerator.add(parseGroupOrFactor());
		}
		if (numerator.isEmpty()) {
			throw emptyTermList(peek());
		}
		if (!peek().isType(UnitToken.TokenType.SLASH)) {
			return new Expression(numerator, null);
		}
		UnitToken slash = advance();
		if (!startsTerm(peek())) {
			throw new UnitSyntaxException("Denominator expected after '/'", peek().position());
		}
		Term denominator = parseGroupOrFactor();
		UnitToken next = peek();
		if (next.isType(UnitToken.TokenType.SLASH)) {
			throw new UnitSyntaxException("Only one '/' is allowed per group; parenthesize the denominator",
					next.position());
		}
		if (startsTerm(next)) {
			throw new UnitSyntaxException("Terms after the denominator of '/' at offset " + slash.position()
					+ " must be parenthesized with it", next.position());
		}
		return new Expression(numerator, denominator);
	}

	private Term parseGroupOrFactor() {
		UnitToken token = advance();
		if (token.isFactor()) {
			return token.factor();
		}
		Expression inner = parseExpression();
		if (peek().isType(UnitToken.TokenType.EOF)) {
			throw new UnitSyntaxException("Unclosed '('", token.position());
		}
		expect(UnitToken.TokenType.RPAREN);
		return inner;
	}

	private UnitSyntaxException emptyTermList(UnitToken token) {
		return switch (token.type()) {
			case EOF -> new UnitSyntaxException("Empty expression", token.position());
			case RPAREN -> new UnitSyntaxException("Empty parentheses or unmatched ')'", token.position());
			case SLASH -> new UnitSyntaxException("Numerator expected before '/'", token.position());
			default -> new UnitSyntaxException("Unexpected token " + token, token.position());
		};
	}

	private boolean startsTerm(UnitToken token) {
		return token.isFactor() || token.isType(UnitToken.TokenType.LPAREN);
	}

	private UnitToken expect(UnitToken.TokenType type) {
		UnitToken token = peek();
		if (!token.isType(type)) {
			throw new UnitSyntaxException("Expected " + type + " but found " + token, token.position());
		}
		return advance();
	}

	private UnitToken peek() {
		return tokens.get(index);
	}

	private UnitToken advance() {
		UnitToken token = tokens.get(index);
		if (index < tokens.size() - 1) {
			index++;
		}
		return token;
	}
}

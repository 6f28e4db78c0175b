package org.javai.units.polish;

import java.util.ArrayList;
import java.util.List;

/**
 * Parses Polish-notation tokens into a single {@link PolishNode} tree.
 * Accepts any well-formed form; whether the form describes a unit expression is
 * decided later by {@link PolishNotation}.
 */
public class PolishReader {

	private final List<PolishToken> tokens;
	private int index = 0;

	public PolishReader(List<PolishToken> tokens) {
		this.tokens = tokens != null && !tokens.isEmpty() ? tokens
				: List.of(new PolishToken(PolishToken.TokenType.EOF, "", 0));
	}

	/**
	 * Parses exactly one top-level form.
	 *
	 * @throws PolishFormatException on unbalanced parentheses, an empty list,
	 * a non-symbol head or trailing input
	 */
	public PolishNode parse() {
		if (peek().isType(PolishToken.TokenType.EOF)) {
			throw new PolishFormatException("Empty Polish-notation form", peek().position());
		}
		PolishNode node = parseNode();
		if (!peek().isType(PolishToken.TokenType.EOF)) {
			throw new PolishFormatException("Unexpected trailing token " + peek(), peek().position());
		}
		return node;
	}

	private PolishNode parseNode() {
		PolishToken token = advance();
		return switch (token.type()) {
			case NUMBER -> PolishNode.number(token.value());
			case STRING -> PolishNode.string(token.value());
			case SYMBOL -> PolishNode.symbol(token.value());
			case LPAREN -> parseList(token);
			case RPAREN -> throw new PolishFormatException("Unexpected ')'", token.position());
			case EOF -> throw new PolishFormatException("Unexpected end of input", token.position());
		};
	}

	private PolishNode parseList(PolishToken open) {
		PolishToken head = advance();
		if (!head.isType(PolishToken.TokenType.SYMBOL)) {
			throw new PolishFormatException("List must start with a symbol, found " + head, head.position());
		}
		List<PolishNode> args = new ArrayList<>();
		while (!peek().isType(PolishToken.TokenType.RPAREN)) {
			if (peek().isType(PolishToken.TokenType.EOF)) {
				throw new PolishFormatException("Unclosed '('", open.position());
			}
			args.add(parseNode());
		}
		advance(); // consume ')'
		return PolishNode.list(head.value(), args);
	}

	private PolishToken peek() {
		return tokens.get(index);
	}

	private PolishToken advance() {
		PolishToken token = tokens.get(index);
		if (index < tokens.size() - 1) {
			index++;
		}
		return token;
	}
}

package org.javai.units.polish;

import java.util.List;
import java.util.Objects;

/**
 * Represents a node of a parsed Polish-notation form.
 *
 * A node is one of:
 * - a list {@code (head args...)} - kind LIST, value is the head symbol
 * - a bare symbol - kind SYMBOL
 * - a number literal - kind NUMBER, value is the literal text
 * - a quoted string - kind STRING, value is the unquoted text
 */
public record PolishNode(Kind kind, String value, List<PolishNode> args) {

	public enum Kind {
		LIST,
		SYMBOL,
		NUMBER,
		STRING
	}

	public PolishNode {
		Objects.requireNonNull(kind, "kind must not be null");
		Objects.requireNonNull(value, "value must not be null");
		args = args != null ? List.copyOf(args) : List.of();
	}

	public static PolishNode list(String head, List<PolishNode> args) {
		return new PolishNode(Kind.LIST, head, args);
	}

	public static PolishNode list(String head, PolishNode... args) {
		return new PolishNode(Kind.LIST, head, List.of(args));
	}

	public static PolishNode symbol(String symbol) {
		return new PolishNode(Kind.SYMBOL, symbol, List.of());
	}

	public static PolishNode number(String text) {
		return new PolishNode(Kind.NUMBER, text, List.of());
	}

	public static PolishNode string(String text) {
		return new PolishNode(Kind.STRING, text, List.of());
	}

	public boolean isList(String head) {
		return kind == Kind.LIST && value.equals(head);
	}

	/**
	 * Accepts a visitor and dispatches to the appropriate visitor method.
	 *
	 * @param <R> the return type of the visitor
	 * @param visitor the visitor to accept
	 * @return the result of the visitor operation
	 */
	public <R> R accept(PolishNodeVisitor<R> visitor) {
		return switch (kind) {
			case LIST -> visitor.visitList(value, args);
			case SYMBOL -> visitor.visitSymbol(value);
			case NUMBER -> visitor.visitNumber(value);
			case STRING -> visitor.visitString(value);
		};
	}
}

package org.javai.units.polish;

import java.util.List;

/**
 * Prints a {@link PolishNode} tree back to Polish-notation text, either on one
 * line or indented with one argument per line.
 */
public class PolishPrinter implements PolishNodeVisitor<Void> {

	private final StringBuilder output = new StringBuilder();
	private int indentLevel = 0;
	private final boolean pretty;
	private final int indentSize;

	public PolishPrinter() {
		this(false, 0);
	}

	public PolishPrinter(boolean pretty, int indentSize) {
		this.pretty = pretty;
		this.indentSize = indentSize;
	}

	@Override
	public Void visitList(String head, List<PolishNode> args) {
		output.append('(').append(head);
		// leaf-only lists stay on one line even in pretty mode
		boolean nested = args.stream().anyMatch(a -> a.kind() == PolishNode.Kind.LIST);
		if (pretty && nested) {
			indentLevel++;
			for (PolishNode arg : args) {
				output.append('\n');
				indent();
				arg.accept(this);
			}
			indentLevel--;
		} else {
			for (PolishNode arg : args) {
				output.append(' ');
				arg.accept(this);
			}
		}
		output.append(')');
		return null;
	}

	@Override
	public Void visitSymbol(String symbol) {
		output.append(symbol);
		return null;
	}

	@Override
	public Void visitNumber(String text) {
		output.append(text);
		return null;
	}

	@Override
	public Void visitString(String text) {
		output.append('\'').append(text.replace("\\", "\\\\").replace("'", "\\'")).append('\'');
		return null;
	}

	private void indent() {
		output.append(" ".repeat(indentLevel * indentSize));
	}

	/**
	 * Returns the printed output as a string.
	 */
	public String toString() {
		return output.toString();
	}

	/**
	 * Static convenience method to print a node on one line.
	 */
	public static String printCompact(PolishNode node) {
		PolishPrinter printer = new PolishPrinter();
		node.accept(printer);
		return printer.toString();
	}

	/**
	 * Static convenience method to print a node with indentation.
	 */
	public static String print(PolishNode node) {
		PolishPrinter printer = new PolishPrinter(true, 2);
		node.accept(printer);
		return printer.toString();
	}
}

package org.javai.units.polish;

import java.util.List;

/**
 * Visitor interface for traversing Polish-notation node trees.
 *
 * @param <R> the return type of the visitor operations
 */
public interface PolishNodeVisitor<R> {

	/**
	 * Visits a list node.
	 *
	 * @param head the operator or tag in head position
	 * @param args the child nodes
	 * @return the result of visiting this node
	 */
	R visitList(String head, List<PolishNode> args);

	R visitSymbol(String symbol);

	R visitNumber(String text);

	R visitString(String text);
}

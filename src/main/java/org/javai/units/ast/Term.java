package org.javai.units.ast;

/**
 * One multiplicative term of an expression: a single {@link Factor} or a
 * parenthesized sub-{@link Expression}.
 */
public sealed interface Term permits Factor, Expression {

	<R> R accept(ExpressionVisitor<R> visitor);
}

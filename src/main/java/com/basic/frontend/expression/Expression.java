package com.basic.frontend.expression;

/**
 * Node of a translated expression tree. Trees are immutable once built.
 */
public interface Expression {

    <R> R accept(ExpressionVisitor<R> visitor);
}

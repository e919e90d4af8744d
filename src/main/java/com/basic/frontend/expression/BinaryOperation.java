package com.basic.frontend.expression;

import lombok.NonNull;
import lombok.Value;

@Value
public class BinaryOperation implements Expression {
    @NonNull
    Expression left;
    @NonNull
    BinaryOperator operator;
    @NonNull
    Expression right;

    @Override
    public <R> R accept(ExpressionVisitor<R> visitor) {
        return visitor.visitBinary(this);
    }
}

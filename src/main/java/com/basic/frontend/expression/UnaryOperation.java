package com.basic.frontend.expression;

import lombok.NonNull;
import lombok.Value;

/**
 * Arithmetic negation; the only prefix operator of the language.
 */
@Value
public class UnaryOperation implements Expression {
    public static final String NEGATE = "-";

    @NonNull
    Expression operand;

    public String getOperator() {
        return NEGATE;
    }

    @Override
    public <R> R accept(ExpressionVisitor<R> visitor) {
        return visitor.visitUnary(this);
    }
}

package com.basic.frontend.expression;

import lombok.NonNull;
import lombok.Value;

/**
 * Numeric literal. Keeps the source lexeme next to the parsed value.
 */
@Value
public class NumberLiteral implements Expression {
    @NonNull
    String lexeme;
    double value;

    public static NumberLiteral of(String lexeme) {
        return new NumberLiteral(lexeme, Double.parseDouble(lexeme));
    }

    @Override
    public <R> R accept(ExpressionVisitor<R> visitor) {
        return visitor.visitNumber(this);
    }
}

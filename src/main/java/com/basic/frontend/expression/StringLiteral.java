package com.basic.frontend.expression;

import lombok.NonNull;
import lombok.Value;

/**
 * String literal; the body is kept exactly as written between the quotes,
 * escape sequences included.
 */
@Value
public class StringLiteral implements Expression {
    @NonNull
    String body;

    @Override
    public <R> R accept(ExpressionVisitor<R> visitor) {
        return visitor.visitString(this);
    }
}

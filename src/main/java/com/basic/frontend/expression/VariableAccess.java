package com.basic.frontend.expression;

import lombok.NonNull;
import lombok.Value;

/**
 * Read of a scalar variable or, when {@code subscript} is set, of an array element.
 */
@Value
public class VariableAccess implements Expression {
    @NonNull
    String name;
    Expression subscript;

    public static VariableAccess scalar(String name) {
        return new VariableAccess(name, null);
    }

    public boolean isSubscripted() {
        return subscript != null;
    }

    @Override
    public <R> R accept(ExpressionVisitor<R> visitor) {
        return visitor.visitVariable(this);
    }
}

package com.basic.frontend.expression;

import lombok.NonNull;
import lombok.Value;

@Value
public class ConstantReference implements Expression {
    @NonNull
    String name;

    @Override
    public <R> R accept(ExpressionVisitor<R> visitor) {
        return visitor.visitConstant(this);
    }
}

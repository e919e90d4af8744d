package com.basic.frontend.expression;

import java.util.List;

import lombok.NonNull;
import lombok.Value;

@Value
public class FunctionCall implements Expression {
    @NonNull
    String name;
    @NonNull
    List<Expression> arguments;

    public FunctionCall(String name, List<Expression> arguments) {
        this.name = name;
        this.arguments = List.copyOf(arguments);
    }

    @Override
    public <R> R accept(ExpressionVisitor<R> visitor) {
        return visitor.visitCall(this);
    }
}

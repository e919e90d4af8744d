package com.basic.frontend.ast;

import com.basic.frontend.expression.Expression;

import lombok.NonNull;
import lombok.Value;

/**
 * Variable named as an assignment or loop target. {@code subscript} is
 * {@code null} for a scalar variable.
 */
@Value
public class Variable {
    int lineNumber;
    @NonNull
    String name;
    Expression subscript;

    public boolean isSubscripted() {
        return subscript != null;
    }
}

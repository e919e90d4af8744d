package com.basic.frontend.ast;

import com.basic.frontend.expression.Expression;

import lombok.EqualsAndHashCode;
import lombok.Getter;
import lombok.NonNull;
import lombok.ToString;

/**
 * {@code INPUT prompt; variable}.
 */
@Getter
@EqualsAndHashCode(callSuper = true)
@ToString(callSuper = true)
public final class InputStatement extends Statement {

    private final Expression prompt;
    private final Variable variable;

    public InputStatement(int lineNumber, @NonNull Expression prompt, @NonNull Variable variable) {
        super(lineNumber);
        this.prompt = prompt;
        this.variable = variable;
    }

    @Override
    public StatementKind getKind() {
        return StatementKind.INPUT;
    }

    @Override
    public <R> R accept(StatementVisitor<R> visitor) {
        return visitor.visitInput(this);
    }
}

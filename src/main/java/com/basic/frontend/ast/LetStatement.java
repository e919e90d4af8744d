package com.basic.frontend.ast;

import com.basic.frontend.expression.Expression;

import lombok.EqualsAndHashCode;
import lombok.Getter;
import lombok.NonNull;
import lombok.ToString;

@Getter
@EqualsAndHashCode(callSuper = true)
@ToString(callSuper = true)
public final class LetStatement extends Statement {

    private final Variable variable;
    private final Expression value;

    public LetStatement(int lineNumber, @NonNull Variable variable, @NonNull Expression value) {
        super(lineNumber);
        this.variable = variable;
        this.value = value;
    }

    @Override
    public StatementKind getKind() {
        return StatementKind.LET;
    }

    @Override
    public <R> R accept(StatementVisitor<R> visitor) {
        return visitor.visitLet(this);
    }
}

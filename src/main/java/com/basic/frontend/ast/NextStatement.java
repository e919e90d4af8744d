package com.basic.frontend.ast;

import lombok.EqualsAndHashCode;
import lombok.Getter;
import lombok.NonNull;
import lombok.ToString;

@Getter
@EqualsAndHashCode(callSuper = true)
@ToString(callSuper = true)
public final class NextStatement extends Statement {

    private final Variable variable;

    public NextStatement(int lineNumber, @NonNull Variable variable) {
        super(lineNumber);
        this.variable = variable;
    }

    @Override
    public StatementKind getKind() {
        return StatementKind.NEXT;
    }

    @Override
    public <R> R accept(StatementVisitor<R> visitor) {
        return visitor.visitNext(this);
    }
}

package com.basic.frontend.ast;

import lombok.EqualsAndHashCode;
import lombok.ToString;

@EqualsAndHashCode(callSuper = true)
@ToString(callSuper = true)
public final class EndStatement extends Statement {

    public EndStatement(int lineNumber) {
        super(lineNumber);
    }

    @Override
    public StatementKind getKind() {
        return StatementKind.END;
    }

    @Override
    public <R> R accept(StatementVisitor<R> visitor) {
        return visitor.visitEnd(this);
    }
}

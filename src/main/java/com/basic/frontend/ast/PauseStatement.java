package com.basic.frontend.ast;

import com.basic.frontend.expression.Expression;

import lombok.EqualsAndHashCode;
import lombok.Getter;
import lombok.NonNull;
import lombok.ToString;

@Getter
@EqualsAndHashCode(callSuper = true)
@ToString(callSuper = true)
public final class PauseStatement extends Statement {

    private final Expression duration;

    public PauseStatement(int lineNumber, @NonNull Expression duration) {
        super(lineNumber);
        this.duration = duration;
    }

    @Override
    public StatementKind getKind() {
        return StatementKind.PAUSE;
    }

    @Override
    public <R> R accept(StatementVisitor<R> visitor) {
        return visitor.visitPause(this);
    }
}

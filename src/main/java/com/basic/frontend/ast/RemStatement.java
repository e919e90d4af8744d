package com.basic.frontend.ast;

import lombok.EqualsAndHashCode;
import lombok.Getter;
import lombok.NonNull;
import lombok.ToString;

/**
 * Comment line. The text is everything after {@code REM} and the whitespace
 * following it, possibly empty.
 */
@Getter
@EqualsAndHashCode(callSuper = true)
@ToString(callSuper = true)
public final class RemStatement extends Statement {

    private final String comment;

    public RemStatement(int lineNumber, @NonNull String comment) {
        super(lineNumber);
        this.comment = comment;
    }

    @Override
    public StatementKind getKind() {
        return StatementKind.REM;
    }

    @Override
    public <R> R accept(StatementVisitor<R> visitor) {
        return visitor.visitRem(this);
    }
}

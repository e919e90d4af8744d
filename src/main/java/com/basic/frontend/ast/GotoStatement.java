package com.basic.frontend.ast;

import com.basic.frontend.expression.Expression;

import lombok.EqualsAndHashCode;
import lombok.Getter;
import lombok.NonNull;
import lombok.ToString;

/**
 * Jump to the line the target expression evaluates to.
 */
@Getter
@EqualsAndHashCode(callSuper = true)
@ToString(callSuper = true)
public final class GotoStatement extends Statement {

    private final Expression target;

    public GotoStatement(int lineNumber, @NonNull Expression target) {
        super(lineNumber);
        this.target = target;
    }

    @Override
    public StatementKind getKind() {
        return StatementKind.GOTO;
    }

    @Override
    public <R> R accept(StatementVisitor<R> visitor) {
        return visitor.visitGoto(this);
    }
}

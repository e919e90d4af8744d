package com.basic.frontend.ast;

import com.basic.frontend.expression.Expression;

import lombok.EqualsAndHashCode;
import lombok.Getter;
import lombok.NonNull;
import lombok.ToString;

/**
 * {@code IF condition THEN statement [ELSE statement]}. Both branches are full
 * statements of the same line, so IF nodes can nest. {@code elseBranch} is
 * {@code null} without an ELSE clause.
 */
@Getter
@EqualsAndHashCode(callSuper = true)
@ToString(callSuper = true)
public final class IfStatement extends Statement {

    private final Expression condition;
    private final Statement thenBranch;
    private final Statement elseBranch;

    public IfStatement(int lineNumber, @NonNull Expression condition, @NonNull Statement thenBranch,
                       Statement elseBranch) {
        super(lineNumber);
        this.condition = condition;
        this.thenBranch = thenBranch;
        this.elseBranch = elseBranch;
    }

    public boolean hasElseBranch() {
        return elseBranch != null;
    }

    @Override
    public StatementKind getKind() {
        return StatementKind.IF;
    }

    @Override
    public <R> R accept(StatementVisitor<R> visitor) {
        return visitor.visitIf(this);
    }
}

package com.basic.frontend.ast;

import com.basic.frontend.expression.Expression;

import lombok.EqualsAndHashCode;
import lombok.Getter;
import lombok.NonNull;
import lombok.ToString;

/**
 * {@code FOR variable = from TO to [STEP step]}. {@code step} is {@code null}
 * when the line has no STEP clause.
 */
@Getter
@EqualsAndHashCode(callSuper = true)
@ToString(callSuper = true)
public final class ForStatement extends Statement {

    private final Variable variable;
    private final Expression from;
    private final Expression to;
    private final Expression step;

    public ForStatement(int lineNumber, @NonNull Variable variable, @NonNull Expression from,
                        @NonNull Expression to, Expression step) {
        super(lineNumber);
        this.variable = variable;
        this.from = from;
        this.to = to;
        this.step = step;
    }

    public boolean hasStep() {
        return step != null;
    }

    @Override
    public StatementKind getKind() {
        return StatementKind.FOR;
    }

    @Override
    public <R> R accept(StatementVisitor<R> visitor) {
        return visitor.visitFor(this);
    }
}

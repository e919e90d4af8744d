package com.basic.frontend.ast;

import com.basic.frontend.expression.Expression;

import lombok.EqualsAndHashCode;
import lombok.Getter;
import lombok.NonNull;
import lombok.ToString;

/**
 * {@code PRINT expr [;]}. A trailing {@code ;} keeps the output on the same line.
 */
@Getter
@EqualsAndHashCode(callSuper = true)
@ToString(callSuper = true)
public final class PrintStatement extends Statement {

    private final Expression expression;
    private final boolean lineModifier;

    public PrintStatement(int lineNumber, @NonNull Expression expression, boolean lineModifier) {
        super(lineNumber);
        this.expression = expression;
        this.lineModifier = lineModifier;
    }

    @Override
    public StatementKind getKind() {
        return StatementKind.PRINT;
    }

    @Override
    public <R> R accept(StatementVisitor<R> visitor) {
        return visitor.visitPrint(this);
    }
}

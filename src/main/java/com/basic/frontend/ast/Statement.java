package com.basic.frontend.ast;

import lombok.EqualsAndHashCode;
import lombok.Getter;
import lombok.ToString;

/**
 * Base class for all statement nodes. A node is built once per parsed line and
 * never changes afterwards.
 */
@Getter
@EqualsAndHashCode
@ToString
public abstract class Statement {

    /**
     * Number of the source line the statement was parsed from.
     */
    private final int lineNumber;

    protected Statement(int lineNumber) {
        if (lineNumber < 0) {
            throw new IllegalArgumentException("Line number must not be negative: " + lineNumber);
        }
        this.lineNumber = lineNumber;
    }

    public abstract StatementKind getKind();

    public abstract <R> R accept(StatementVisitor<R> visitor);
}

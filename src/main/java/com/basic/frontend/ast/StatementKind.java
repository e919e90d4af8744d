package com.basic.frontend.ast;

import java.util.Arrays;
import java.util.Optional;

/**
 * The closed set of statements a line can hold. The constant name is the
 * keyword that introduces the statement.
 */
public enum StatementKind {
    PRINT,
    LET,
    REM,
    PAUSE,
    INPUT,
    FOR,
    NEXT,
    GOTO,
    END,
    IF;

    public String keyword() {
        return name();
    }

    public static Optional<StatementKind> fromKeyword(String keyword) {
        if (keyword == null) {
            return Optional.empty();
        }
        return Arrays.stream(values())
                .filter(kind -> kind.keyword().equalsIgnoreCase(keyword))
                .findFirst();
    }
}

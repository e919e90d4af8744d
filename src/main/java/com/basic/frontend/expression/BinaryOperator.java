package com.basic.frontend.expression;

import java.util.Arrays;
import java.util.Optional;

import com.basic.frontend.lexer.Token;
import com.basic.frontend.lexer.Token.TokenType;

import lombok.Getter;

/**
 * Infix operators with their binding strength. A higher precedence binds tighter;
 * all levels associate to the left.
 */
public enum BinaryOperator {
    OR("OR", TokenType.LOGIC, 1),
    AND("AND", TokenType.LOGIC, 1),
    EQUAL("=", TokenType.OPERATOR, 2),
    NOT_EQUAL("<>", TokenType.OPERATOR, 2),
    LESS("<", TokenType.OPERATOR, 2),
    GREATER(">", TokenType.OPERATOR, 2),
    LESS_EQUAL("<=", TokenType.OPERATOR, 2),
    GREATER_EQUAL(">=", TokenType.OPERATOR, 2),
    ADD("+", TokenType.OPERATOR, 3),
    SUBTRACT("-", TokenType.OPERATOR, 3),
    MULTIPLY("*", TokenType.OPERATOR, 4),
    DIVIDE("/", TokenType.OPERATOR, 4),
    MODULO("%", TokenType.OPERATOR, 4);

    public static final int LOWEST_PRECEDENCE = 1;

    @Getter
    private final String symbol;
    private final TokenType tokenType;
    @Getter
    private final int precedence;

    BinaryOperator(String symbol, TokenType tokenType, int precedence) {
        this.symbol = symbol;
        this.tokenType = tokenType;
        this.precedence = precedence;
    }

    public static Optional<BinaryOperator> fromToken(Token token) {
        return Arrays.stream(values())
                .filter(op -> op.tokenType == token.getType() && op.symbol.equals(token.getValue()))
                .findFirst();
    }
}

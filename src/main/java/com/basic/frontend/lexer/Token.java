package com.basic.frontend.lexer;

import lombok.EqualsAndHashCode;
import lombok.NonNull;
import lombok.Value;

/**
 * Represents a token produced by the line tokenizer.
 * Two tokens are equal when kind and value match; the column is only for messages.
 */
@Value
public class Token {
    @NonNull
    TokenType type;
    @NonNull
    String value;
    @EqualsAndHashCode.Exclude
    int column;

    public enum TokenType {
        LINE_NUMBER,
        KEYWORD,
        COMMENT,
        STRING,
        NUMBER,
        VARIABLE,
        FUNCTION,
        CONSTANT,
        OPERATOR,
        LOGIC,
        LINE_MODIFIER,
        EOF
    }

    public static final Token EOF = new Token(TokenType.EOF, "", -1);

    /**
     * Whether this token may appear inside an expression.
     */
    public boolean isExpressionPart() {
        return type == TokenType.STRING || type == TokenType.FUNCTION ||
               type == TokenType.OPERATOR || type == TokenType.NUMBER ||
               type == TokenType.VARIABLE || type == TokenType.LOGIC ||
               type == TokenType.CONSTANT;
    }

    public boolean is(TokenType expectedType, String expectedValue) {
        return type == expectedType && value.equals(expectedValue);
    }

    public boolean isOperator(String symbol) {
        return is(TokenType.OPERATOR, symbol);
    }

    public boolean isKeyword(String keyword) {
        return type == TokenType.KEYWORD && value.equalsIgnoreCase(keyword);
    }

    public boolean isOpeningBracket() {
        return isOperator("(") || isOperator("[");
    }

    public boolean isClosingBracket() {
        return isOperator(")") || isOperator("]");
    }

    /**
     * Short form used in error messages, e.g. {@code OPERATOR ']'}.
     */
    public String describe() {
        if (type == TokenType.EOF) {
            return "end of line";
        }
        return type + " '" + value + "'";
    }
}

package com.basic.frontend.lexer;

import java.util.List;

import lombok.Getter;

/**
 * Tokens of a single source line with one consuming cursor.
 *
 * Reading past the last token keeps returning {@link Token#EOF}; peeking or
 * consuming at the end never fails.
 */
public class TokenStream {

    /**
     * All tokens of the line, independent of the cursor.
     */
    @Getter
    private final List<Token> tokens;
    @Getter
    private final int lineNumber;
    private int pos = 0;

    public TokenStream(List<Token> tokens, int lineNumber) {
        this.tokens = List.copyOf(tokens);
        this.lineNumber = lineNumber;
    }

    public Token peek() {
        return peek(0);
    }

    public Token peek(int offset) {
        int index = pos + offset;
        if (index < 0 || index >= tokens.size()) {
            return Token.EOF;
        }
        return tokens.get(index);
    }

    public Token next() {
        if (pos >= tokens.size()) {
            return Token.EOF;
        }
        return tokens.get(pos++);
    }

    public boolean isAtEnd() {
        return pos >= tokens.size();
    }
}

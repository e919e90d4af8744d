package com.basic.frontend.lexer;

import com.basic.frontend.lexer.Token.TokenType;
import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.List;

import static org.assertj.core.api.Assertions.*;

class TokenStreamTest {

    private final Token lineNumber = new Token(TokenType.LINE_NUMBER, "10", 0);
    private final Token end = new Token(TokenType.KEYWORD, "END", 3);

    @Test
    void testPeekDoesNotConsume() {
        TokenStream stream = new TokenStream(List.of(lineNumber, end), 10);

        assertThat(stream.peek()).isEqualTo(lineNumber);
        assertThat(stream.peek(1)).isEqualTo(end);
        assertThat(stream.next()).isEqualTo(lineNumber);
    }

    @Test
    void testNextAdvancesCursor() {
        TokenStream stream = new TokenStream(List.of(lineNumber, end), 10);

        assertThat(stream.next()).isEqualTo(lineNumber);
        assertThat(stream.next()).isEqualTo(end);
        assertThat(stream.isAtEnd()).isTrue();
    }

    @Test
    void testEndOfInputIsIdempotent() {
        TokenStream stream = new TokenStream(List.of(lineNumber), 10);
        stream.next();

        assertThat(stream.peek()).isSameAs(Token.EOF);
        assertThat(stream.next()).isSameAs(Token.EOF);
        assertThat(stream.next()).isSameAs(Token.EOF);
        assertThat(stream.peek(5)).isSameAs(Token.EOF);
        assertThat(stream.isAtEnd()).isTrue();
    }

    @Test
    void testTokensAreIndependentOfSourceList() {
        List<Token> source = new ArrayList<>(List.of(lineNumber));
        TokenStream stream = new TokenStream(source, 10);
        source.add(end);

        assertThat(stream.getTokens()).containsExactly(lineNumber);
        assertThatThrownBy(() -> stream.getTokens().add(end))
                .isInstanceOf(UnsupportedOperationException.class);
    }
}

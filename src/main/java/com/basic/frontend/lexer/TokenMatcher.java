package com.basic.frontend.lexer;

import java.util.List;
import java.util.Optional;

import lombok.Value;

/**
 * One token class of the lexer. Tried at a scan position; either claims a
 * non-empty prefix of the remaining input or declines.
 */
@FunctionalInterface
public interface TokenMatcher {

    Optional<Match> match(String line, int position);

    /**
     * Tokens produced by a successful match and the position right after the
     * consumed text, trailing whitespace included.
     */
    @Value
    class Match {
        List<Token> tokens;
        int end;

        public static Match of(Token token, int end) {
            return new Match(List.of(token), end);
        }
    }
}

package com.basic.frontend.lexer;

import java.util.ArrayList;
import java.util.Collection;
import java.util.Comparator;
import java.util.List;
import java.util.Optional;
import java.util.function.UnaryOperator;
import java.util.regex.Matcher;
import java.util.regex.Pattern;
import java.util.stream.Collectors;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.basic.frontend.exception.LexException;
import com.basic.frontend.exception.SyntaxException;
import com.basic.frontend.lexer.Token.TokenType;
import com.basic.frontend.registry.FunctionRegistry;

/**
 * Tokenizer for a single numbered source line.
 *
 * The line must start with its line number. The rest is scanned left to right;
 * at every position the token classes are tried in a fixed order and the first
 * one that matches wins. Several classes are prefixes of others (keywords of
 * variables, {@code <} of {@code <>}), so the order is part of the grammar.
 */
public class LineTokenizer {
    private static final Logger log = LoggerFactory.getLogger(LineTokenizer.class);

    public static final List<String> KEYWORDS = List.of(
        "IF", "THEN", "ELSE", "FOR", "ON", "TO", "STEP", "GOTO", "GOSUB", "RETURN",
        "NEXT", "INPUT", "LET", "CLC", "CLT", "CLS", "END", "PRINT", "PLOT", "DRAW",
        "UNDRAW", "ARRAY", "DIM", "DATA", "READ", "REM", "PAUSE", "STOP"
    );

    public static final List<String> CONSTANTS = List.of("LEVEL", "PI");

    private static final String COMMENT_KEYWORD = "REM";

    private static final Pattern LINE_NUMBER = Pattern.compile("\\s*(\\d+)\\s*");
    private static final Pattern KEYWORD = alternation(KEYWORDS);
    // Unrolled so that long literals do not recurse once per character.
    private static final Pattern STRING = Pattern.compile("\"([^\"\\\\]*+(?:\\\\.[^\"\\\\]*+)*+)\"\\s*");
    private static final Pattern LOGIC = Pattern.compile("(AND|OR)\\s*", Pattern.CASE_INSENSITIVE);
    private static final Pattern CONSTANT = alternation(CONSTANTS);
    // The string marker is consumed but not part of the name: A$ and A are one variable.
    private static final Pattern VARIABLE = Pattern.compile("([A-Z][0-9]*)\\$?\\s*", Pattern.CASE_INSENSITIVE);
    private static final Pattern NUMBER = Pattern.compile("(\\d+(?:\\.\\d+)?)\\s*");
    private static final Pattern OPERATOR = Pattern.compile("(<>|>=|<=|[,+\\-*/%=<>()\\[\\]])\\s*");
    private static final Pattern LINE_MODIFIER = Pattern.compile("(;)\\s*");

    private final List<TokenMatcher> matchers;

    public LineTokenizer(FunctionRegistry functions) {
        Pattern function = alternation(functions.getFunctionNames());

        // Order matters: see class comment.
        this.matchers = List.of(
            this::matchKeyword,
            simple(STRING, TokenType.STRING, UnaryOperator.identity()),
            simple(LOGIC, TokenType.LOGIC, String::toUpperCase),
            simple(function, TokenType.FUNCTION, String::toUpperCase),
            simple(CONSTANT, TokenType.CONSTANT, String::toUpperCase),
            simple(VARIABLE, TokenType.VARIABLE, String::toUpperCase),
            simple(NUMBER, TokenType.NUMBER, UnaryOperator.identity()),
            simple(OPERATOR, TokenType.OPERATOR, UnaryOperator.identity()),
            simple(LINE_MODIFIER, TokenType.LINE_MODIFIER, UnaryOperator.identity())
        );
    }

    /**
     * Tokenize a whole line. The first token of the result is always the line number.
     */
    public TokenStream tokenize(String line) {
        if (line == null) {
            throw new LexException(SyntaxException.UNKNOWN_LINE, "Every line must start with a line number");
        }

        Matcher lineMatcher = LINE_NUMBER.matcher(line);
        if (!lineMatcher.lookingAt()) {
            throw new LexException(SyntaxException.UNKNOWN_LINE, "Every line must start with a line number");
        }

        int lineNumber = parseLineNumber(lineMatcher.group(1));

        List<Token> tokens = new ArrayList<>();
        tokens.add(new Token(TokenType.LINE_NUMBER, String.valueOf(lineNumber), lineMatcher.start(1)));

        int pos = lineMatcher.end();
        while (pos < line.length()) {
            Optional<TokenMatcher.Match> match = nextMatch(line, pos);
            if (match.isEmpty()) {
                throw new LexException(lineNumber, "Invalid syntax near: '" + line.substring(pos) + "'");
            }
            tokens.addAll(match.get().getTokens());
            pos = match.get().getEnd();
        }

        log.debug("Tokenized line {} into {} tokens", lineNumber, tokens.size());
        return new TokenStream(tokens, lineNumber);
    }

    private Optional<TokenMatcher.Match> nextMatch(String line, int pos) {
        for (TokenMatcher matcher : matchers) {
            Optional<TokenMatcher.Match> match = matcher.match(line, pos);
            if (match.isPresent()) {
                return match;
            }
        }
        return Optional.empty();
    }

    private int parseLineNumber(String digits) {
        try {
            return Integer.parseInt(digits);
        } catch (NumberFormatException e) {
            throw new LexException(SyntaxException.UNKNOWN_LINE, "Line number out of range: " + digits, e);
        }
    }

    /**
     * Keywords are matched before anything else. {@code REM} swallows the rest of
     * the line as one comment token.
     */
    private Optional<TokenMatcher.Match> matchKeyword(String line, int pos) {
        Matcher m = KEYWORD.matcher(line).region(pos, line.length());
        if (!m.lookingAt()) {
            return Optional.empty();
        }

        String keyword = m.group(1).toUpperCase();
        Token keywordToken = new Token(TokenType.KEYWORD, keyword, pos);

        if (keyword.equals(COMMENT_KEYWORD)) {
            Token comment = new Token(TokenType.COMMENT, line.substring(m.end()), m.end());
            return Optional.of(new TokenMatcher.Match(List.of(keywordToken, comment), line.length()));
        }

        return Optional.of(TokenMatcher.Match.of(keywordToken, m.end()));
    }

    private static TokenMatcher simple(Pattern pattern, TokenType type, UnaryOperator<String> normalizer) {
        return (line, pos) -> {
            Matcher m = pattern.matcher(line).region(pos, line.length());
            if (!m.lookingAt() || m.end() == pos) {
                return Optional.empty();
            }
            Token token = new Token(type, normalizer.apply(m.group(1)), pos);
            return Optional.of(TokenMatcher.Match.of(token, m.end()));
        };
    }

    /**
     * Case-insensitive alternation of literal words, longest first so that no
     * word is shadowed by one of its prefixes.
     */
    private static Pattern alternation(Collection<String> words) {
        if (words.isEmpty()) {
            // never matches
            return Pattern.compile("(?!)()");
        }
        String body = words.stream()
                .sorted(Comparator.comparingInt(String::length).reversed().thenComparing(Comparator.naturalOrder()))
                .map(word -> word.replaceAll("[^A-Za-z0-9]", "\\\\$0"))
                .collect(Collectors.joining("|"));
        return Pattern.compile("(" + body + ")\\s*", Pattern.CASE_INSENSITIVE);
    }
}

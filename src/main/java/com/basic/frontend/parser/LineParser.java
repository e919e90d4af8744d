package com.basic.frontend.parser;

import com.basic.frontend.ast.Statement;
import com.basic.frontend.config.ParserConfig;
import com.basic.frontend.exception.ParseException;
import com.basic.frontend.exception.SyntaxException;
import com.basic.frontend.lexer.LineTokenizer;
import com.basic.frontend.lexer.Token;
import com.basic.frontend.lexer.Token.TokenType;
import com.basic.frontend.lexer.TokenStream;

/**
 * Entry point turning one raw source line into one statement node:
 * tokenize the whole line, read its line number, parse the statement.
 *
 * Instances hold no per-line state and can be shared between threads.
 */
public class LineParser {

    private final ParserConfig config;
    private final LineTokenizer tokenizer;

    public LineParser() {
        this(ParserConfig.defaults());
    }

    public LineParser(ParserConfig config) {
        this.config = config;
        this.tokenizer = new LineTokenizer(config.getFunctionRegistry());
    }

    public Statement parseLine(String line) {
        return parseTokens(tokenize(line));
    }

    public TokenStream tokenize(String line) {
        return tokenizer.tokenize(line);
    }

    /**
     * Parse a freshly tokenized line. The stream's cursor must still be on the
     * line number token.
     */
    public Statement parseTokens(TokenStream tokens) {
        int lineNumber = readLineNumber(tokens);
        return new StatementParser(tokens, lineNumber, config).parse();
    }

    private static int readLineNumber(TokenStream tokens) {
        Token token = tokens.next();
        if (token.getType() != TokenType.LINE_NUMBER) {
            throw new ParseException(SyntaxException.UNKNOWN_LINE,
                    "Expected line number but found " + token.describe());
        }
        return Integer.parseInt(token.getValue());
    }
}

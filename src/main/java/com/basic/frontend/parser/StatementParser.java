package com.basic.frontend.parser;

import java.util.ArrayList;
import java.util.List;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.basic.frontend.ast.EndStatement;
import com.basic.frontend.ast.ForStatement;
import com.basic.frontend.ast.GotoStatement;
import com.basic.frontend.ast.IfStatement;
import com.basic.frontend.ast.InputStatement;
import com.basic.frontend.ast.LetStatement;
import com.basic.frontend.ast.NextStatement;
import com.basic.frontend.ast.PauseStatement;
import com.basic.frontend.ast.PrintStatement;
import com.basic.frontend.ast.RemStatement;
import com.basic.frontend.ast.Statement;
import com.basic.frontend.ast.StatementKind;
import com.basic.frontend.ast.Variable;
import com.basic.frontend.config.ParserConfig;
import com.basic.frontend.exception.ParseException;
import com.basic.frontend.expression.Expression;
import com.basic.frontend.expression.ExpressionTranslator;
import com.basic.frontend.lexer.Token;
import com.basic.frontend.lexer.Token.TokenType;
import com.basic.frontend.lexer.TokenStream;

/**
 * Recursive-descent parser for the statement of one tokenized line.
 *
 * Expressions have no terminator of their own: the parser collects tokens of
 * expression kinds until it meets anything else, or a closing bracket that
 * belongs to an enclosing subscript. The collected slice is handed to the
 * {@link ExpressionTranslator}.
 *
 * Parsing only; nothing is evaluated and no partial node escapes a failure.
 */
public class StatementParser {
    private static final Logger log = LoggerFactory.getLogger(StatementParser.class);

    private final TokenStream tokens;
    private final int lineNumber;
    private final int maxIfDepth;
    private final ExpressionTranslator translator;
    private int ifDepth = 0;

    public StatementParser(TokenStream tokens, int lineNumber, ParserConfig config) {
        this.tokens = tokens;
        this.lineNumber = lineNumber;
        this.maxIfDepth = config.getMaxIfDepth();
        this.translator = new ExpressionTranslator(config.getMaxExpressionDepth(), config.getMaxExpressionLength());
    }

    /**
     * Parse the statement and require that it uses up the whole line.
     */
    public Statement parse() {
        Statement statement = parseStatement();

        if (!tokens.isAtEnd()) {
            throw new ParseException(lineNumber, "Unexpected trailing " + tokens.peek().describe());
        }
        return statement;
    }

    /**
     * Parse one statement starting at the cursor. Called again for IF branches.
     */
    public Statement parseStatement() {
        Token top = tokens.next();
        if (top.getType() != TokenType.KEYWORD) {
            throw new ParseException(lineNumber, "Expected statement keyword but found " + top.describe());
        }

        StatementKind kind = StatementKind.fromKeyword(top.getValue())
                .orElseThrow(() -> new ParseException(lineNumber, "Unsupported statement: " + top.getValue()));

        Statement statement = switch (kind) {
            case PRINT -> new PrintStatement(lineNumber, expectExpression(), acceptLineModifier());
            case LET -> parseLet();
            case REM -> new RemStatement(lineNumber, expectComment());
            case PAUSE -> new PauseStatement(lineNumber, expectExpression());
            case INPUT -> parseInput();
            case FOR -> parseFor();
            case NEXT -> new NextStatement(lineNumber, expectVariable());
            case GOTO -> new GotoStatement(lineNumber, expectExpression());
            case END -> new EndStatement(lineNumber);
            case IF -> parseIf();
        };

        log.debug("Parsed {} at line {}", kind, lineNumber);
        return statement;
    }

    private Statement parseLet() {
        Variable variable = expectVariable();
        expectOperator("=");
        return new LetStatement(lineNumber, variable, expectExpression());
    }

    private Statement parseInput() {
        Expression prompt = expectExpression();
        expectLineModifier();
        return new InputStatement(lineNumber, prompt, expectVariable());
    }

    private Statement parseFor() {
        Variable variable = expectVariable();
        expectOperator("=");
        Expression from = expectExpression();
        expectKeyword("TO");
        Expression to = expectExpression();
        Expression step = acceptKeyword("STEP") ? expectExpression() : null;
        return new ForStatement(lineNumber, variable, from, to, step);
    }

    private Statement parseIf() {
        ifDepth++;
        if (ifDepth > maxIfDepth) {
            throw new ParseException(lineNumber, "IF statements nested deeper than " + maxIfDepth + " levels");
        }

        Expression condition = expectExpression();
        expectKeyword("THEN");
        Statement thenBranch = parseStatement();

        // A dangling ELSE has already been claimed by the innermost IF.
        Statement elseBranch = null;
        if (acceptKeyword("ELSE")) {
            elseBranch = parseStatement();
        }

        ifDepth--;
        return new IfStatement(lineNumber, condition, thenBranch, elseBranch);
    }

    private Expression expectExpression() {
        List<Token> slice = new ArrayList<>();
        int depth = 0;

        while (!tokens.isAtEnd() && tokens.peek().isExpressionPart()) {
            Token token = tokens.peek();

            // A closer at depth 0 belongs to the enclosing subscript.
            if (depth == 0 && token.isClosingBracket()) {
                break;
            }

            tokens.next();

            if (token.isOpeningBracket()) {
                depth++;
            } else if (token.isClosingBracket()) {
                depth--;
            }

            slice.add(token);
        }

        if (slice.isEmpty()) {
            throw new ParseException(lineNumber, "Expected expression but found " + tokens.peek().describe());
        }

        return translator.translate(slice, lineNumber);
    }

    private Variable expectVariable() {
        Token token = tokens.next();
        if (token.getType() != TokenType.VARIABLE) {
            throw new ParseException(lineNumber, "Expected variable but found " + token.describe());
        }
        return new Variable(lineNumber, token.getValue(), acceptSubscript());
    }

    private Expression acceptSubscript() {
        if (!tokens.peek().isOperator("[")) {
            return null;
        }
        tokens.next();

        Expression subscript = expectExpression();
        expectOperator("]");
        return subscript;
    }

    private String expectComment() {
        Token token = tokens.next();

        if (token.getType() == TokenType.COMMENT) {
            return token.getValue();
        }
        if (token.getType() == TokenType.EOF) {
            return "";
        }
        throw new ParseException(lineNumber, "Expected comment but found " + token.describe());
    }

    private boolean acceptKeyword(String keyword) {
        if (tokens.peek().isKeyword(keyword)) {
            tokens.next();
            return true;
        }
        return false;
    }

    private void expectKeyword(String keyword) {
        if (!acceptKeyword(keyword)) {
            throw new ParseException(lineNumber, "Expected " + keyword + " but found " + tokens.peek().describe());
        }
    }

    private void expectOperator(String symbol) {
        Token token = tokens.next();
        if (!token.isOperator(symbol)) {
            throw new ParseException(lineNumber, "Expected '" + symbol + "' but found " + token.describe());
        }
    }

    private boolean acceptLineModifier() {
        if (tokens.peek().getType() == TokenType.LINE_MODIFIER) {
            tokens.next();
            return true;
        }
        return false;
    }

    private void expectLineModifier() {
        if (!acceptLineModifier()) {
            throw new ParseException(lineNumber, "Expected ';' but found " + tokens.peek().describe());
        }
    }
}

package com.basic.frontend.expression;

import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

import com.basic.frontend.exception.ParseException;
import com.basic.frontend.lexer.Token;

/**
 * Translates an isolated slice of expression tokens into an expression tree.
 *
 * Precedence, loosest first: AND/OR, comparisons, + and -, * / and %, unary minus.
 * Binary operators of equal precedence group to the left. The translator only
 * reads the slice it is given and never touches the statement parser's cursor.
 */
public class ExpressionTranslator {

    private final int maxDepth;
    private final int maxLength;

    public ExpressionTranslator(int maxDepth, int maxLength) {
        this.maxDepth = maxDepth;
        this.maxLength = maxLength;
    }

    public Expression translate(List<Token> slice, int lineNumber) {
        if (slice.isEmpty()) {
            throw new ParseException(lineNumber, "Expected expression");
        }
        if (slice.size() > maxLength) {
            throw new ParseException(lineNumber, "Expression longer than " + maxLength + " tokens");
        }

        Translation translation = new Translation(slice, lineNumber);
        Expression result = translation.expression();

        if (!translation.isAtEnd()) {
            throw new ParseException(lineNumber, "Unexpected " + translation.peek().describe() + " in expression");
        }
        return result;
    }

    /**
     * Cursor state for a single translation.
     */
    private class Translation {
        private final List<Token> tokens;
        private final int lineNumber;
        private int pos = 0;
        private int depth = 0;

        Translation(List<Token> tokens, int lineNumber) {
            this.tokens = tokens;
            this.lineNumber = lineNumber;
        }

        Expression expression() {
            return binary(BinaryOperator.LOWEST_PRECEDENCE);
        }

        private Expression binary(int minPrecedence) {
            Expression left = unary();

            while (true) {
                Optional<BinaryOperator> operator = BinaryOperator.fromToken(peek());
                if (operator.isEmpty() || operator.get().getPrecedence() < minPrecedence) {
                    return left;
                }
                advance();
                Expression right = binary(operator.get().getPrecedence() + 1);
                left = new BinaryOperation(left, operator.get(), right);
            }
        }

        private Expression unary() {
            if (peek().isOperator(UnaryOperation.NEGATE)) {
                advance();
                enter();
                Expression operand = unary();
                exit();
                return new UnaryOperation(operand);
            }
            return primary();
        }

        private Expression primary() {
            Token token = peek();

            switch (token.getType()) {
                case NUMBER:
                    advance();
                    return NumberLiteral.of(token.getValue());
                case STRING:
                    advance();
                    return new StringLiteral(token.getValue());
                case CONSTANT:
                    advance();
                    return new ConstantReference(token.getValue());
                case VARIABLE:
                    advance();
                    return variable(token.getValue());
                case FUNCTION:
                    advance();
                    return call(token.getValue());
                case OPERATOR:
                    if (token.isOperator("(")) {
                        advance();
                        enter();
                        Expression inner = expression();
                        expectOperator(")");
                        exit();
                        return inner;
                    }
                    break;
                case EOF:
                    throw new ParseException(lineNumber, "Expected operand but reached end of expression");
                default:
                    break;
            }

            throw new ParseException(lineNumber, "Expected operand but found " + token.describe());
        }

        private Expression variable(String name) {
            if (!peek().isOperator("[")) {
                return VariableAccess.scalar(name);
            }
            advance();
            enter();
            Expression subscript = expression();
            expectOperator("]");
            exit();
            return new VariableAccess(name, subscript);
        }

        private Expression call(String name) {
            expectOperator("(");
            enter();

            List<Expression> arguments = new ArrayList<>();
            if (!peek().isOperator(")")) {
                arguments.add(expression());
                while (peek().isOperator(",")) {
                    advance();
                    arguments.add(expression());
                }
            }

            expectOperator(")");
            exit();
            return new FunctionCall(name, arguments);
        }

        private void enter() {
            depth++;
            if (depth > maxDepth) {
                throw new ParseException(lineNumber, "Expression nested deeper than " + maxDepth + " levels");
            }
        }

        private void exit() {
            depth--;
        }

        private void expectOperator(String symbol) {
            Token token = peek();
            if (!token.isOperator(symbol)) {
                throw new ParseException(lineNumber, "Expected '" + symbol + "' but found " + token.describe());
            }
            advance();
        }

        boolean isAtEnd() {
            return pos >= tokens.size();
        }

        Token peek() {
            return isAtEnd() ? Token.EOF : tokens.get(pos);
        }

        private void advance() {
            if (!isAtEnd()) pos++;
        }
    }
}

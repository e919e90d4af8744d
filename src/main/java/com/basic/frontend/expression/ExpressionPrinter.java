package com.basic.frontend.expression;

import java.util.stream.Collectors;

/**
 * Renders an expression tree as text with every operation parenthesized, so the
 * grouping chosen by the translator is visible, e.g. {@code (A + (B * 2))}.
 */
public class ExpressionPrinter implements ExpressionVisitor<String> {

    public String print(Expression expression) {
        return expression.accept(this);
    }

    @Override
    public String visitNumber(NumberLiteral number) {
        return number.getLexeme();
    }

    @Override
    public String visitString(StringLiteral string) {
        return "\"" + string.getBody() + "\"";
    }

    @Override
    public String visitConstant(ConstantReference constant) {
        return constant.getName();
    }

    @Override
    public String visitVariable(VariableAccess variable) {
        if (!variable.isSubscripted()) {
            return variable.getName();
        }
        return variable.getName() + "[" + print(variable.getSubscript()) + "]";
    }

    @Override
    public String visitCall(FunctionCall call) {
        return call.getName() + call.getArguments().stream()
                .map(this::print)
                .collect(Collectors.joining(", ", "(", ")"));
    }

    @Override
    public String visitUnary(UnaryOperation unary) {
        return "(" + unary.getOperator() + print(unary.getOperand()) + ")";
    }

    @Override
    public String visitBinary(BinaryOperation binary) {
        return "(" + print(binary.getLeft()) + " " + binary.getOperator().getSymbol() + " "
                + print(binary.getRight()) + ")";
    }
}

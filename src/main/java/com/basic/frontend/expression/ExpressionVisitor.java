package com.basic.frontend.expression;

/**
 * Visitor over expression tree nodes.
 */
public interface ExpressionVisitor<R> {

    R visitNumber(NumberLiteral number);

    R visitString(StringLiteral string);

    R visitConstant(ConstantReference constant);

    R visitVariable(VariableAccess variable);

    R visitCall(FunctionCall call);

    R visitUnary(UnaryOperation unary);

    R visitBinary(BinaryOperation binary);
}

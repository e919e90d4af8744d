package com.basic.frontend.cli.output;

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
import com.basic.frontend.ast.StatementVisitor;
import com.basic.frontend.ast.Variable;
import com.basic.frontend.expression.Expression;
import com.basic.frontend.expression.ExpressionPrinter;

/**
 * Renders a statement node back to one line of source-like text, with
 * expressions fully parenthesized.
 */
public class StatementPrinter implements StatementVisitor<String> {

    private final ExpressionPrinter expressions = new ExpressionPrinter();

    /**
     * Statement prefixed with its line number.
     */
    public String print(Statement statement) {
        return statement.getLineNumber() + " " + statement.accept(this);
    }

    @Override
    public String visitPrint(PrintStatement statement) {
        return "PRINT " + expr(statement.getExpression()) + (statement.isLineModifier() ? ";" : "");
    }

    @Override
    public String visitLet(LetStatement statement) {
        return "LET " + variable(statement.getVariable()) + " = " + expr(statement.getValue());
    }

    @Override
    public String visitRem(RemStatement statement) {
        return statement.getComment().isEmpty() ? "REM" : "REM " + statement.getComment();
    }

    @Override
    public String visitPause(PauseStatement statement) {
        return "PAUSE " + expr(statement.getDuration());
    }

    @Override
    public String visitInput(InputStatement statement) {
        return "INPUT " + expr(statement.getPrompt()) + "; " + variable(statement.getVariable());
    }

    @Override
    public String visitFor(ForStatement statement) {
        String text = "FOR " + variable(statement.getVariable()) + " = " + expr(statement.getFrom())
                + " TO " + expr(statement.getTo());
        if (statement.hasStep()) {
            text += " STEP " + expr(statement.getStep());
        }
        return text;
    }

    @Override
    public String visitNext(NextStatement statement) {
        return "NEXT " + variable(statement.getVariable());
    }

    @Override
    public String visitGoto(GotoStatement statement) {
        return "GOTO " + expr(statement.getTarget());
    }

    @Override
    public String visitEnd(EndStatement statement) {
        return "END";
    }

    @Override
    public String visitIf(IfStatement statement) {
        String text = "IF " + expr(statement.getCondition()) + " THEN " + statement.getThenBranch().accept(this);
        if (statement.hasElseBranch()) {
            text += " ELSE " + statement.getElseBranch().accept(this);
        }
        return text;
    }

    private String expr(Expression expression) {
        return expressions.print(expression);
    }

    private String variable(Variable variable) {
        if (!variable.isSubscripted()) {
            return variable.getName();
        }
        return variable.getName() + "[" + expr(variable.getSubscript()) + "]";
    }
}

package com.basic.frontend.ast;

/**
 * Visitor over statement nodes. Adding a statement kind adds a method here, so
 * every consumer has to handle it.
 */
public interface StatementVisitor<R> {

    R visitPrint(PrintStatement statement);

    R visitLet(LetStatement statement);

    R visitRem(RemStatement statement);

    R visitPause(PauseStatement statement);

    R visitInput(InputStatement statement);

    R visitFor(ForStatement statement);

    R visitNext(NextStatement statement);

    R visitGoto(GotoStatement statement);

    R visitEnd(EndStatement statement);

    R visitIf(IfStatement statement);
}

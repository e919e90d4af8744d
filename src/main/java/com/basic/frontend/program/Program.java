package com.basic.frontend.program;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.NavigableMap;
import java.util.TreeMap;

import com.basic.frontend.ast.Statement;

import lombok.Getter;

/**
 * Parsed program: statements keyed and ordered by line number, plus the
 * diagnostics gathered while parsing.
 */
public class Program {

    private final NavigableMap<Integer, Statement> statements;
    @Getter
    private final ParseDiagnostics diagnostics;

    Program(NavigableMap<Integer, Statement> statements, ParseDiagnostics diagnostics) {
        this.statements = Collections.unmodifiableNavigableMap(new TreeMap<>(statements));
        this.diagnostics = diagnostics;
    }

    /**
     * Statements in ascending line number order.
     */
    public List<Statement> getStatements() {
        return new ArrayList<>(statements.values());
    }

    public int size() {
        return statements.size();
    }

    public boolean isValid() {
        return !diagnostics.hasErrors();
    }
}

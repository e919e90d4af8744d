package com.basic.frontend.cli.output;

import java.nio.file.Path;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.basic.frontend.ast.Statement;
import com.basic.frontend.config.ParserConfig;
import com.basic.frontend.lexer.Token;
import com.basic.frontend.lexer.TokenStream;
import com.basic.frontend.program.ParseDiagnostics;
import com.basic.frontend.program.Program;

/**
 * Responsible only for printing CLI output for the "check" command.
 * No validation, no parsing.
 */
public class CheckResultsPrinter {

    private static final Logger log = LoggerFactory.getLogger(CheckResultsPrinter.class);

    private final StatementPrinter statementPrinter = new StatementPrinter();

    public void printBanner(Path source, ParserConfig config) {
        log.info("=================================================");
        log.info("BASIC Syntax Check");
        log.info("=================================================");
        log.info("Source File: {}", source.toAbsolutePath());
        log.info("Max IF Depth: {}", config.getMaxIfDepth());
        log.info("Max Expression Depth: {}", config.getMaxExpressionDepth());
        log.info("Max Expression Length: {}", config.getMaxExpressionLength());
        log.info("Known Functions: {}", config.getFunctionRegistry().getFunctionNames().size());
        log.info("=================================================");
    }

    public void printTokens(TokenStream tokens) {
        StringBuilder sb = new StringBuilder();
        for (Token token : tokens.getTokens()) {
            if (sb.length() > 0) {
                sb.append(' ');
            }
            sb.append(token.getType()).append('(').append(token.getValue()).append(')');
        }
        log.info("  {}", sb);
    }

    public void printStatements(Program program) {
        log.info("");
        log.info("Statements:");
        for (Statement statement : program.getStatements()) {
            log.info("  {}", statementPrinter.print(statement));
        }
    }

    public void printSummary(Program program) {
        ParseDiagnostics diagnostics = program.getDiagnostics();

        log.info("");
        log.info("=================================================");
        log.info(program.isValid() ? "CHECK PASSED" : "CHECK FAILED");
        log.info("=================================================");
        log.info("Statements Parsed: {}", program.size());
        log.info("Errors: {}", diagnostics.getErrors().size());
        log.info("Warnings: {}", diagnostics.getWarnings().size());

        if (diagnostics.hasWarnings()) {
            log.info("");
            log.info("Warnings:");
            diagnostics.getWarnings().forEach(warning -> log.warn("  {}", warning));
        }
        if (diagnostics.hasErrors()) {
            log.info("");
            log.info("Errors:");
            diagnostics.getErrors().forEach(error -> log.error("  {}", error));
        }
    }
}

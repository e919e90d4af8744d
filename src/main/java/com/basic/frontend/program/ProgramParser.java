package com.basic.frontend.program;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;
import java.util.NavigableMap;
import java.util.TreeMap;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.basic.frontend.ast.Statement;
import com.basic.frontend.exception.SyntaxException;
import com.basic.frontend.parser.LineParser;

/**
 * Parses a whole program listing line by line.
 *
 * A line that fails to lex or parse is reported in the diagnostics and skipped;
 * the remaining lines are still parsed. When a line number appears twice the
 * later line replaces the earlier one.
 */
public class ProgramParser {
    private static final Logger log = LoggerFactory.getLogger(ProgramParser.class);

    private final LineParser lineParser;

    public ProgramParser(LineParser lineParser) {
        this.lineParser = lineParser;
    }

    public Program parse(Path sourceFile) throws IOException {
        List<String> lines = Files.readAllLines(sourceFile, StandardCharsets.UTF_8);
        return parse(lines);
    }

    public Program parse(List<String> lines) {
        ParseDiagnostics diagnostics = new ParseDiagnostics();
        NavigableMap<Integer, Statement> statements = new TreeMap<>();

        int sourceLine = 0;
        for (String line : lines) {
            sourceLine++;

            if (line.isBlank()) {
                continue;
            }

            try {
                Statement statement = lineParser.parseLine(line);
                Statement replaced = statements.put(statement.getLineNumber(), statement);
                if (replaced != null) {
                    diagnostics.getWarnings().add("Line " + statement.getLineNumber()
                            + " defined more than once; keeping the definition at source line " + sourceLine);
                }
            } catch (SyntaxException e) {
                diagnostics.getErrors().add("Source line " + sourceLine + ": " + e.describe());
                log.debug("Skipping source line {}: {}", sourceLine, e.getMessage());
            }
        }

        log.debug("Parsed {} statements, {} errors", statements.size(), diagnostics.getErrors().size());
        return new Program(statements, diagnostics);
    }
}

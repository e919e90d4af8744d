package com.basic.frontend.cli;

import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;
import java.util.concurrent.Callable;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.basic.frontend.cli.exception.OptionsValidationException;
import com.basic.frontend.cli.output.CheckResultsPrinter;
import com.basic.frontend.config.ParserConfig;
import com.basic.frontend.exception.SyntaxException;
import com.basic.frontend.lexer.TokenStream;
import com.basic.frontend.parser.LineParser;
import com.basic.frontend.program.Program;
import com.basic.frontend.program.ProgramParser;
import com.basic.frontend.registry.DefaultFunctionRegistry;

import picocli.CommandLine.Command;
import picocli.CommandLine.Option;
import picocli.CommandLine.Parameters;

/**
 * CLI command that parses a BASIC listing and reports every line that does not
 * lex or parse.
 */
@Command(
        name = "basic-check",
        mixinStandardHelpOptions = true,
        version = "basic-check 1.0.0",
        description = "Tokenizes and parses a line-numbered BASIC program and reports syntax errors."
)
public class CheckCommand implements Callable<Integer> {

    private static final Logger log = LoggerFactory.getLogger(CheckCommand.class);

    @Parameters(index = "0", paramLabel = "FILE", description = "BASIC source file to check")
    private Path source;

    @Option(names = {"--tokens", "-t"}, description = "Print the tokens of every line")
    private boolean showTokens;

    @Option(names = {"--tree"}, description = "Print the parsed statements")
    private boolean showTree;

    @Option(names = {"--max-if-depth"}, defaultValue = "" + ParserConfig.DEFAULT_MAX_IF_DEPTH,
            description = "Maximum nesting of IF statements on one line (default: ${DEFAULT-VALUE})")
    private int maxIfDepth;

    @Option(names = {"--max-expression-depth"}, defaultValue = "" + ParserConfig.DEFAULT_MAX_EXPRESSION_DEPTH,
            description = "Maximum nesting inside one expression (default: ${DEFAULT-VALUE})")
    private int maxExpressionDepth;

    @Option(names = {"--max-expression-length"}, defaultValue = "" + ParserConfig.DEFAULT_MAX_EXPRESSION_LENGTH,
            description = "Maximum number of tokens in one expression (default: ${DEFAULT-VALUE})")
    private int maxExpressionLength;

    @Option(names = {"--functions", "-f"}, description = "Additional function names known to the runtime (comma-separated)")
    private String extraFunctions;

    private final CheckResultsPrinter printer = new CheckResultsPrinter();

    @Override
    public Integer call() {
        try {
            validate();

            ParserConfig config = ParserConfig.builder()
                    .maxIfDepth(maxIfDepth)
                    .maxExpressionDepth(maxExpressionDepth)
                    .maxExpressionLength(maxExpressionLength)
                    .functionRegistry(DefaultFunctionRegistry.withAdditional(parseFunctionNames()))
                    .build();

            printer.printBanner(source, config);

            LineParser lineParser = new LineParser(config);
            List<String> lines = Files.readAllLines(source);
            Program program = new ProgramParser(lineParser).parse(lines);

            if (showTokens) {
                printTokens(lineParser, lines);
            }
            if (showTree) {
                printer.printStatements(program);
            }
            printer.printSummary(program);

            return program.isValid() ? 0 : 1;

        } catch (OptionsValidationException e) {
            e.getProblems().forEach(log::error);
            return 1;
        } catch (Exception e) {
            log.error("Check failed with exception", e);
            return 1;
        }
    }

    private void validate() {
        List<String> problems = new ArrayList<>();

        if (source == null || !Files.isRegularFile(source)) {
            problems.add("Source file does not exist or is not a file: " + source);
        }
        if (maxIfDepth < 1) {
            problems.add("Max IF depth must be >= 1. Got: " + maxIfDepth);
        }
        if (maxExpressionDepth < 1) {
            problems.add("Max expression depth must be >= 1. Got: " + maxExpressionDepth);
        }
        if (maxExpressionLength < 1) {
            problems.add("Max expression length must be >= 1. Got: " + maxExpressionLength);
        }

        if (!problems.isEmpty()) {
            throw new OptionsValidationException(problems);
        }
    }

    private void printTokens(LineParser lineParser, List<String> lines) {
        log.info("");
        log.info("Tokens:");
        for (String line : lines) {
            if (line.isBlank()) {
                continue;
            }
            try {
                TokenStream tokens = lineParser.tokenize(line);
                printer.printTokens(tokens);
            } catch (SyntaxException e) {
                // already part of the diagnostics
                log.debug("No tokens for '{}': {}", line, e.getMessage());
            }
        }
    }

    private List<String> parseFunctionNames() {
        if (extraFunctions == null || extraFunctions.isBlank()) {
            return List.of();
        }
        return Arrays.stream(extraFunctions.split(","))
                .map(String::trim)
                .filter(s -> !s.isEmpty())
                .toList();
    }
}

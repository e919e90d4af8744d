package com.basic.frontend;

import com.basic.frontend.cli.CheckCommand;
import picocli.CommandLine;

/**
 * Main entry point for the BASIC syntax checker.
 * Parses a line-numbered BASIC listing and reports lines that fail to lex or parse.
 */
public class BasicFrontendApplication {

    public static void main(String[] args) {
        int exitCode = new CommandLine(new CheckCommand()).execute(args);
        System.exit(exitCode);
    }
}

package com.basic.frontend.program;

import java.util.ArrayList;
import java.util.List;

import lombok.Getter;

/**
 * Errors and warnings collected while loading a program.
 *
 * Pure structure only: no logging, no formatting, no IO.
 */
@Getter
public class ParseDiagnostics {
    private final List<String> errors = new ArrayList<>();
    private final List<String> warnings = new ArrayList<>();

    public boolean hasErrors() {
        return !errors.isEmpty();
    }

    public boolean hasWarnings() {
        return !warnings.isEmpty();
    }
}

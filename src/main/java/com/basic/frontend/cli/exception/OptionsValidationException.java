package com.basic.frontend.cli.exception;

import java.util.List;

import lombok.Getter;

/**
 * Thrown by the check command when its options are unusable. Every problem found
 * is listed so the user can fix them all in one go.
 */
@Getter
public class OptionsValidationException extends RuntimeException {

	private static final long serialVersionUID = 1L;

	private final List<String> problems;

	public OptionsValidationException(List<String> problems) {
		super("Invalid options: " + String.join("; ", problems));
		this.problems = List.copyOf(problems);
	}
}

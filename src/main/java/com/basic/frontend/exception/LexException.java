package com.basic.frontend.exception;

/**
 * Raised when no token pattern matches at the current scan position, or when the
 * line does not start with a line number.
 */
public class LexException extends SyntaxException {

	private static final long serialVersionUID = 1L;

	public LexException(int lineNumber, String message) {
		super(lineNumber, message);
	}

	public LexException(int lineNumber, String message, Throwable cause) {
		super(lineNumber, message, cause);
	}
}

package com.basic.frontend.exception;

/**
 * Raised when the token sequence of a line violates the statement or expression
 * grammar.
 */
public class ParseException extends SyntaxException {

	private static final long serialVersionUID = 1L;

	public ParseException(int lineNumber, String message) {
		super(lineNumber, message);
	}
}

package com.basic.frontend.exception;

/**
 * Base class for failures raised while turning a source line into a statement.
 * Carries the line number of the offending line, or {@code -1} when the line
 * number itself could not be read.
 */
public abstract class SyntaxException extends RuntimeException {

	private static final long serialVersionUID = 1L;

	public static final int UNKNOWN_LINE = -1;

	private final int lineNumber;

	protected SyntaxException(int lineNumber, String message) {
		super(message);
		this.lineNumber = lineNumber;
	}

	protected SyntaxException(int lineNumber, String message, Throwable cause) {
		super(message, cause);
		this.lineNumber = lineNumber;
	}

	public int getLineNumber() {
		return lineNumber;
	}

	/**
	 * Message prefixed with the line number, suitable for diagnostics output.
	 */
	public String describe() {
		if (lineNumber == UNKNOWN_LINE) {
			return getMessage();
		}
		return "Line " + lineNumber + ": " + getMessage();
	}
}

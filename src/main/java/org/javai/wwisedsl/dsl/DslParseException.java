package org.javai.wwisedsl.dsl;

import org.javai.wwisedsl.FailureKind;

/**
 * Exception thrown when a DSL line cannot be parsed.
 */
public class DslParseException extends RuntimeException {

	private final FailureKind kind;
	private final int lineNumber;

	public DslParseException(FailureKind kind, String message) {
		this(kind, 0, message, null);
	}

	public DslParseException(FailureKind kind, int lineNumber, String message, Throwable cause) {
		super(lineNumber > 0 ? "Line " + lineNumber + ": " + message : message, cause);
		this.kind = kind;
		this.lineNumber = lineNumber;
	}

	public FailureKind kind() {
		return kind;
	}

	/**
	 * 1-based source line, or 0 when the failing text was parsed on its own.
	 */
	public int lineNumber() {
		return lineNumber;
	}
}

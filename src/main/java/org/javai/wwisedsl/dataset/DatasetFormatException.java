package org.javai.wwisedsl.dataset;

/**
 * A dataset line is not a valid sample record.
 */
public class DatasetFormatException extends RuntimeException {

	private final int lineNumber;

	public DatasetFormatException(int lineNumber, String message, Throwable cause) {
		super("Line " + lineNumber + ": " + message, cause);
		this.lineNumber = lineNumber;
	}

	public int lineNumber() {
		return lineNumber;
	}
}

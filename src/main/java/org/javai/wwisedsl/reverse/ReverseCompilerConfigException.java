package org.javai.wwisedsl.reverse;

/**
 * Reverse compiler options could not be read.
 */
public class ReverseCompilerConfigException extends RuntimeException {

	public ReverseCompilerConfigException(String message) {
		super(message);
	}

	public ReverseCompilerConfigException(String message, Throwable cause) {
		super(message, cause);
	}
}

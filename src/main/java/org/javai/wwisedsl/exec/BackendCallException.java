package org.javai.wwisedsl.exec;

/**
 * A backend operation failed. Fatal only for the statement that issued it and for statements that
 * depend on the object it should have created.
 */
public class BackendCallException extends RuntimeException {

	public BackendCallException(String message) {
		super(message);
	}

	public BackendCallException(String message, Throwable cause) {
		super(message, cause);
	}
}

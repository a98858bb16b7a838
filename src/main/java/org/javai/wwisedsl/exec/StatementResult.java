package org.javai.wwisedsl.exec;

import org.javai.wwisedsl.FailureKind;
import org.javai.wwisedsl.dsl.Statement;
import org.javai.wwisedsl.registry.ObjectId;

/**
 * Per-statement execution outcome.
 *
 * @param index position of the statement in the executed sequence
 * @param statement the statement
 * @param failure why it failed, or {@code null} on success
 * @param objectId identifier of the object the statement created or acted on, when known
 * @param message failure description, {@code null} on success
 * @param error underlying exception, if any
 */
public record StatementResult(
		int index,
		Statement statement,
		FailureKind failure,
		ObjectId objectId,
		String message,
		Throwable error
) {

	public static StatementResult success(int index, Statement statement, ObjectId objectId) {
		return new StatementResult(index, statement, null, objectId, null, null);
	}

	public static StatementResult failure(int index, Statement statement, FailureKind failure, String message,
			Throwable error) {
		return new StatementResult(index, statement, failure, null, message, error);
	}

	public boolean success() {
		return failure == null;
	}
}

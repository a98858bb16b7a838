package org.javai.wwisedsl;

/**
 * Every way a statement can fail, from parsing through backend execution.
 */
public enum FailureKind {

	/** Line matches no statement rule, or names an unknown type, relation, action kind or value. */
	MALFORMED_STATEMENT,
	/** Quotes on the line do not pair up. */
	UNBALANCED_QUOTING,
	/** Leading keyword is not a known command. */
	UNKNOWN_COMMAND,
	/** Same name and type bound to two different identifiers. */
	REGISTRATION_CONFLICT,
	AMBIGUOUS_PARENT,
	AMBIGUOUS_TARGET,
	/** Name still unknown after the deferred retry. */
	UNRESOLVED_REFERENCE,
	/** References a name whose creation failed earlier. */
	DEPENDENCY_FAILED,
	BACKEND_CALL_FAILED
}

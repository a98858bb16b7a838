package org.javai.wwisedsl.dsl;

import java.util.List;

/**
 * Outcome of parsing a DSL text: the statements in source order and the lines that were skipped.
 */
public record ParseResult(List<Statement> statements, List<ParseError> errors) {

	public ParseResult {
		statements = statements != null ? List.copyOf(statements) : List.of();
		errors = errors != null ? List.copyOf(errors) : List.of();
	}

	public boolean isClean() {
		return errors.isEmpty();
	}
}

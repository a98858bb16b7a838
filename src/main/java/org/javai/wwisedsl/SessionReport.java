package org.javai.wwisedsl;

import java.util.ArrayList;
import java.util.List;
import org.javai.wwisedsl.dsl.ParseError;
import org.javai.wwisedsl.dsl.ParseResult;
import org.javai.wwisedsl.exec.ExecutionReport;
import org.javai.wwisedsl.exec.StatementResult;

/**
 * Outcome of replaying DSL text in a {@link CompilationSession}: the lines that did not parse and the
 * result of every statement that did.
 * <p>
 * Statements that succeeded stay applied even when others failed.
 */
public record SessionReport(List<ParseError> parseErrors, ExecutionReport execution) {

	public SessionReport {
		parseErrors = parseErrors != null ? List.copyOf(parseErrors) : List.of();
		execution = execution != null ? execution : new ExecutionReport(List.of(), 0, 0);
	}

	static SessionReport of(ParseResult parsed, ExecutionReport execution) {
		return new SessionReport(parsed.errors(), execution);
	}

	public boolean success() {
		return parseErrors.isEmpty() && execution.success();
	}

	/**
	 * Process exit status for the run: {@code 0} when every line parsed and every statement succeeded,
	 * {@code 1} otherwise.
	 */
	public int exitStatus() {
		return success() ? 0 : 1;
	}

	/**
	 * Count of lines or statements that failed with the given kind.
	 */
	public long count(FailureKind kind) {
		return parseErrors.stream().filter(e -> e.kind() == kind).count() + execution.count(kind);
	}

	/**
	 * One line per failure, parse errors first.
	 */
	public List<String> failureLog() {
		List<String> log = new ArrayList<>();
		for (ParseError error : parseErrors) {
			log.add("line " + error.lineNumber() + " " + error.kind() + ": " + error.message());
		}
		for (StatementResult result : execution.failures()) {
			log.add("statement " + (result.index() + 1) + " " + result.failure() + ": " + result.message());
		}
		return log;
	}
}

package org.javai.wwisedsl.exec;

import java.util.List;
import org.javai.wwisedsl.FailureKind;

/**
 * Captures the outcome of executing a statement sequence: one result per statement, in source order.
 *
 * @param results per-statement results
 * @param backendCalls number of backend operations issued
 * @param deferred number of statements postponed to the retry pass
 */
public record ExecutionReport(List<StatementResult> results, int backendCalls, int deferred) {

	public ExecutionReport {
		results = results != null ? List.copyOf(results) : List.of();
	}

	public boolean success() {
		return results.stream().allMatch(StatementResult::success);
	}

	public List<StatementResult> failures() {
		return results.stream().filter(r -> !r.success()).toList();
	}

	public long count(FailureKind kind) {
		return results.stream().filter(r -> r.failure() == kind).count();
	}

	public long succeeded() {
		return results.stream().filter(StatementResult::success).count();
	}
}

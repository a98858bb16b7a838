package org.javai.wwisedsl.dataset;

import java.util.Collections;
import java.util.EnumMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;
import org.javai.wwisedsl.dsl.StatementKind;
import org.javai.wwisedsl.reverse.ComplexityTag;
import org.javai.wwisedsl.reverse.Sample;
import org.javai.wwisedsl.reverse.SampleMetadata;

/**
 * Running totals over the samples of a batch: how many there are, how they spread over complexity
 * tags and how many statements of each kind they hold.
 */
public final class BatchStatistics {

	private final Map<ComplexityTag, Integer> complexity = new EnumMap<>(ComplexityTag.class);
	private final Map<StatementKind, Long> statements = new EnumMap<>(StatementKind.class);
	private final Set<String> sources = new LinkedHashSet<>();
	private int samples = 0;

	public BatchStatistics() {
		for (ComplexityTag tag : ComplexityTag.values()) {
			complexity.put(tag, 0);
		}
		for (StatementKind kind : StatementKind.values()) {
			statements.put(kind, 0L);
		}
	}

	public static BatchStatistics of(List<Sample> batch) {
		BatchStatistics statistics = new BatchStatistics();
		batch.forEach(statistics::add);
		return statistics;
	}

	public BatchStatistics add(Sample sample) {
		SampleMetadata metadata = sample.metadata();
		samples++;
		complexity.merge(metadata.complexity(), 1, Integer::sum);
		for (StatementKind kind : StatementKind.values()) {
			statements.merge(kind, (long) metadata.count(kind), Long::sum);
		}
		if (metadata.source() != null) {
			sources.add(metadata.source());
		}
		return this;
	}

	public int samples() {
		return samples;
	}

	public int count(ComplexityTag tag) {
		return complexity.get(tag);
	}

	/**
	 * Percentage of samples carrying the tag, 0 for an empty batch.
	 */
	public double share(ComplexityTag tag) {
		return samples == 0 ? 0.0 : complexity.get(tag) * 100.0 / samples;
	}

	public long statements(StatementKind kind) {
		return statements.get(kind);
	}

	public long totalStatements() {
		return statements.values().stream().mapToLong(Long::longValue).sum();
	}

	public Set<String> sources() {
		return Collections.unmodifiableSet(sources);
	}

	/**
	 * Multi-line human-readable report.
	 */
	public String summary() {
		StringBuilder sb = new StringBuilder();
		sb.append("Samples: ").append(samples).append('\n');
		sb.append("Sources: ").append(sources.size()).append('\n');
		sb.append("Complexity:\n");
		for (ComplexityTag tag : ComplexityTag.values()) {
			sb.append(String.format("  %-8s %5d (%.1f%%)%n", tag.label(), count(tag), share(tag)));
		}
		sb.append("Statements:\n");
		for (StatementKind kind : StatementKind.values()) {
			sb.append(String.format("  %-10s %6d%n", kind.keyword(), statements(kind)));
		}
		return sb.toString();
	}
}

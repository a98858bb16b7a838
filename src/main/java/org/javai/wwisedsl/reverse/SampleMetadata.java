package org.javai.wwisedsl.reverse;

import java.util.Collections;
import java.util.EnumMap;
import java.util.Map;
import java.util.Objects;
import org.javai.wwisedsl.dsl.StatementKind;
import org.javai.wwisedsl.model.ObjectType;

/**
 * Descriptive data carried with a sample.
 *
 * @param rootName name of the head node
 * @param rootType type of the head node
 * @param lineCount number of statements
 * @param depth deepest nesting below the head node, 0 for a sample with no inline children
 * @param complexity difficulty label
 * @param commands statement count per kind, every kind present
 * @param source where the tree came from, may be {@code null}
 */
public record SampleMetadata(
		String rootName,
		ObjectType rootType,
		int lineCount,
		int depth,
		ComplexityTag complexity,
		Map<StatementKind, Integer> commands,
		String source
) {

	public SampleMetadata {
		Objects.requireNonNull(rootName, "rootName must not be null");
		Objects.requireNonNull(rootType, "rootType must not be null");
		Objects.requireNonNull(complexity, "complexity must not be null");
		EnumMap<StatementKind, Integer> counts = new EnumMap<>(StatementKind.class);
		for (StatementKind kind : StatementKind.values()) {
			Integer count = commands != null ? commands.get(kind) : null;
			counts.put(kind, count != null ? count : 0);
		}
		commands = Collections.unmodifiableMap(counts);
	}

	public int count(StatementKind kind) {
		return commands.get(kind);
	}
}

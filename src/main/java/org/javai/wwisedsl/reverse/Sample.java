package org.javai.wwisedsl.reverse;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.Optional;
import org.javai.wwisedsl.dsl.DslRenderer;
import org.javai.wwisedsl.dsl.Statement;

/**
 * One unit of emitted DSL: the statements, their rendered text and descriptive metadata.
 * <p>
 * Samples are immutable. The only rewrite a sample ever sees is {@link #withHeadParent(String)},
 * applied by consistency repair.
 */
public record Sample(List<Statement> statements, String text, SampleMetadata metadata) {

	public Sample {
		statements = List.copyOf(statements);
		Objects.requireNonNull(text, "text must not be null");
		Objects.requireNonNull(metadata, "metadata must not be null");
		if (statements.isEmpty()) {
			throw new IllegalArgumentException("A sample needs at least one statement");
		}
	}

	public static Sample of(List<? extends Statement> statements, SampleMetadata metadata) {
		List<Statement> copy = List.copyOf(statements);
		return new Sample(copy, DslRenderer.render(copy), metadata);
	}

	public String rootName() {
		return metadata.rootName();
	}

	/**
	 * The head node's CREATE, absent when the head is a system object whose creation is not emitted.
	 */
	public Optional<Statement.Create> headCreate() {
		Statement first = statements.get(0);
		if (first instanceof Statement.Create create && create.name().equals(rootName())) {
			return Optional.of(create);
		}
		return Optional.empty();
	}

	/**
	 * Copy of this sample whose head CREATE is placed under {@code parentName}; the text is rendered again.
	 *
	 * @throws IllegalStateException if the sample has no head CREATE
	 */
	public Sample withHeadParent(String parentName) {
		Statement.Create head = headCreate()
				.orElseThrow(() -> new IllegalStateException("Sample \"" + rootName() + "\" has no head CREATE"));
		List<Statement> rewritten = new ArrayList<>(statements);
		rewritten.set(0, head.withParent(parentName));
		return Sample.of(rewritten, metadata);
	}
}

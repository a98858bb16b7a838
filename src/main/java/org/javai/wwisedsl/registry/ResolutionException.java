package org.javai.wwisedsl.registry;

import java.util.List;
import org.javai.wwisedsl.FailureKind;

/**
 * A name could not be resolved to exactly one identifier.
 * <p>
 * The candidate list lets callers inspect what the name matched; it is empty for unresolved names.
 */
public class ResolutionException extends RuntimeException {

	private final FailureKind kind;
	private final String name;
	private final List<RegistryEntry> candidates;

	public ResolutionException(FailureKind kind, String name, List<RegistryEntry> candidates) {
		super(describe(kind, name, candidates));
		this.kind = kind;
		this.name = name;
		this.candidates = candidates != null ? List.copyOf(candidates) : List.of();
	}

	public FailureKind kind() {
		return kind;
	}

	public String name() {
		return name;
	}

	public List<RegistryEntry> candidates() {
		return candidates;
	}

	private static String describe(FailureKind kind, String name, List<RegistryEntry> candidates) {
		if (candidates == null || candidates.isEmpty()) {
			return "No object named \"" + name + "\" is registered";
		}
		String types = candidates.stream().map(c -> c.type().dslName()).toList().toString();
		return switch (kind) {
			case AMBIGUOUS_PARENT -> "Parent \"" + name + "\" is ambiguous between " + types;
			case AMBIGUOUS_TARGET -> "Target \"" + name + "\" is ambiguous between " + types;
			default -> "Cannot resolve \"" + name + "\" (" + kind + "), candidates " + types;
		};
	}
}

package org.javai.wwisedsl.registry;

/**
 * What parent resolution does when two or more container-capable objects share the requested name.
 */
public enum ContainerTieBreak {
	/** Fail with an ambiguous-parent error listing the candidates. */
	REJECT,
	/** Pick the most recently registered container. */
	LATEST_WINS
}

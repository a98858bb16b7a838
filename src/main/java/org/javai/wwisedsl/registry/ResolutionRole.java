package org.javai.wwisedsl.registry;

/**
 * How a name is used by the statement that references it.
 */
public enum ResolutionRole {
	/** Parent of a CREATE; container-capable candidates win. */
	AS_PARENT,
	/** Subject or target of SET_PROP, LINK or ADD_ACTION; must be unique. */
	AS_TARGET
}

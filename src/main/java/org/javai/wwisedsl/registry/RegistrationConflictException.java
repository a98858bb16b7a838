package org.javai.wwisedsl.registry;

import org.javai.wwisedsl.model.ObjectType;

/**
 * A (name, type) pair was bound to an identifier different from the one it already has.
 */
public class RegistrationConflictException extends RuntimeException {

	private final String name;
	private final ObjectType type;
	private final ObjectId existing;
	private final ObjectId rejected;

	public RegistrationConflictException(String name, ObjectType type, ObjectId existing, ObjectId rejected) {
		super(type.dslName() + " \"" + name + "\" is already registered as " + existing + "; refusing " + rejected);
		this.name = name;
		this.type = type;
		this.existing = existing;
		this.rejected = rejected;
	}

	public String name() {
		return name;
	}

	public ObjectType type() {
		return type;
	}

	public ObjectId existing() {
		return existing;
	}

	public ObjectId rejected() {
		return rejected;
	}
}

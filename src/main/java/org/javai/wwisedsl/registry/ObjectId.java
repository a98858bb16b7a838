package org.javai.wwisedsl.registry;

import java.util.Objects;
import java.util.UUID;

/**
 * Opaque identifier of an object in the authoring backend.
 */
public record ObjectId(String value) {

	/**
	 * Identifier of the sentinel root. Never assigned by a backend and never registered.
	 */
	public static final ObjectId ROOT = new ObjectId("{00000000-0000-0000-0000-000000000000}");

	public ObjectId {
		Objects.requireNonNull(value, "value must not be null");
		if (value.isBlank()) {
			throw new IllegalArgumentException("Object id must not be blank");
		}
	}

	/**
	 * A fresh identifier in the backend's brace-wrapped GUID style.
	 */
	public static ObjectId random() {
		return new ObjectId("{" + UUID.randomUUID().toString().toUpperCase() + "}");
	}

	public boolean isRoot() {
		return ROOT.equals(this);
	}

	@Override
	public String toString() {
		return value;
	}
}

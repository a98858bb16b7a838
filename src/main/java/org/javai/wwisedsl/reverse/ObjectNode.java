package org.javai.wwisedsl.reverse;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import org.javai.wwisedsl.model.ActionKind;
import org.javai.wwisedsl.model.ObjectType;
import org.javai.wwisedsl.model.PropertyValue;
import org.javai.wwisedsl.model.Relation;

/**
 * One object of a decoded project tree.
 * <p>
 * Names are not unique across the tree. Properties keep their insertion order, which is the order
 * the reverse compiler emits them in.
 *
 * @param type object type
 * @param name object name
 * @param properties property values by name
 * @param references typed references to other objects, by target name
 * @param children child objects in project order
 * @param actions event actions, only allowed on {@link ObjectType#EVENT} nodes
 */
public record ObjectNode(
		ObjectType type,
		String name,
		Map<String, PropertyValue> properties,
		List<Reference> references,
		List<ObjectNode> children,
		List<Action> actions
) {

	public ObjectNode {
		Objects.requireNonNull(type, "type must not be null");
		if (name == null || name.isEmpty()) {
			throw new IllegalArgumentException("Node name must not be empty");
		}
		properties = properties != null
				? Collections.unmodifiableMap(new LinkedHashMap<>(properties))
				: Map.of();
		references = references != null ? List.copyOf(references) : List.of();
		children = children != null ? List.copyOf(children) : List.of();
		actions = actions != null ? List.copyOf(actions) : List.of();
		if (!actions.isEmpty() && type != ObjectType.EVENT) {
			throw new IllegalArgumentException(type + " \"" + name + "\" cannot carry event actions");
		}
	}

	public static Builder builder(ObjectType type, String name) {
		return new Builder(type, name);
	}

	/**
	 * A node with no properties, references or actions.
	 */
	public static ObjectNode of(ObjectType type, String name, ObjectNode... children) {
		return new ObjectNode(type, name, Map.of(), List.of(), List.of(children), List.of());
	}

	public record Reference(Relation relation, String targetName) {
		public Reference {
			Objects.requireNonNull(relation, "relation must not be null");
			if (targetName == null || targetName.isEmpty()) {
				throw new IllegalArgumentException("Reference target must not be empty");
			}
		}
	}

	public record Action(ActionKind kind, String targetName) {
		public Action {
			Objects.requireNonNull(kind, "kind must not be null");
			if (targetName == null || targetName.isEmpty()) {
				throw new IllegalArgumentException("Action target must not be empty");
			}
		}
	}

	public static final class Builder {
		private final ObjectType type;
		private final String name;
		private final Map<String, PropertyValue> properties = new LinkedHashMap<>();
		private final List<Reference> references = new ArrayList<>();
		private final List<ObjectNode> children = new ArrayList<>();
		private final List<Action> actions = new ArrayList<>();

		private Builder(ObjectType type, String name) {
			this.type = type;
			this.name = name;
		}

		public Builder property(String property, PropertyValue value) {
			properties.put(property, value);
			return this;
		}

		public Builder reference(Relation relation, String targetName) {
			references.add(new Reference(relation, targetName));
			return this;
		}

		public Builder child(ObjectNode child) {
			children.add(child);
			return this;
		}

		public Builder children(List<ObjectNode> nodes) {
			children.addAll(nodes);
			return this;
		}

		public Builder action(ActionKind kind, String targetName) {
			actions.add(new Action(kind, targetName));
			return this;
		}

		public ObjectNode build() {
			return new ObjectNode(type, name, properties, references, children, actions);
		}
	}
}

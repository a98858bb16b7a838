package org.javai.wwisedsl.dsl;

import java.util.List;
import java.util.Objects;
import org.javai.wwisedsl.model.ActionKind;
import org.javai.wwisedsl.model.ObjectType;
import org.javai.wwisedsl.model.PropertyValue;
import org.javai.wwisedsl.model.Relation;

/**
 * One DSL statement. Sealed to ensure all statement forms are known.
 * <p>
 * Statements are plain values: two statements parsed from the same line, or one rendered and parsed
 * again, are equal.
 */
public sealed interface Statement {

	StatementKind kind();

	/**
	 * Name of the object this statement creates or acts on.
	 */
	String subject();

	/**
	 * Names this statement needs resolved before it can run, in resolution order.
	 */
	List<String> references();

	/**
	 * {@code CREATE <Type> "<Name>" UNDER "<ParentName>"}
	 */
	record Create(ObjectType type, String name, String parentName) implements Statement {
		public Create {
			Objects.requireNonNull(type, "type must not be null");
			requireName(name, "name");
			requireName(parentName, "parentName");
		}

		@Override
		public StatementKind kind() {
			return StatementKind.CREATE;
		}

		@Override
		public String subject() {
			return name;
		}

		@Override
		public List<String> references() {
			return List.of(parentName);
		}

		/**
		 * Copy of this statement placed under a different parent.
		 */
		public Create withParent(String newParent) {
			return new Create(type, name, newParent);
		}
	}

	/**
	 * {@code SET_PROP "<Name>" "<PropName>" = <Value>}
	 */
	record SetProp(String name, String propName, PropertyValue value) implements Statement {
		public SetProp {
			requireName(name, "name");
			requireName(propName, "propName");
			Objects.requireNonNull(value, "value must not be null");
		}

		@Override
		public StatementKind kind() {
			return StatementKind.SET_PROP;
		}

		@Override
		public String subject() {
			return name;
		}

		@Override
		public List<String> references() {
			return List.of(name);
		}
	}

	/**
	 * {@code LINK "<Name>" TO "<TargetName>" AS "<Relation>"}
	 */
	record Link(String name, String targetName, Relation relation) implements Statement {
		public Link {
			requireName(name, "name");
			requireName(targetName, "targetName");
			Objects.requireNonNull(relation, "relation must not be null");
		}

		@Override
		public StatementKind kind() {
			return StatementKind.LINK;
		}

		@Override
		public String subject() {
			return name;
		}

		@Override
		public List<String> references() {
			return List.of(name, targetName);
		}
	}

	/**
	 * {@code ADD_ACTION "<EventName>" <ACTIONKIND> "<TargetName>"}
	 */
	record AddAction(String eventName, ActionKind actionKind, String targetName) implements Statement {
		public AddAction {
			requireName(eventName, "eventName");
			Objects.requireNonNull(actionKind, "actionKind must not be null");
			requireName(targetName, "targetName");
		}

		@Override
		public StatementKind kind() {
			return StatementKind.ADD_ACTION;
		}

		@Override
		public String subject() {
			return eventName;
		}

		@Override
		public List<String> references() {
			return List.of(eventName, targetName);
		}
	}

	private static void requireName(String value, String field) {
		if (value == null || value.isEmpty()) {
			throw new IllegalArgumentException(field + " must not be empty");
		}
	}
}

package org.javai.wwisedsl.exec;

import org.javai.wwisedsl.model.ActionKind;
import org.javai.wwisedsl.model.ObjectType;
import org.javai.wwisedsl.model.PropertyValue;
import org.javai.wwisedsl.model.Relation;
import org.javai.wwisedsl.registry.ObjectId;

/**
 * The four operations of the authoring backend. {@link ExecutionPlanner} is the only caller.
 * <p>
 * Implementations report failures by throwing {@link BackendCallException}.
 */
public interface BackendClient {

	/**
	 * Create an object, or return the existing one when the parent already holds an object of the
	 * same type and name.
	 *
	 * @param parentId parent identifier, {@link ObjectId#ROOT} for the type's top-level hierarchy
	 * @return identifier of the created object
	 */
	ObjectId create(ObjectType type, String name, ObjectId parentId);

	void setProperty(ObjectId id, String property, PropertyValue value);

	void link(ObjectId id, ObjectId targetId, Relation relation);

	void addAction(ObjectId eventId, ActionKind kind, ObjectId targetId);
}

package org.javai.wwisedsl.registry;

import org.javai.wwisedsl.model.ObjectType;

/**
 * One registered object.
 *
 * @param name object name, unique only within its type
 * @param type object type
 * @param id identifier assigned when the object was created
 * @param sequence registration order within the session, starting at 1
 * @param preexisting whether the object existed in the project before the session started
 */
public record RegistryEntry(String name, ObjectType type, ObjectId id, long sequence, boolean preexisting) {
}

package org.javai.wwisedsl.exec;

import java.util.ArrayList;
import java.util.EnumMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.function.Supplier;
import org.javai.wwisedsl.model.ActionKind;
import org.javai.wwisedsl.model.ObjectType;
import org.javai.wwisedsl.model.PropertyValue;
import org.javai.wwisedsl.model.Relation;
import org.javai.wwisedsl.registry.ObjectId;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Dry-run backend that keeps the project in memory.
 * <p>
 * Creation merges: asking for an object that already exists under the same parent with the same type
 * and name returns the existing identifier. Objects created under {@link ObjectId#ROOT} land in the
 * default work unit of their type's hierarchy.
 */
public class InMemoryBackend implements BackendClient {

	private static final Logger logger = LoggerFactory.getLogger(InMemoryBackend.class);

	private final Map<ObjectId, StoredObject> objects = new LinkedHashMap<>();
	private final Map<String, ObjectId> byPath = new LinkedHashMap<>();
	private final Supplier<ObjectId> idGenerator;
	private int calls = 0;

	public InMemoryBackend() {
		this(ObjectId::random);
	}

	public InMemoryBackend(Supplier<ObjectId> idGenerator) {
		this.idGenerator = idGenerator;
	}

	@Override
	public ObjectId create(ObjectType type, String name, ObjectId parentId) {
		calls++;
		return store(type, name, parentId);
	}

	private ObjectId store(ObjectType type, String name, ObjectId parentId) {
		String parentPath;
		if (parentId == null || parentId.isRoot()) {
			parentPath = type.hierarchy().rootPath();
		}
		else {
			StoredObject parent = require(parentId);
			if (!parent.type().isContainer()) {
				logger.debug("Creating {} \"{}\" under non-container {}", type, name, parent.path());
			}
			parentPath = parent.path();
		}
		String path = parentPath + "\\" + name;
		ObjectId existing = byPath.get(key(path, type));
		if (existing != null) {
			logger.debug("Merged {} \"{}\" into existing {}", type, name, existing);
			return existing;
		}
		ObjectId id = idGenerator.get();
		objects.put(id, new StoredObject(id, type, name, path));
		byPath.put(key(path, type), id);
		logger.debug("Created {} at {} as {}", type, path, id);
		return id;
	}

	@Override
	public void setProperty(ObjectId id, String property, PropertyValue value) {
		calls++;
		require(id).properties().put(property, value);
	}

	@Override
	public void link(ObjectId id, ObjectId targetId, Relation relation) {
		calls++;
		StoredObject owner = require(id);
		require(targetId);
		owner.references().put(relation, targetId);
	}

	@Override
	public void addAction(ObjectId eventId, ActionKind kind, ObjectId targetId) {
		calls++;
		StoredObject event = require(eventId);
		if (event.type() != ObjectType.EVENT) {
			throw new BackendCallException("Actions can only be added to events, not to " + event.type()
					+ " " + event.path());
		}
		require(targetId);
		event.actions().add(new StoredAction(kind, targetId));
	}

	public Optional<StoredObject> find(ObjectId id) {
		return Optional.ofNullable(objects.get(id));
	}

	public Optional<StoredObject> findByPath(String path, ObjectType type) {
		return Optional.ofNullable(byPath.get(key(path, type))).map(objects::get);
	}

	/**
	 * Add an object that exists in the project before any session runs. Not counted as a call.
	 */
	public ObjectId seed(ObjectType type, String name) {
		return store(type, name, ObjectId.ROOT);
	}

	public int size() {
		return objects.size();
	}

	public int calls() {
		return calls;
	}

	private StoredObject require(ObjectId id) {
		StoredObject object = id != null ? objects.get(id) : null;
		if (object == null) {
			throw new BackendCallException("No object with id " + id);
		}
		return object;
	}

	private static String key(String path, ObjectType type) {
		return type.name() + ":" + path;
	}

	/**
	 * Object state held by the backend. Properties, references and actions are live views.
	 */
	public record StoredObject(
			ObjectId id,
			ObjectType type,
			String name,
			String path,
			Map<String, PropertyValue> properties,
			Map<Relation, ObjectId> references,
			List<StoredAction> actions
	) {
		StoredObject(ObjectId id, ObjectType type, String name, String path) {
			this(id, type, name, path, new LinkedHashMap<>(), new EnumMap<>(Relation.class), new ArrayList<>());
		}
	}

	public record StoredAction(ActionKind kind, ObjectId targetId) {
	}
}

package org.javai.wwisedsl.registry;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.Set;
import java.util.function.Supplier;
import org.javai.wwisedsl.FailureKind;
import org.javai.wwisedsl.model.ObjectType;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Session-scoped identity map from (name, type) to object identifier.
 * <p>
 * Names are unique only within a type. Entries are never removed; once a (name, type) pair is
 * registered it resolves to the same identifier for the rest of the session. A registry belongs to
 * one session and is not thread-safe; create one per compile or replay run.
 */
public final class ObjectRegistry {

	private static final Logger logger = LoggerFactory.getLogger(ObjectRegistry.class);

	/**
	 * Parent literal that always resolves to {@link ObjectId#ROOT}.
	 */
	public static final String SENTINEL_ROOT_NAME = "Default Work Unit";

	/**
	 * Short parent literal for the sentinel root, reserved only while no object of that name is registered.
	 */
	public static final String ROOT_ALIAS = "Root";

	private final Map<Key, RegistryEntry> entries = new LinkedHashMap<>();
	private final Map<String, List<RegistryEntry>> byName = new LinkedHashMap<>();
	private final Supplier<ObjectId> idGenerator;
	private final ContainerTieBreak tieBreak;
	private long sequence = 0;

	private ObjectRegistry(Supplier<ObjectId> idGenerator, ContainerTieBreak tieBreak) {
		this.idGenerator = Objects.requireNonNull(idGenerator, "idGenerator must not be null");
		this.tieBreak = Objects.requireNonNull(tieBreak, "tieBreak must not be null");
	}

	/**
	 * Create an empty registry with random identifiers that rejects ambiguous container parents.
	 */
	public static ObjectRegistry create() {
		return new ObjectRegistry(ObjectId::random, ContainerTieBreak.REJECT);
	}

	public static ObjectRegistry create(Supplier<ObjectId> idGenerator, ContainerTieBreak tieBreak) {
		return new ObjectRegistry(idGenerator, tieBreak);
	}

	/**
	 * Whether the name is the sentinel root literal, ignoring case.
	 */
	public static boolean isSentinel(String name) {
		return name != null && name.strip().equalsIgnoreCase(SENTINEL_ROOT_NAME);
	}

	/**
	 * Whether a parent name denotes the sentinel root in this registry: the sentinel literal, or
	 * {@value #ROOT_ALIAS} in any case when no object is registered under that exact name.
	 */
	public boolean isRootParent(String name) {
		if (isSentinel(name)) {
			return true;
		}
		return name != null && name.strip().equalsIgnoreCase(ROOT_ALIAS) && !isRegistered(name);
	}

	/**
	 * Register a name under a type, allocating an identifier on first use.
	 * Repeated calls with the same arguments return the same identifier.
	 */
	public ObjectId register(String name, ObjectType type) {
		RegistryEntry existing = entries.get(new Key(requireName(name), type));
		if (existing != null) {
			return existing.id();
		}
		return add(name, type, idGenerator.get(), false).id();
	}

	/**
	 * Record the identifier a backend assigned to a created object.
	 *
	 * @throws RegistrationConflictException if the pair is already bound to a different identifier
	 */
	public RegistryEntry bind(String name, ObjectType type, ObjectId id) {
		return put(name, type, id, false);
	}

	/**
	 * Seed an object that exists in the project before the session starts (a bus, a shared attenuation).
	 * Such objects can be referenced but are never created by the session.
	 *
	 * @throws RegistrationConflictException if the pair is already bound to a different identifier
	 */
	public RegistryEntry registerExisting(String name, ObjectType type, ObjectId id) {
		return put(name, type, id, true);
	}

	private RegistryEntry put(String name, ObjectType type, ObjectId id, boolean preexisting) {
		Objects.requireNonNull(id, "id must not be null");
		if (id.isRoot()) {
			throw new IllegalArgumentException("The sentinel root id cannot be registered");
		}
		RegistryEntry existing = entries.get(new Key(requireName(name), type));
		if (existing != null) {
			if (!existing.id().equals(id)) {
				throw new RegistrationConflictException(name, type, existing.id(), id);
			}
			return existing;
		}
		return add(name, type, id, preexisting);
	}

	private RegistryEntry add(String name, ObjectType type, ObjectId id, boolean preexisting) {
		RegistryEntry entry = new RegistryEntry(name, type, id, ++sequence, preexisting);
		entries.put(new Key(name, type), entry);
		byName.computeIfAbsent(name, k -> new ArrayList<>()).add(entry);
		logger.debug("Registered {} \"{}\" as {}", type.dslName(), name, id);
		return entry;
	}

	/**
	 * Resolve a name for the given role.
	 *
	 * @throws ResolutionException with {@link FailureKind#UNRESOLVED_REFERENCE},
	 * {@link FailureKind#AMBIGUOUS_PARENT} or {@link FailureKind#AMBIGUOUS_TARGET}
	 */
	public ObjectId resolve(String name, ResolutionRole role) {
		return resolve(name, role, Set.of());
	}

	/**
	 * Resolve a name, narrowing an ambiguous target to the candidates whose type is in {@code expectedTypes}.
	 * An empty set applies no narrowing. Parent resolution ignores the expected types.
	 */
	public ObjectId resolve(String name, ResolutionRole role, Set<ObjectType> expectedTypes) {
		if (role == ResolutionRole.AS_PARENT && isRootParent(name)) {
			return ObjectId.ROOT;
		}
		List<RegistryEntry> candidates = candidates(name);
		if (candidates.isEmpty()) {
			throw new ResolutionException(FailureKind.UNRESOLVED_REFERENCE, name, List.of());
		}
		RegistryEntry chosen = select(candidates, role, expectedTypes);
		if (chosen == null) {
			throw ambiguity(name, role, candidates);
		}
		return chosen.id();
	}

	/**
	 * The entry a name resolves to for the role, without failing.
	 *
	 * @return empty when the name is unknown, ambiguous or denotes the sentinel root
	 */
	public Optional<RegistryEntry> find(String name, ResolutionRole role, Set<ObjectType> expectedTypes) {
		if (role == ResolutionRole.AS_PARENT && isRootParent(name)) {
			return Optional.empty();
		}
		List<RegistryEntry> candidates = candidates(name);
		return candidates.isEmpty() ? Optional.empty() : Optional.ofNullable(select(candidates, role, expectedTypes));
	}

	private RegistryEntry select(List<RegistryEntry> candidates, ResolutionRole role, Set<ObjectType> expectedTypes) {
		if (role == ResolutionRole.AS_PARENT) {
			List<RegistryEntry> containers = containers(candidates);
			if (containers.size() == 1) {
				return containers.get(0);
			}
			if (containers.size() > 1) {
				return tieBreak == ContainerTieBreak.LATEST_WINS ? containers.get(containers.size() - 1) : null;
			}
			return candidates.size() == 1 ? candidates.get(0) : null;
		}
		if (candidates.size() == 1) {
			return candidates.get(0);
		}
		if (expectedTypes != null && !expectedTypes.isEmpty()) {
			List<RegistryEntry> narrowed = candidates.stream()
					.filter(c -> expectedTypes.contains(c.type()))
					.toList();
			if (narrowed.size() == 1) {
				return narrowed.get(0);
			}
		}
		return null;
	}

	private static ResolutionException ambiguity(String name, ResolutionRole role, List<RegistryEntry> candidates) {
		if (role == ResolutionRole.AS_PARENT) {
			List<RegistryEntry> containers = containers(candidates);
			return new ResolutionException(FailureKind.AMBIGUOUS_PARENT, name,
					containers.size() > 1 ? containers : candidates);
		}
		return new ResolutionException(FailureKind.AMBIGUOUS_TARGET, name, candidates);
	}

	private static List<RegistryEntry> containers(List<RegistryEntry> candidates) {
		return candidates.stream().filter(c -> c.type().isContainer()).toList();
	}

	/**
	 * All entries registered under a name, in registration order.
	 */
	public List<RegistryEntry> candidates(String name) {
		List<RegistryEntry> found = byName.get(name);
		return found != null ? List.copyOf(found) : List.of();
	}

	/**
	 * Whether any type has an entry under this name. The sentinel root is not an entry.
	 */
	public boolean isRegistered(String name) {
		return byName.containsKey(name);
	}

	public Optional<RegistryEntry> lookup(String name, ObjectType type) {
		return Optional.ofNullable(entries.get(new Key(name, type)));
	}

	public int size() {
		return entries.size();
	}

	private static String requireName(String name) {
		if (name == null || name.isEmpty()) {
			throw new IllegalArgumentException("Object name must not be empty");
		}
		return name;
	}

	private record Key(String name, ObjectType type) {
	}
}

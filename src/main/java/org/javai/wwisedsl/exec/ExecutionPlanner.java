package org.javai.wwisedsl.exec;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.EnumSet;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.Set;
import java.util.function.Supplier;
import java.util.stream.Collectors;
import org.javai.wwisedsl.FailureKind;
import org.javai.wwisedsl.dsl.DslRenderer;
import org.javai.wwisedsl.dsl.Statement;
import org.javai.wwisedsl.model.ObjectType;
import org.javai.wwisedsl.model.PropertyValue;
import org.javai.wwisedsl.model.Relation;
import org.javai.wwisedsl.registry.ObjectId;
import org.javai.wwisedsl.registry.ObjectRegistry;
import org.javai.wwisedsl.registry.RegistrationConflictException;
import org.javai.wwisedsl.registry.RegistryEntry;
import org.javai.wwisedsl.registry.ResolutionException;
import org.javai.wwisedsl.registry.ResolutionRole;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Sequential executor that turns statements into backend calls.
 * <p>
 * Statements run in source order. A statement naming an object that is not registered yet is
 * deferred; deferred statements are retried once, in their original order, after the first pass.
 * This handles a reference to an object created further down the text but is not a full dependency
 * sort: a deferred statement that needs another deferred statement retried after it still fails.
 * <p>
 * A failure never stops the run. When a CREATE fails its name and type are marked failed, and every
 * later statement whose reference resolves to that object, or would have resolved to it had the
 * CREATE succeeded, fails with {@link FailureKind#DEPENDENCY_FAILED}. Objects of other types sharing
 * the name are unaffected. A CREATE or LINK that fails this way marks its own subject failed in turn.
 */
public class ExecutionPlanner {

	private static final Logger logger = LoggerFactory.getLogger(ExecutionPlanner.class);

	private static final Map<Relation, String> OVERRIDE_PROPERTIES = Map.of(
			Relation.OUTPUT_BUS, "OverrideOutput",
			Relation.ATTENUATION, "OverridePositioning");

	private final BackendClient backend;
	private final PlannerOptions options;

	public ExecutionPlanner(BackendClient backend) {
		this(backend, PlannerOptions.defaults());
	}

	public ExecutionPlanner(BackendClient backend, PlannerOptions options) {
		this.backend = Objects.requireNonNull(backend, "backend must not be null");
		this.options = options != null ? options : PlannerOptions.defaults();
	}

	public PlannerOptions options() {
		return options;
	}

	/**
	 * Execute statements against the backend, resolving and binding names through {@code registry}.
	 *
	 * @return one result per statement, in source order
	 */
	public ExecutionReport execute(List<? extends Statement> statements, ObjectRegistry registry) {
		Objects.requireNonNull(registry, "registry must not be null");
		if (statements == null || statements.isEmpty()) {
			return new ExecutionReport(List.of(), 0, 0);
		}

		Run run = new Run(registry);
		StatementResult[] results = new StatementResult[statements.size()];
		List<Integer> deferred = new ArrayList<>();

		for (int i = 0; i < statements.size(); i++) {
			StatementResult result = attempt(i, statements.get(i), run, false);
			if (result == null) {
				deferred.add(i);
			}
			else {
				results[i] = result;
			}
		}

		if (!deferred.isEmpty()) {
			logger.debug("Retrying {} deferred statement(s)", deferred.size());
		}
		for (int index : deferred) {
			results[index] = attempt(index, statements.get(index), run, true);
		}

		ExecutionReport report = new ExecutionReport(Arrays.asList(results), run.calls, deferred.size());
		logger.info("Executed {} statement(s): {} succeeded, {} failed, {} backend call(s)",
				statements.size(), report.succeeded(), report.failures().size(), run.calls);
		return report;
	}

	/**
	 * @return the result, or {@code null} when the statement is deferred to the retry pass
	 */
	private StatementResult attempt(int index, Statement statement, Run run, boolean retry) {
		for (Reference reference : references(statement)) {
			if (run.dependsOnFailure(reference)) {
				if (!reference.name().equals(statement.subject())) {
					markSubjectTainted(statement, run);
				}
				return fail(index, statement, FailureKind.DEPENDENCY_FAILED,
						"Depends on \"" + reference.name() + "\" which failed earlier", null);
			}
		}

		String missing = firstUnregistered(statement, run.registry);
		if (missing != null) {
			if (!retry) {
				logger.debug("Deferring {}: \"{}\" is not registered yet", statement.kind(), missing);
				return null;
			}
			markCreateFailed(statement, run);
			return fail(index, statement, FailureKind.UNRESOLVED_REFERENCE,
					"No object named \"" + missing + "\" is registered", null);
		}

		try {
			ObjectId id = dispatch(statement, run);
			if (statement instanceof Statement.Create create) {
				run.cleared(create.name(), create.type());
			}
			return StatementResult.success(index, statement, id);
		}
		catch (ResolutionException ex) {
			markCreateFailed(statement, run);
			return fail(index, statement, ex.kind(), ex.getMessage(), ex);
		}
		catch (RegistrationConflictException ex) {
			return fail(index, statement, FailureKind.REGISTRATION_CONFLICT, ex.getMessage(), ex);
		}
		catch (BackendCallException ex) {
			markCreateFailed(statement, run);
			return fail(index, statement, FailureKind.BACKEND_CALL_FAILED, ex.getMessage(), ex);
		}
	}

	private ObjectId dispatch(Statement statement, Run run) {
		ObjectRegistry registry = run.registry;
		if (statement instanceof Statement.Create create) {
			ObjectId parentId = registry.resolve(create.parentName(), ResolutionRole.AS_PARENT);
			ObjectId id = run.call(() -> backend.create(create.type(), create.name(), parentId),
					"create " + create.type().dslName() + " \"" + create.name() + "\"");
			if (id == null) {
				throw new BackendCallException("Backend returned no id for \"" + create.name() + "\"");
			}
			registry.bind(create.name(), create.type(), id);
			return id;
		}
		if (statement instanceof Statement.SetProp setProp) {
			ObjectId id = registry.resolve(setProp.name(), ResolutionRole.AS_TARGET);
			run.invoke(() -> backend.setProperty(id, setProp.propName(), setProp.value()),
					"set " + setProp.propName() + " on \"" + setProp.name() + "\"");
			return id;
		}
		if (statement instanceof Statement.Link link) {
			ObjectId id = registry.resolve(link.name(), ResolutionRole.AS_TARGET);
			ObjectId targetId = registry.resolve(link.targetName(), ResolutionRole.AS_TARGET,
					link.relation().targetTypes());
			String override = OVERRIDE_PROPERTIES.get(link.relation());
			if (options.overrideOnLink() && override != null) {
				run.invoke(() -> backend.setProperty(id, override, PropertyValue.of(true)),
						"set " + override + " on \"" + link.name() + "\"");
			}
			run.invoke(() -> backend.link(id, targetId, link.relation()),
					"link \"" + link.name() + "\" to \"" + link.targetName() + "\"");
			return id;
		}
		if (statement instanceof Statement.AddAction action) {
			ObjectId eventId = registry.resolve(action.eventName(), ResolutionRole.AS_TARGET,
					Set.of(ObjectType.EVENT));
			ObjectId targetId = registry.resolve(action.targetName(), ResolutionRole.AS_TARGET);
			run.invoke(() -> backend.addAction(eventId, action.actionKind(), targetId),
					"add " + action.actionKind().keyword() + " action to \"" + action.eventName() + "\"");
			return eventId;
		}
		throw new IllegalStateException("Unsupported statement: " + statement);
	}

	private static String firstUnregistered(Statement statement, ObjectRegistry registry) {
		if (statement instanceof Statement.Create create) {
			String parent = create.parentName();
			return registry.isRootParent(parent) || registry.isRegistered(parent) ? null : parent;
		}
		for (String reference : statement.references()) {
			if (!registry.isRegistered(reference)) {
				return reference;
			}
		}
		return null;
	}

	/**
	 * Names a statement resolves, with the role and expected types each is resolved with.
	 */
	private static List<Reference> references(Statement statement) {
		if (statement instanceof Statement.Create create) {
			return List.of(new Reference(create.parentName(), ResolutionRole.AS_PARENT, Set.of()));
		}
		if (statement instanceof Statement.Link link) {
			return List.of(new Reference(link.name(), ResolutionRole.AS_TARGET, Set.of()),
					new Reference(link.targetName(), ResolutionRole.AS_TARGET, link.relation().targetTypes()));
		}
		if (statement instanceof Statement.AddAction action) {
			return List.of(new Reference(action.eventName(), ResolutionRole.AS_TARGET, Set.of(ObjectType.EVENT)),
					new Reference(action.targetName(), ResolutionRole.AS_TARGET, Set.of()));
		}
		return List.of(new Reference(statement.subject(), ResolutionRole.AS_TARGET, Set.of()));
	}

	/**
	 * A CREATE or LINK that cannot run because of an earlier failure taints its own subject.
	 */
	private static void markSubjectTainted(Statement statement, Run run) {
		if (statement instanceof Statement.Create create) {
			run.failed(create.name(), create.type());
		}
		else if (statement instanceof Statement.Link link) {
			run.registry.find(link.name(), ResolutionRole.AS_TARGET, Set.of())
					.ifPresent(entry -> run.failed(entry.name(), entry.type()));
		}
	}

	private static void markCreateFailed(Statement statement, Run run) {
		if (statement instanceof Statement.Create create) {
			run.failed(create.name(), create.type());
		}
	}

	private static StatementResult fail(int index, Statement statement, FailureKind kind, String message,
			Throwable error) {
		logger.warn("{} failed ({}): {}", DslRenderer.render(statement), kind, message);
		return StatementResult.failure(index, statement, kind, message, error);
	}

	private record Reference(String name, ResolutionRole role, Set<ObjectType> expectedTypes) {
	}

	private static final class Run {
		private final ObjectRegistry registry;
		private final Map<String, Set<ObjectType>> failures = new HashMap<>();
		private int calls = 0;

		Run(ObjectRegistry registry) {
			this.registry = registry;
		}

		void failed(String name, ObjectType type) {
			failures.computeIfAbsent(name, k -> EnumSet.noneOf(ObjectType.class)).add(type);
		}

		void cleared(String name, ObjectType type) {
			Set<ObjectType> types = failures.get(name);
			if (types != null) {
				types.remove(type);
			}
		}

		/**
		 * Whether the object a reference resolves to, or would resolve to had its creation succeeded,
		 * is one that failed. Registered objects of other types under the same name are unaffected.
		 */
		boolean dependsOnFailure(Reference reference) {
			Set<ObjectType> failedTypes = failures.getOrDefault(reference.name(), Set.of());
			if (failedTypes.isEmpty()) {
				return false;
			}
			if (reference.role() == ResolutionRole.AS_PARENT && registry.isRootParent(reference.name())) {
				return false;
			}
			List<RegistryEntry> live = registry.candidates(reference.name());
			if (live.isEmpty()) {
				return true;
			}
			Optional<RegistryEntry> chosen = registry.find(reference.name(), reference.role(),
					reference.expectedTypes());
			if (chosen.isPresent() && failedTypes.contains(chosen.get().type())) {
				return true;
			}
			Set<ObjectType> liveTypes = live.stream().map(RegistryEntry::type).collect(Collectors.toSet());
			List<ObjectType> neverCreated = failedTypes.stream().filter(t -> !liveTypes.contains(t)).toList();
			if (reference.role() == ResolutionRole.AS_PARENT) {
				return liveTypes.stream().noneMatch(ObjectType::isContainer)
						&& neverCreated.stream().anyMatch(ObjectType::isContainer);
			}
			Set<ObjectType> expected = reference.expectedTypes();
			return !expected.isEmpty()
					&& liveTypes.stream().noneMatch(expected::contains)
					&& neverCreated.stream().anyMatch(expected::contains);
		}

		void invoke(Runnable operation, String description) {
			call(() -> {
				operation.run();
				return null;
			}, description);
		}

		<T> T call(Supplier<T> operation, String description) {
			calls++;
			logger.debug("Backend call {}: {}", calls, description);
			try {
				return operation.get();
			}
			catch (BackendCallException ex) {
				throw ex;
			}
			catch (RuntimeException ex) {
				throw new BackendCallException("Backend failed to " + description + ": " + ex.getMessage(), ex);
			}
		}
	}
}

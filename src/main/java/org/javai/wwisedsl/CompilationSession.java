package org.javai.wwisedsl;

import java.util.List;
import java.util.Objects;
import org.javai.wwisedsl.dsl.DslParser;
import org.javai.wwisedsl.dsl.ParseResult;
import org.javai.wwisedsl.dsl.Statement;
import org.javai.wwisedsl.exec.BackendClient;
import org.javai.wwisedsl.exec.ExecutionPlanner;
import org.javai.wwisedsl.exec.ExecutionReport;
import org.javai.wwisedsl.exec.PlannerOptions;
import org.javai.wwisedsl.model.ObjectType;
import org.javai.wwisedsl.registry.ObjectId;
import org.javai.wwisedsl.registry.ObjectRegistry;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * One compile or replay run against a backend.
 * <p>
 * A session owns a fresh {@link ObjectRegistry}; names bound by one replay stay visible to later
 * replays in the same session and to nothing else. Sessions share no state, so independent sessions
 * may run on different threads. A single session is not thread-safe.
 */
public final class CompilationSession {

	private static final Logger logger = LoggerFactory.getLogger(CompilationSession.class);

	private final BackendClient backend;
	private final DslParser parser;
	private final ExecutionPlanner planner;
	private final ObjectRegistry registry;

	public CompilationSession(BackendClient backend) {
		this(backend, new DslParser(), PlannerOptions.defaults(), ObjectRegistry.create());
	}

	public CompilationSession(BackendClient backend, DslParser parser, PlannerOptions options,
			ObjectRegistry registry) {
		this.backend = Objects.requireNonNull(backend, "backend must not be null");
		this.parser = Objects.requireNonNull(parser, "parser must not be null");
		this.registry = Objects.requireNonNull(registry, "registry must not be null");
		this.planner = new ExecutionPlanner(backend, options);
	}

	/**
	 * Make an object that already exists in the project (typically a bus) referable by name.
	 */
	public CompilationSession withExisting(String name, ObjectType type, ObjectId id) {
		registry.registerExisting(name, type, id);
		return this;
	}

	/**
	 * Parse DSL text and execute the statements that parsed.
	 *
	 * @throws org.javai.wwisedsl.dsl.DslParseException if the parser is strict and a line is malformed
	 */
	public SessionReport replay(String text) {
		ParseResult parsed = parser.parse(text);
		if (!parsed.isClean()) {
			logger.warn("{} line(s) could not be parsed and were skipped", parsed.errors().size());
		}
		ExecutionReport execution = planner.execute(parsed.statements(), registry);
		return SessionReport.of(parsed, execution);
	}

	/**
	 * Execute already parsed statements.
	 */
	public ExecutionReport execute(List<? extends Statement> statements) {
		return planner.execute(statements, registry);
	}

	public ObjectRegistry registry() {
		return registry;
	}

	public BackendClient backend() {
		return backend;
	}

	public DslParser parser() {
		return parser;
	}
}

package org.javai.wwisedsl.reverse;

import java.util.ArrayList;
import java.util.Collections;
import java.util.EnumMap;
import java.util.IdentityHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Set;
import org.javai.wwisedsl.dsl.Statement;
import org.javai.wwisedsl.dsl.StatementKind;
import org.javai.wwisedsl.model.PropertyValue;
import org.javai.wwisedsl.registry.ObjectRegistry;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Turns a project tree into DSL samples.
 * <p>
 * Every top-level node heads a sample whose CREATE is placed under the sentinel root. A descendant
 * heads a sample of its own when its inline subtree, after its own oversized descendants have been
 * split off, has more nodes than {@link ReverseCompilerOptions#maxNodes()} or nests deeper than
 * {@link ReverseCompilerOptions#maxDepth()}. Such a sample places its head under the head of the
 * sample it was split from, which consistency repair then replaces with the sentinel root, so every
 * repaired sample replays on its own.
 * <p>
 * Statements are emitted in depth-first preorder. Per node: CREATE, then one SET_PROP per emitted
 * property, one LINK per reference and one ADD_ACTION per event action. Samples are returned in
 * preorder of their heads.
 */
public class ReverseCompiler {

	private static final Logger logger = LoggerFactory.getLogger(ReverseCompiler.class);

	private final ReverseCompilerOptions options;

	public ReverseCompiler() {
		this(ReverseCompilerOptions.defaults());
	}

	public ReverseCompiler(ReverseCompilerOptions options) {
		this.options = Objects.requireNonNull(options, "options must not be null");
	}

	public ReverseCompilerOptions options() {
		return options;
	}

	/**
	 * Compile the children of a top-level scope node. The scope itself is not emitted.
	 */
	public List<Sample> compile(ObjectNode scope) {
		return compile(scope, null);
	}

	public List<Sample> compile(ObjectNode scope, String source) {
		Objects.requireNonNull(scope, "scope must not be null");
		return compileAll(scope.children(), source);
	}

	/**
	 * Compile a list of top-level nodes.
	 *
	 * @param source recorded in each sample's metadata, may be {@code null}
	 */
	public List<Sample> compileAll(List<ObjectNode> topLevel, String source) {
		List<Sample> samples = new ArrayList<>();
		for (ObjectNode node : topLevel) {
			Set<ObjectNode> splits = Collections.newSetFromMap(new IdentityHashMap<>());
			measure(node, splits);
			emitSamples(node, ObjectRegistry.SENTINEL_ROOT_NAME, splits, source, samples);
		}
		logger.info("Compiled {} top-level node(s) into {} sample(s){}", topLevel.size(), samples.size(),
				source != null ? " from " + source : "");
		return samples;
	}

	/**
	 * Decide which descendants of {@code node} are split off.
	 *
	 * @return size and depth of what stays inline under {@code node}
	 */
	private Inline measure(ObjectNode node, Set<ObjectNode> splits) {
		int size = 1;
		int depth = 0;
		for (ObjectNode child : node.children()) {
			Inline inline = measure(child, splits);
			if (inline.size() > options.maxNodes() || inline.depth() > options.maxDepth()) {
				logger.debug("Splitting {} \"{}\" ({} nodes, depth {}) from \"{}\"", child.type(), child.name(),
						inline.size(), inline.depth(), node.name());
				splits.add(child);
				continue;
			}
			size += inline.size();
			depth = Math.max(depth, inline.depth() + 1);
		}
		return new Inline(size, depth);
	}

	private void emitSamples(ObjectNode head, String parentName, Set<ObjectNode> splits, String source,
			List<Sample> samples) {
		List<Statement> statements = new ArrayList<>();
		int depth = emitInline(head, parentName, 0, splits, statements);
		if (statements.isEmpty()) {
			logger.debug("Nothing to emit for {} \"{}\"", head.type(), head.name());
		}
		else {
			samples.add(Sample.of(statements, describe(head, statements, depth, source)));
		}
		emitSplitDescendants(head, head, splits, source, samples);
	}

	private void emitSplitDescendants(ObjectNode sampleHead, ObjectNode node, Set<ObjectNode> splits,
			String source, List<Sample> samples) {
		for (ObjectNode child : node.children()) {
			if (splits.contains(child)) {
				emitSamples(child, sampleHead.name(), splits, source, samples);
			}
			else {
				emitSplitDescendants(sampleHead, child, splits, source, samples);
			}
		}
	}

	private int emitInline(ObjectNode node, String parentName, int level, Set<ObjectNode> splits,
			List<Statement> out) {
		emitNode(node, parentName, out);
		int depth = level;
		for (ObjectNode child : node.children()) {
			if (!splits.contains(child)) {
				depth = Math.max(depth, emitInline(child, node.name(), level + 1, splits, out));
			}
		}
		return depth;
	}

	private void emitNode(ObjectNode node, String parentName, List<Statement> out) {
		String name = node.name();
		if (!options.systemObjectNames().contains(name)) {
			out.add(new Statement.Create(node.type(), name, parentName));
		}
		for (Map.Entry<String, PropertyValue> property : node.properties().entrySet()) {
			if (options.emitsProperty(property.getKey(), property.getValue())) {
				out.add(new Statement.SetProp(name, property.getKey(), property.getValue()));
			}
		}
		for (ObjectNode.Reference reference : node.references()) {
			if (!options.implicitLinkTargets().contains(reference.targetName())) {
				out.add(new Statement.Link(name, reference.targetName(), reference.relation()));
			}
		}
		for (ObjectNode.Action action : node.actions()) {
			out.add(new Statement.AddAction(name, action.kind(), action.targetName()));
		}
	}

	private static SampleMetadata describe(ObjectNode head, List<Statement> statements, int depth, String source) {
		Map<StatementKind, Integer> counts = new EnumMap<>(StatementKind.class);
		for (Statement statement : statements) {
			counts.merge(statement.kind(), 1, Integer::sum);
		}
		int links = counts.getOrDefault(StatementKind.LINK, 0);
		boolean hasActions = counts.getOrDefault(StatementKind.ADD_ACTION, 0) > 0;
		ComplexityTag complexity = ComplexityTag.classify(statements.size(), depth, hasActions, links);
		return new SampleMetadata(head.name(), head.type(), statements.size(), depth, complexity, counts, source);
	}

	private record Inline(int size, int depth) {
	}
}

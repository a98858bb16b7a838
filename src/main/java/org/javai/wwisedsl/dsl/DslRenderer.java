package org.javai.wwisedsl.dsl;

import java.util.List;
import java.util.stream.Collectors;
import org.javai.wwisedsl.model.Quoting;

/**
 * Writes statements back as canonical DSL lines. {@link DslParser} reads every rendered line back
 * into an equal statement.
 */
public final class DslRenderer {

	private DslRenderer() {
	}

	public static String render(Statement statement) {
		if (statement instanceof Statement.Create create) {
			return "CREATE " + create.type().dslName() + " " + Quoting.quote(create.name())
					+ " UNDER " + Quoting.quote(create.parentName());
		}
		if (statement instanceof Statement.SetProp setProp) {
			return "SET_PROP " + Quoting.quote(setProp.name()) + " " + Quoting.quote(setProp.propName())
					+ " = " + setProp.value().render();
		}
		if (statement instanceof Statement.Link link) {
			return "LINK " + Quoting.quote(link.name()) + " TO " + Quoting.quote(link.targetName())
					+ " AS " + Quoting.quote(link.relation().dslName());
		}
		if (statement instanceof Statement.AddAction addAction) {
			return "ADD_ACTION " + Quoting.quote(addAction.eventName()) + " " + addAction.actionKind().keyword()
					+ " " + Quoting.quote(addAction.targetName());
		}
		throw new IllegalArgumentException("Unsupported statement: " + statement);
	}

	/**
	 * Render statements one per line, joined with {@code \n} and without a trailing newline.
	 */
	public static String render(List<? extends Statement> statements) {
		return statements.stream().map(DslRenderer::render).collect(Collectors.joining("\n"));
	}
}

package org.javai.wwisedsl.dsl;

import java.util.ArrayList;
import java.util.List;
import java.util.regex.Pattern;
import java.util.stream.Collectors;
import org.javai.wwisedsl.FailureKind;
import org.javai.wwisedsl.model.ActionKind;
import org.javai.wwisedsl.model.ObjectType;
import org.javai.wwisedsl.model.PropertyValue;
import org.javai.wwisedsl.model.Relation;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Line-oriented parser for the audio-object DSL.
 * <p>
 * Grammar (keywords are case-insensitive, names are quoted literals):
 * <pre>
 * CREATE &lt;Type&gt; "&lt;Name&gt;" UNDER "&lt;ParentName&gt;"
 * SET_PROP "&lt;Name&gt;" "&lt;PropName&gt;" = &lt;Value&gt;
 * LINK "&lt;Name&gt;" TO "&lt;TargetName&gt;" AS "&lt;Relation&gt;"
 * ADD_ACTION "&lt;EventName&gt;" &lt;ACTIONKIND&gt; "&lt;TargetName&gt;"
 * </pre>
 * Blank lines and lines starting with {@code #} or {@code //} are ignored. A leading list number
 * such as {@code "3. "} is dropped.
 * <p>
 * By default parsing is best-effort: a bad line is reported in {@link ParseResult#errors()} and the
 * rest of the text is still parsed. A {@linkplain #strict() strict} parser throws on the first bad line.
 */
public class DslParser {

	private static final Logger logger = LoggerFactory.getLogger(DslParser.class);

	private static final Pattern LIST_NUMBER_PREFIX = Pattern.compile("^\\d+\\.\\s*(?=[A-Za-z_])");

	private final boolean strict;
	private final TextSanitizer sanitizer;

	/**
	 * Creates a best-effort parser.
	 */
	public DslParser() {
		this(false, new TextSanitizer());
	}

	public DslParser(boolean strict, TextSanitizer sanitizer) {
		if (sanitizer == null) {
			throw new IllegalArgumentException("Sanitizer cannot be null");
		}
		this.strict = strict;
		this.sanitizer = sanitizer;
	}

	/**
	 * Creates a parser that aborts on the first malformed line.
	 */
	public static DslParser strict() {
		return new DslParser(true, new TextSanitizer());
	}

	/**
	 * Parses a multi-line DSL text.
	 *
	 * @throws DslParseException in strict mode, for the first line that fails
	 */
	public ParseResult parse(String text) {
		return parse(text == null ? List.of() : text.lines().collect(Collectors.toList()));
	}

	/**
	 * Parses DSL lines; line numbers in errors are 1-based positions in {@code lines}.
	 *
	 * @throws DslParseException in strict mode, for the first line that fails
	 */
	public ParseResult parse(List<String> lines) {
		List<Statement> statements = new ArrayList<>();
		List<ParseError> errors = new ArrayList<>();

		for (int i = 0; i < lines.size(); i++) {
			int lineNumber = i + 1;
			String line = prepare(lines.get(i));
			if (line.isEmpty()) {
				continue;
			}
			try {
				statements.add(parseStatement(line));
			}
			catch (DslParseException ex) {
				if (strict) {
					throw new DslParseException(ex.kind(), lineNumber, ex.getMessage(), ex);
				}
				logger.debug("Skipping line {} ({}): {}", lineNumber, ex.kind(), ex.getMessage());
				errors.add(new ParseError(lineNumber, ex.kind(), line, ex.getMessage()));
			}
		}

		return new ParseResult(statements, errors);
	}

	/**
	 * Parses exactly one statement.
	 *
	 * @throws DslParseException if the line is blank, a comment or not a valid statement
	 */
	public Statement parseLine(String line) {
		String prepared = prepare(line);
		if (prepared.isEmpty()) {
			throw new DslParseException(FailureKind.MALFORMED_STATEMENT, "Line contains no statement");
		}
		return parseStatement(prepared);
	}

	private String prepare(String raw) {
		String line = sanitizer.sanitize(raw).strip();
		if (line.isEmpty() || line.startsWith("#") || line.startsWith("//")) {
			return "";
		}
		return LIST_NUMBER_PREFIX.matcher(line).replaceFirst("");
	}

	private Statement parseStatement(String line) {
		TokenCursor cursor = new TokenCursor(new DslLineTokenizer(line).tokenize());
		DslToken first = cursor.peek();
		if (!first.isType(DslToken.TokenType.WORD)) {
			throw malformed("Expected a command keyword but found " + first);
		}
		StatementKind kind = StatementKind.fromKeyword(first.value())
				.orElseThrow(() -> new DslParseException(FailureKind.UNKNOWN_COMMAND,
						"Unknown command: " + first.value()));
		cursor.advance();

		Statement statement = switch (kind) {
			case CREATE -> parseCreate(cursor);
			case SET_PROP -> parseSetProp(cursor);
			case LINK -> parseLink(cursor);
			case ADD_ACTION -> parseAddAction(cursor);
		};
		cursor.expectEnd(kind);
		return statement;
	}

	private Statement parseCreate(TokenCursor cursor) {
		List<String> typeWords = new ArrayList<>();
		while (cursor.peek().isType(DslToken.TokenType.WORD)) {
			typeWords.add(cursor.advance().value());
		}
		if (typeWords.isEmpty()) {
			throw malformed("CREATE requires an object type before the name");
		}
		String spelling = String.join(" ", typeWords);
		ObjectType type = ObjectType.fromDsl(spelling)
				.orElseThrow(() -> malformed("Unknown object type: " + spelling));
		String name = cursor.expectString("object name");
		cursor.expectWord("UNDER");
		String parent = cursor.expectString("parent name");
		return new Statement.Create(type, name, parent);
	}

	private Statement parseSetProp(TokenCursor cursor) {
		String name = cursor.expectString("object name");
		String property = cursor.expectString("property name");
		cursor.expect(DslToken.TokenType.EQUALS, "'='");
		DslToken rest = cursor.expect(DslToken.TokenType.REST, "property value");
		try {
			return new Statement.SetProp(name, property, PropertyValue.parse(rest.value()));
		}
		catch (IllegalArgumentException ex) {
			throw new DslParseException(FailureKind.MALFORMED_STATEMENT, 0,
					"Invalid value for " + property + ": " + ex.getMessage(), ex);
		}
	}

	private Statement parseLink(TokenCursor cursor) {
		String name = cursor.expectString("object name");
		cursor.expectWord("TO");
		String target = cursor.expectString("target name");
		cursor.expectWord("AS");
		String relationName = cursor.expectString("relation");
		Relation relation = Relation.fromName(relationName)
				.orElseThrow(() -> malformed("Unknown relation: " + relationName));
		return new Statement.Link(name, target, relation);
	}

	private Statement parseAddAction(TokenCursor cursor) {
		String event = cursor.expectString("event name");
		DslToken kindToken = cursor.expect(DslToken.TokenType.WORD, "action kind");
		ActionKind kind = ActionKind.fromKeyword(kindToken.value())
				.orElseThrow(() -> malformed("Unknown action kind: " + kindToken.value()));
		String target = cursor.expectString("target name");
		return new Statement.AddAction(event, kind, target);
	}

	private static DslParseException malformed(String message) {
		return new DslParseException(FailureKind.MALFORMED_STATEMENT, message);
	}

	private static final class TokenCursor {
		private final List<DslToken> tokens;
		private int index = 0;

		TokenCursor(List<DslToken> tokens) {
			this.tokens = tokens;
		}

		DslToken peek() {
			return tokens.get(index);
		}

		DslToken advance() {
			DslToken token = tokens.get(index);
			if (!token.isType(DslToken.TokenType.EOL)) {
				index++;
			}
			return token;
		}

		DslToken expect(DslToken.TokenType type, String what) {
			DslToken token = peek();
			if (!token.isType(type)) {
				throw malformed("Expected " + what + " but found " + token);
			}
			return advance();
		}

		String expectString(String what) {
			String value = expect(DslToken.TokenType.STRING, what + " in quotes").value();
			if (value.isEmpty()) {
				throw malformed("Empty " + what);
			}
			return value;
		}

		void expectWord(String keyword) {
			DslToken token = peek();
			if (!token.isWord(keyword)) {
				throw malformed("Expected " + keyword + " but found " + token);
			}
			advance();
		}

		void expectEnd(StatementKind kind) {
			DslToken token = peek();
			if (!token.isType(DslToken.TokenType.EOL)) {
				throw malformed("Unexpected " + token + " after " + kind.keyword() + " statement");
			}
		}
	}
}

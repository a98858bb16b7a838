package org.javai.wwisedsl.dsl;

/**
 * Represents a token of a single DSL line.
 *
 * @param type the token type
 * @param value the token text; unescaped content for strings, raw text for {@link TokenType#REST}
 * @param position the character position in the line
 */
public record DslToken(TokenType type, String value, int position) {

	public enum TokenType {
		WORD,          // keywords, type names, action kinds
		STRING,        // "quoted literal"
		EQUALS,        // =
		REST,          // raw value text after '='
		EOL            // end of line
	}

	public boolean isType(TokenType expectedType) {
		return this.type == expectedType;
	}

	public boolean isWord(String expected) {
		return type == TokenType.WORD && value.equalsIgnoreCase(expected);
	}

	@Override
	public String toString() {
		return switch (type) {
			case STRING -> "STRING(\"" + value + "\")";
			case WORD, REST -> type + "(" + value + ")";
			default -> type.toString();
		};
	}
}

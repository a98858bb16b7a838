package org.javai.wwisedsl.model;

/**
 * Quoting rules for DSL string literals: {@code "} and {@code \} are escaped with a backslash, line
 * breaks are written as {@code \n} and {@code \r} so a literal always stays on one line.
 */
public final class Quoting {

	private Quoting() {
	}

	public static String quote(String value) {
		StringBuilder sb = new StringBuilder(value.length() + 2).append('"');
		for (int i = 0; i < value.length(); i++) {
			char c = value.charAt(i);
			if (c == '\n') {
				sb.append("\\n");
			}
			else if (c == '\r') {
				sb.append("\\r");
			}
			else {
				if (c == '"' || c == '\\') {
					sb.append('\\');
				}
				sb.append(c);
			}
		}
		return sb.append('"').toString();
	}

	/**
	 * Strip the surrounding quotes of a literal and resolve escapes.
	 *
	 * @throws IllegalArgumentException if the literal is not a complete quoted string
	 */
	public static String unquote(String literal) {
		if (literal.length() < 2 || literal.charAt(0) != '"' || literal.charAt(literal.length() - 1) != '"') {
			throw new IllegalArgumentException("Not a quoted literal: " + literal);
		}
		StringBuilder sb = new StringBuilder(literal.length());
		int end = literal.length() - 1;
		for (int i = 1; i < end; i++) {
			char c = literal.charAt(i);
			if (c == '\\' && i + 1 < end) {
				c = unescape(literal.charAt(++i));
			}
			else if (c == '"') {
				throw new IllegalArgumentException("Unescaped quote inside literal: " + literal);
			}
			sb.append(c);
		}
		return sb.toString();
	}

	/**
	 * Character denoted by {@code \<c>} inside a literal.
	 */
	public static char unescape(char c) {
		if (c == 'n') {
			return '\n';
		}
		if (c == 'r') {
			return '\r';
		}
		return c;
	}
}

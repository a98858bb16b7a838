package org.javai.wwisedsl.dsl;

import java.util.ArrayList;
import java.util.List;
import org.javai.wwisedsl.FailureKind;
import org.javai.wwisedsl.model.Quoting;

/**
 * Tokenizer for one DSL line.
 * <p>
 * Everything after an {@code =} outside quotes becomes a single {@link DslToken.TokenType#REST} token,
 * so property values keep their original spelling for {@code PropertyValue.parse}.
 */
public class DslLineTokenizer {

	private final String input;
	private int pos = 0;

	public DslLineTokenizer(String input) {
		this.input = input != null ? input : "";
	}

	/**
	 * Tokenizes the whole line.
	 *
	 * @return list of tokens (includes EOL token at end)
	 * @throws DslParseException with {@link FailureKind#UNBALANCED_QUOTING} if a quote is never closed
	 */
	public List<DslToken> tokenize() {
		List<DslToken> tokens = new ArrayList<>();

		while (!isAtEnd()) {
			skipWhitespace();
			if (isAtEnd()) break;

			char c = peek();
			if (c == '"') {
				tokens.add(scanString());
			}
			else if (c == '=') {
				tokens.add(new DslToken(DslToken.TokenType.EQUALS, "=", pos));
				advance();
				skipWhitespace();
				if (!isAtEnd()) {
					tokens.add(scanRest());
				}
			}
			else {
				tokens.add(scanWord());
			}
		}

		tokens.add(new DslToken(DslToken.TokenType.EOL, "", pos));
		return tokens;
	}

	private DslToken scanString() {
		int start = pos;
		advance(); // consume opening "

		StringBuilder sb = new StringBuilder();
		while (!isAtEnd() && peek() != '"') {
			char c = advance();
			if (c == '\\' && !isAtEnd()) {
				sb.append(Quoting.unescape(advance()));
			}
			else {
				sb.append(c);
			}
		}

		if (isAtEnd()) {
			throw new DslParseException(FailureKind.UNBALANCED_QUOTING, "Unterminated string at position " + start);
		}

		advance(); // consume closing "
		return new DslToken(DslToken.TokenType.STRING, sb.toString(), start);
	}

	private DslToken scanRest() {
		int start = pos;
		String rest = input.substring(start).strip();
		if (!quotesBalanced(rest)) {
			throw new DslParseException(FailureKind.UNBALANCED_QUOTING, "Unterminated string in value at position " + start);
		}
		pos = input.length();
		return new DslToken(DslToken.TokenType.REST, rest, start);
	}

	private DslToken scanWord() {
		int start = pos;
		while (!isAtEnd() && !isWhitespace(peek()) && peek() != '"' && peek() != '=') {
			advance();
		}
		return new DslToken(DslToken.TokenType.WORD, input.substring(start, pos), start);
	}

	private static boolean quotesBalanced(String text) {
		boolean open = false;
		for (int i = 0; i < text.length(); i++) {
			char c = text.charAt(i);
			if (c == '\\' && open) {
				i++;
			}
			else if (c == '"') {
				open = !open;
			}
		}
		return !open;
	}

	private void skipWhitespace() {
		while (!isAtEnd() && isWhitespace(peek())) {
			advance();
		}
	}

	private char peek() {
		return isAtEnd() ? '\0' : input.charAt(pos);
	}

	private char advance() {
		return input.charAt(pos++);
	}

	private boolean isAtEnd() {
		return pos >= input.length();
	}

	private boolean isWhitespace(char c) {
		return c == ' ' || c == '\t' || c == '\n' || c == '\r';
	}
}

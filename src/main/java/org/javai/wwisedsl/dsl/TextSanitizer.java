package org.javai.wwisedsl.dsl;

import java.text.Normalizer;
import java.util.Map;

/**
 * Cleans a DSL line pasted from documents or generated by language models before it is parsed.
 * <p>
 * Outside quoted literals it applies NFKC normalization (full-width punctuation becomes ASCII),
 * turns typographic quotes into straight quotes, drops zero-width characters and the byte order mark,
 * maps non-breaking and ideographic spaces to plain spaces and removes remaining control characters
 * except tabs.
 * <p>
 * Quoted literals hold object names and text values and are not normalized. A literal in straight
 * quotes, the form {@link DslRenderer} writes, is kept verbatim. A literal in typographic or
 * full-width quotes gets straight quotes and loses its invisible characters only.
 */
public final class TextSanitizer {

	private static final Map<Character, String> REPLACEMENTS = Map.ofEntries(
			Map.entry('\u200B', ""),
			Map.entry('\u200C', ""),
			Map.entry('\u200D', ""),
			Map.entry('\u2060', ""),
			Map.entry('\uFEFF', ""),
			Map.entry('\u00A0', " "),
			Map.entry('\u3000', " "),
			Map.entry('\u2018', "'"),
			Map.entry('\u2019', "'"),
			Map.entry('\u3010', "["),
			Map.entry('\u3011', "]"));

	public String sanitize(String line) {
		if (line == null || line.isEmpty()) {
			return "";
		}
		StringBuilder out = new StringBuilder(line.length());
		int plainStart = 0;
		int i = 0;
		while (i < line.length()) {
			char c = line.charAt(i);
			if (!isQuote(c)) {
				i++;
				continue;
			}
			out.append(clean(line.substring(plainStart, i)));
			boolean straight = c == '"';
			int end = closingQuote(line, i + 1, straight);
			if (end < 0) {
				// unterminated: left for the tokenizer to report
				out.append('"').append(line, i + 1, line.length());
				return out.toString();
			}
			String literal = line.substring(i + 1, end);
			out.append('"').append(straight ? literal : stripInvisible(literal)).append('"');
			i = end + 1;
			plainStart = i;
		}
		out.append(clean(line.substring(plainStart)));
		return out.toString();
	}

	private static int closingQuote(String line, int from, boolean straight) {
		for (int j = from; j < line.length(); j++) {
			char c = line.charAt(j);
			if (c == '\\') {
				j++;
			}
			else if (straight ? c == '"' : isQuote(c)) {
				return j;
			}
		}
		return -1;
	}

	private static boolean isQuote(char c) {
		return c == '"' || c == '\u201C' || c == '\u201D' || c == '\u201E' || c == '\uFF02';
	}

	private static String clean(String text) {
		if (text.isEmpty()) {
			return text;
		}
		String normalized = Normalizer.normalize(text, Normalizer.Form.NFKC);
		StringBuilder sb = new StringBuilder(normalized.length());
		for (int i = 0; i < normalized.length(); i++) {
			char c = normalized.charAt(i);
			String replacement = REPLACEMENTS.get(c);
			if (replacement != null) {
				sb.append(replacement);
			}
			else if (c == '\t' || !isInvisible(c)) {
				sb.append(c);
			}
		}
		return sb.toString();
	}

	private static String stripInvisible(String literal) {
		StringBuilder sb = new StringBuilder(literal.length());
		for (int i = 0; i < literal.length(); i++) {
			char c = literal.charAt(i);
			if (c == '\t' || !isInvisible(c)) {
				sb.append(c);
			}
		}
		return sb.toString();
	}

	private static boolean isInvisible(char c) {
		int type = Character.getType(c);
		return type == Character.CONTROL || type == Character.FORMAT;
	}
}

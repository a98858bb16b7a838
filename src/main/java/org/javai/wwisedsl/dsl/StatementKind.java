package org.javai.wwisedsl.dsl;

import java.util.Arrays;
import java.util.Locale;
import java.util.Optional;

/**
 * Leading keyword of each statement form.
 */
public enum StatementKind {

	CREATE,
	SET_PROP,
	LINK,
	ADD_ACTION;

	public String keyword() {
		return name();
	}

	public static Optional<StatementKind> fromKeyword(String keyword) {
		if (keyword == null) {
			return Optional.empty();
		}
		String upper = keyword.toUpperCase(Locale.ROOT);
		return Arrays.stream(values()).filter(kind -> kind.name().equals(upper)).findFirst();
	}
}

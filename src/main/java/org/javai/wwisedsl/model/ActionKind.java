package org.javai.wwisedsl.model;

import java.util.Arrays;
import java.util.Locale;
import java.util.Optional;

/**
 * Kinds of actions an event can trigger ({@code ADD_ACTION "<Event>" <KIND> "<Target>"}).
 * The numeric code is the action type identifier used by project files and the backend.
 */
public enum ActionKind {

	PLAY(1),
	STOP(2),
	PAUSE(3),
	RESUME(4),
	BREAK(5),
	SEEK(6),
	MUTE(7),
	UNMUTE(8),
	SET_GAME_PARAMETER(17),
	SET_STATE(18),
	SET_SWITCH(19),
	RESET_GAME_PARAMETER(20);

	private final int code;

	ActionKind(int code) {
		this.code = code;
	}

	public int code() {
		return code;
	}

	/**
	 * DSL keyword, e.g. {@code PLAY} or {@code SETSWITCH}.
	 */
	public String keyword() {
		return name().replace("_", "");
	}

	public static Optional<ActionKind> fromKeyword(String keyword) {
		if (keyword == null) {
			return Optional.empty();
		}
		String normalized = keyword.trim().replace("_", "").toUpperCase(Locale.ROOT);
		return Arrays.stream(values())
				.filter(kind -> kind.keyword().equals(normalized))
				.findFirst();
	}

	public static Optional<ActionKind> fromCode(int code) {
		return Arrays.stream(values())
				.filter(kind -> kind.code == code)
				.findFirst();
	}
}

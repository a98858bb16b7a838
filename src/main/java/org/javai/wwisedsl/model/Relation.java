package org.javai.wwisedsl.model;

import java.util.EnumSet;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.stream.Collectors;
import java.util.stream.Stream;

/**
 * Typed references an object can hold to another object ({@code LINK ... AS "<Relation>"}).
 * <p>
 * Each relation has the spelling written in DSL, alternative spellings accepted on input (the
 * project file's reference name among them) and the object types a target is expected to have.
 * The expected types narrow name resolution when a target name is shared by objects of several types.
 */
public enum Relation {

	OUTPUT_BUS("Bus", EnumSet.of(ObjectType.BUS, ObjectType.AUX_BUS), "OutputBus"),
	ATTENUATION("Attenuation", EnumSet.of(ObjectType.ATTENUATION)),
	SWITCH_GROUP_OR_STATE_GROUP("SwitchGroupOrStateGroup",
			EnumSet.of(ObjectType.SWITCH_GROUP, ObjectType.STATE_GROUP), "SwitchGroup"),
	STATE_GROUP("StateGroup", EnumSet.of(ObjectType.STATE_GROUP)),
	GAME_PARAMETER("GameParameter", EnumSet.of(ObjectType.GAME_PARAMETER), "RTPC"),
	CONVERSION("Conversion", EnumSet.noneOf(ObjectType.class)),
	EFFECT_0("Effect0", EnumSet.of(ObjectType.EFFECT)),
	EFFECT_1("Effect1", EnumSet.of(ObjectType.EFFECT)),
	EFFECT_2("Effect2", EnumSet.of(ObjectType.EFFECT)),
	EFFECT_3("Effect3", EnumSet.of(ObjectType.EFFECT)),
	USER_AUX_SEND_0("UserAuxSend0", EnumSet.of(ObjectType.AUX_BUS)),
	USER_AUX_SEND_1("UserAuxSend1", EnumSet.of(ObjectType.AUX_BUS));

	private static final Map<String, Relation> BY_SPELLING = Stream.of(values())
			.flatMap(relation -> Stream.concat(Stream.of(relation.dslName), Stream.of(relation.aliases))
					.map(spelling -> spelling.toLowerCase(Locale.ROOT))
					.distinct()
					.map(spelling -> Map.entry(spelling, relation)))
			.collect(Collectors.toUnmodifiableMap(Map.Entry::getKey, Map.Entry::getValue));

	private final String dslName;
	private final Set<ObjectType> targetTypes;
	private final String[] aliases;

	Relation(String dslName, Set<ObjectType> targetTypes, String... aliases) {
		this.dslName = dslName;
		this.targetTypes = targetTypes;
		this.aliases = aliases;
	}

	public String dslName() {
		return dslName;
	}

	/**
	 * Object types a link target is expected to have. Empty when the relation does not constrain it.
	 */
	public Set<ObjectType> targetTypes() {
		return targetTypes.isEmpty() ? Set.of() : EnumSet.copyOf(targetTypes);
	}

	/**
	 * Resolve a relation from its DSL spelling or an alias (case-insensitive).
	 */
	public static Optional<Relation> fromName(String name) {
		if (name == null || name.isBlank()) {
			return Optional.empty();
		}
		return Optional.ofNullable(BY_SPELLING.get(name.trim().toLowerCase(Locale.ROOT)));
	}

	@Override
	public String toString() {
		return dslName;
	}
}

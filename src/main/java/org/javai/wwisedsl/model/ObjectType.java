package org.javai.wwisedsl.model;

import java.util.Locale;
import java.util.Map;
import java.util.Optional;
import java.util.stream.Collectors;
import java.util.stream.Stream;

/**
 * Closed set of object types the DSL can create.
 * <p>
 * {@link #isContainer()} is the only capability the registry consults when a name is used as a parent.
 */
public enum ObjectType {

	ACTOR_MIXER("ActorMixer", true, Hierarchy.ACTOR_MIXER),
	RANDOM_SEQUENCE_CONTAINER("RandomSequenceContainer", true, Hierarchy.ACTOR_MIXER,
			"RandomContainer", "SequenceContainer"),
	SWITCH_CONTAINER("SwitchContainer", true, Hierarchy.ACTOR_MIXER),
	BLEND_CONTAINER("BlendContainer", true, Hierarchy.ACTOR_MIXER),
	WORK_UNIT("WorkUnit", true, Hierarchy.ACTOR_MIXER),
	FOLDER("Folder", true, Hierarchy.ACTOR_MIXER),
	BUS("Bus", true, Hierarchy.MASTER_MIXER, "AudioBus"),
	AUX_BUS("AuxBus", true, Hierarchy.MASTER_MIXER, "AuxiliaryBus"),

	SOUND("Sound", false, Hierarchy.ACTOR_MIXER, "SoundSFX", "SoundVoice"),
	EVENT("Event", false, Hierarchy.EVENTS),
	ATTENUATION("Attenuation", false, Hierarchy.ATTENUATIONS),
	SWITCH_GROUP("SwitchGroup", false, Hierarchy.SWITCHES),
	SWITCH("Switch", false, Hierarchy.SWITCHES),
	STATE_GROUP("StateGroup", false, Hierarchy.STATES),
	STATE("State", false, Hierarchy.STATES),
	GAME_PARAMETER("GameParameter", false, Hierarchy.GAME_PARAMETERS, "RTPC"),
	EFFECT("Effect", false, Hierarchy.EFFECTS),
	ACOUSTIC_TEXTURE("AcousticTexture", false, Hierarchy.EFFECTS);

	private static final Map<String, ObjectType> BY_SPELLING = Stream.of(values())
			.flatMap(type -> type.spellings().map(ObjectType::normalize).distinct()
					.map(spelling -> Map.entry(spelling, type)))
			.collect(Collectors.toUnmodifiableMap(Map.Entry::getKey, Map.Entry::getValue));

	private final String dslName;
	private final boolean container;
	private final Hierarchy hierarchy;
	private final String[] aliases;

	ObjectType(String dslName, boolean container, Hierarchy hierarchy, String... aliases) {
		this.dslName = dslName;
		this.container = container;
		this.hierarchy = hierarchy;
		this.aliases = aliases;
	}

	/**
	 * Canonical spelling used when rendering DSL and talking to the backend.
	 */
	public String dslName() {
		return dslName;
	}

	/**
	 * Whether objects of this type can hold children. Parent resolution prefers such candidates.
	 */
	public boolean isContainer() {
		return container;
	}

	/**
	 * Top-level hierarchy an object of this type lands in when created under the sentinel root.
	 */
	public Hierarchy hierarchy() {
		return hierarchy;
	}

	/**
	 * Look up a type by its canonical name or one of its aliases. Matching ignores case,
	 * spaces and hyphens, so {@code "Random Sequence Container"} and {@code "randomsequencecontainer"}
	 * both resolve.
	 */
	public static Optional<ObjectType> fromDsl(String spelling) {
		if (spelling == null || spelling.isBlank()) {
			return Optional.empty();
		}
		return Optional.ofNullable(BY_SPELLING.get(normalize(spelling)));
	}

	private Stream<String> spellings() {
		return Stream.concat(Stream.of(dslName), Stream.of(aliases));
	}

	private static String normalize(String spelling) {
		return spelling.replace(" ", "").replace("-", "").toLowerCase(Locale.ROOT);
	}

	@Override
	public String toString() {
		return dslName;
	}

	/**
	 * Fixed top-level hierarchies of an authoring project.
	 */
	public enum Hierarchy {
		ACTOR_MIXER("\\Actor-Mixer Hierarchy\\Default Work Unit"),
		MASTER_MIXER("\\Master-Mixer Hierarchy\\Default Work Unit\\Master Audio Bus"),
		EVENTS("\\Events\\Default Work Unit"),
		SWITCHES("\\Switches\\Default Work Unit"),
		STATES("\\States\\Default Work Unit"),
		GAME_PARAMETERS("\\Game Parameters\\Default Work Unit"),
		ATTENUATIONS("\\Attenuations\\Default Work Unit"),
		EFFECTS("\\Effects\\Default Work Unit");

		private final String rootPath;

		Hierarchy(String rootPath) {
			this.rootPath = rootPath;
		}

		public String rootPath() {
			return rootPath;
		}
	}
}

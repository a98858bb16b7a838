package org.javai.wwisedsl.registry;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import java.util.Set;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.function.Supplier;
import org.javai.wwisedsl.FailureKind;
import org.javai.wwisedsl.model.ObjectType;
import org.junit.jupiter.api.Test;

class ObjectRegistryTest {

	private final ObjectRegistry registry = ObjectRegistry.create(sequentialIds(), ContainerTieBreak.REJECT);

	@Test
	void registrationIsIdempotentPerType() {
		ObjectId first = registry.register("Steps", ObjectType.SOUND);
		ObjectId again = registry.register("Steps", ObjectType.SOUND);
		ObjectId otherType = registry.register("Steps", ObjectType.ACTOR_MIXER);

		assertThat(again).isEqualTo(first);
		assertThat(otherType).isNotEqualTo(first);
		assertThat(registry.size()).isEqualTo(2);
		assertThat(registry.candidates("Steps")).extracting(RegistryEntry::type)
				.containsExactly(ObjectType.SOUND, ObjectType.ACTOR_MIXER);
	}

	@Test
	void parentPrefersContainerRegisteredFirst() {
		ObjectId mixer = registry.register("Weapons", ObjectType.ACTOR_MIXER);
		registry.register("Weapons", ObjectType.SOUND);

		assertThat(registry.resolve("Weapons", ResolutionRole.AS_PARENT)).isEqualTo(mixer);
	}

	@Test
	void parentPrefersContainerRegisteredLast() {
		registry.register("Weapons", ObjectType.SOUND);
		ObjectId mixer = registry.register("Weapons", ObjectType.ACTOR_MIXER);

		assertThat(registry.resolve("Weapons", ResolutionRole.AS_PARENT)).isEqualTo(mixer);
	}

	@Test
	void parentFallsBackToSingleLeaf() {
		ObjectId sound = registry.register("Shot", ObjectType.SOUND);

		assertThat(registry.resolve("Shot", ResolutionRole.AS_PARENT)).isEqualTo(sound);
	}

	@Test
	void severalLeavesAreAnAmbiguousParent() {
		registry.register("Shot", ObjectType.SOUND);
		registry.register("Shot", ObjectType.EVENT);

		assertThatThrownBy(() -> registry.resolve("Shot", ResolutionRole.AS_PARENT))
				.isInstanceOf(ResolutionException.class)
				.satisfies(ex -> {
					ResolutionException resolution = (ResolutionException) ex;
					assertThat(resolution.kind()).isEqualTo(FailureKind.AMBIGUOUS_PARENT);
					assertThat(resolution.candidates()).hasSize(2);
				});
	}

	@Test
	void twoContainersAreRejectedByDefault() {
		registry.register("Music", ObjectType.ACTOR_MIXER);
		registry.register("Music", ObjectType.BUS);

		assertThatThrownBy(() -> registry.resolve("Music", ResolutionRole.AS_PARENT))
				.isInstanceOf(ResolutionException.class)
				.extracting(ex -> ((ResolutionException) ex).kind())
				.isEqualTo(FailureKind.AMBIGUOUS_PARENT);
	}

	@Test
	void latestContainerWinsWhenConfigured() {
		ObjectRegistry lenient = ObjectRegistry.create(sequentialIds(), ContainerTieBreak.LATEST_WINS);
		lenient.register("Music", ObjectType.ACTOR_MIXER);
		ObjectId bus = lenient.register("Music", ObjectType.BUS);
		lenient.register("Music", ObjectType.SOUND);

		assertThat(lenient.resolve("Music", ResolutionRole.AS_PARENT)).isEqualTo(bus);
	}

	@Test
	void targetMustBeUniqueUnlessNarrowedByType() {
		registry.register("Hit", ObjectType.SOUND);
		ObjectId bus = registry.register("Hit", ObjectType.BUS);

		assertThatThrownBy(() -> registry.resolve("Hit", ResolutionRole.AS_TARGET))
				.isInstanceOf(ResolutionException.class)
				.extracting(ex -> ((ResolutionException) ex).kind())
				.isEqualTo(FailureKind.AMBIGUOUS_TARGET);
		assertThat(registry.resolve("Hit", ResolutionRole.AS_TARGET, Set.of(ObjectType.BUS))).isEqualTo(bus);
	}

	@Test
	void sentinelResolvesToRootWithoutRegistration() {
		assertThat(registry.resolve("Default Work Unit", ResolutionRole.AS_PARENT)).isEqualTo(ObjectId.ROOT);
		assertThat(registry.resolve("root", ResolutionRole.AS_PARENT)).isEqualTo(ObjectId.ROOT);
		assertThat(registry.isRegistered("Default Work Unit")).isFalse();
		assertThat(registry.size()).isZero();
	}

	@Test
	void registeredRootContainerShadowsTheRootAlias() {
		ObjectId root = registry.register("Root", ObjectType.ACTOR_MIXER);

		assertThat(registry.isRootParent("Root")).isFalse();
		assertThat(registry.resolve("Root", ResolutionRole.AS_PARENT)).isEqualTo(root);
		assertThat(registry.isRootParent("Default Work Unit")).isTrue();
		assertThat(ObjectRegistry.isSentinel("Root")).isFalse();
	}

	@Test
	void findReportsTheEntryResolutionWouldPick() {
		registry.register("Hit", ObjectType.SOUND);
		ObjectId bus = registry.register("Hit", ObjectType.BUS);

		assertThat(registry.find("Hit", ResolutionRole.AS_PARENT, Set.of()).map(RegistryEntry::id)).contains(bus);
		assertThat(registry.find("Hit", ResolutionRole.AS_TARGET, Set.of())).isEmpty();
		assertThat(registry.find("Ghost", ResolutionRole.AS_TARGET, Set.of())).isEmpty();
		assertThat(registry.find("Root", ResolutionRole.AS_PARENT, Set.of())).isEmpty();
	}

	@Test
	void unknownNameIsUnresolved() {
		assertThatThrownBy(() -> registry.resolve("Ghost", ResolutionRole.AS_TARGET))
				.isInstanceOf(ResolutionException.class)
				.satisfies(ex -> {
					ResolutionException resolution = (ResolutionException) ex;
					assertThat(resolution.kind()).isEqualTo(FailureKind.UNRESOLVED_REFERENCE);
					assertThat(resolution.candidates()).isEmpty();
				});
	}

	@Test
	void bindingADifferentIdIsAConflict() {
		ObjectId id = new ObjectId("{A}");
		registry.bind("Steps", ObjectType.SOUND, id);

		assertThat(registry.bind("Steps", ObjectType.SOUND, id).id()).isEqualTo(id);
		assertThatThrownBy(() -> registry.bind("Steps", ObjectType.SOUND, new ObjectId("{B}")))
				.isInstanceOf(RegistrationConflictException.class)
				.hasMessageContaining("{A}");
		assertThat(registry.resolve("Steps", ResolutionRole.AS_TARGET)).isEqualTo(id);
	}

	@Test
	void preexistingObjectsAreMarked() {
		RegistryEntry entry = registry.registerExisting("SFX", ObjectType.BUS, new ObjectId("{BUS}"));

		assertThat(entry.preexisting()).isTrue();
		assertThat(registry.lookup("SFX", ObjectType.BUS)).contains(entry);
		assertThatThrownBy(() -> registry.registerExisting("X", ObjectType.BUS, ObjectId.ROOT))
				.isInstanceOf(IllegalArgumentException.class);
	}

	private static Supplier<ObjectId> sequentialIds() {
		AtomicInteger next = new AtomicInteger();
		return () -> new ObjectId("{ID-" + next.incrementAndGet() + "}");
	}
}

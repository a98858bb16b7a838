package org.javai.wwisedsl;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;
import org.javai.wwisedsl.exec.BackendCallException;
import org.javai.wwisedsl.exec.BackendClient;
import org.javai.wwisedsl.model.ObjectType;
import org.javai.wwisedsl.registry.ObjectId;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.mockito.junit.jupiter.MockitoSettings;
import org.mockito.quality.Strictness;

@ExtendWith(MockitoExtension.class)
@MockitoSettings(strictness = Strictness.LENIENT)
class CompilationSessionBackendFailureTest {

	@Mock
	private BackendClient backend;

	private CompilationSession session;

	@BeforeEach
	void setUp() {
		session = new CompilationSession(backend);
		when(backend.create(eq(ObjectType.ACTOR_MIXER), eq("Weapons"), any()))
				.thenThrow(new BackendCallException("Project is read-only"));
		when(backend.create(eq(ObjectType.SOUND), eq("Beep"), any()))
				.thenReturn(new ObjectId("{BEEP}"));
	}

	@Test
	void failedCreateTaintsItsDependents() {
		SessionReport report = session.replay("""
				CREATE ActorMixer "Weapons" UNDER "Root"
				CREATE Sound "Shot" UNDER "Weapons"
				SET_PROP "Shot" "Volume" = -6
				CREATE Sound "Beep" UNDER "Root"
				""");

		assertThat(report.exitStatus()).isEqualTo(1);
		assertThat(report.count(FailureKind.BACKEND_CALL_FAILED)).isEqualTo(1);
		assertThat(report.count(FailureKind.DEPENDENCY_FAILED)).isEqualTo(2);
		assertThat(report.execution().succeeded()).isEqualTo(1);
		assertThat(report.failureLog().get(0))
				.isEqualTo("statement 1 BACKEND_CALL_FAILED: Project is read-only");
		verify(backend, never()).create(eq(ObjectType.SOUND), eq("Shot"), any());
		verify(backend, never()).setProperty(any(), any(), any());
		assertThat(session.registry().isRegistered("Beep")).isTrue();
	}
}

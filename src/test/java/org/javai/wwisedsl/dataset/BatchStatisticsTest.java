package org.javai.wwisedsl.dataset;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.within;
import java.util.ArrayList;
import java.util.List;
import org.javai.wwisedsl.dsl.StatementKind;
import org.javai.wwisedsl.model.ActionKind;
import org.javai.wwisedsl.model.ObjectType;
import org.javai.wwisedsl.model.Relation;
import org.javai.wwisedsl.reverse.ComplexityTag;
import org.javai.wwisedsl.reverse.ObjectNode;
import org.javai.wwisedsl.reverse.ReverseCompiler;
import org.javai.wwisedsl.reverse.Sample;
import org.junit.jupiter.api.Test;

class BatchStatisticsTest {

	@Test
	void talliesComplexityAndStatements() {
		ReverseCompiler compiler = new ReverseCompiler();
		List<Sample> batch = new ArrayList<>(compiler.compileAll(List.of(
				ObjectNode.of(ObjectType.SOUND, "Beep"),
				ObjectNode.builder(ObjectType.EVENT, "Play_Beep").action(ActionKind.PLAY, "Beep").build()),
				"A.wwu"));
		batch.addAll(compiler.compileAll(List.of(
				ObjectNode.builder(ObjectType.ACTOR_MIXER, "Mix")
						.reference(Relation.OUTPUT_BUS, "SFX")
						.child(ObjectNode.of(ObjectType.SOUND, "One"))
						.child(ObjectNode.of(ObjectType.SOUND, "Two"))
						.build()),
				"B.wwu"));

		BatchStatistics statistics = BatchStatistics.of(batch);

		assertThat(statistics.samples()).isEqualTo(3);
		assertThat(statistics.count(ComplexityTag.SIMPLE)).isEqualTo(2);
		assertThat(statistics.count(ComplexityTag.MEDIUM)).isEqualTo(1);
		assertThat(statistics.count(ComplexityTag.EXPERT)).isZero();
		assertThat(statistics.share(ComplexityTag.MEDIUM)).isCloseTo(33.3, within(0.1));
		assertThat(statistics.statements(StatementKind.CREATE)).isEqualTo(5);
		assertThat(statistics.statements(StatementKind.LINK)).isEqualTo(1);
		assertThat(statistics.statements(StatementKind.ADD_ACTION)).isEqualTo(1);
		assertThat(statistics.totalStatements()).isEqualTo(7);
		assertThat(statistics.sources()).containsExactly("A.wwu", "B.wwu");
		assertThat(statistics.summary())
				.contains("Samples: 3")
				.contains("Sources: 2")
				.contains("medium");
	}

	@Test
	void emptyBatchHasNoShare() {
		BatchStatistics statistics = new BatchStatistics();

		assertThat(statistics.samples()).isZero();
		assertThat(statistics.share(ComplexityTag.SIMPLE)).isZero();
		assertThat(statistics.totalStatements()).isZero();
	}
}

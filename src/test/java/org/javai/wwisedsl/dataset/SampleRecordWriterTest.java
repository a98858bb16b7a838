package org.javai.wwisedsl.dataset;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import java.io.IOException;
import java.io.StringReader;
import java.io.StringWriter;
import java.util.List;
import org.javai.wwisedsl.model.ActionKind;
import org.javai.wwisedsl.model.ObjectType;
import org.javai.wwisedsl.reverse.ObjectNode;
import org.javai.wwisedsl.reverse.ReverseCompiler;
import org.javai.wwisedsl.reverse.Sample;
import org.junit.jupiter.api.Test;

class SampleRecordWriterTest {

	private final List<Sample> samples = new ReverseCompiler().compileAll(List.of(
			ObjectNode.of(ObjectType.RANDOM_SEQUENCE_CONTAINER, "Shots",
					ObjectNode.of(ObjectType.SOUND, "Shot_01")),
			ObjectNode.builder(ObjectType.EVENT, "Play_Shot").action(ActionKind.PLAY, "Shots").build()),
			"Weapons.wwu");

	@Test
	void writesOneSnakeCaseObjectPerLine() throws IOException {
		StringWriter out = new StringWriter();
		try (SampleRecordWriter writer = new SampleRecordWriter(out)) {
			writer.writeAll(samples);
			assertThat(writer.written()).isEqualTo(2);
		}

		String[] lines = out.toString().split("\n");
		assertThat(lines).hasSize(2);
		JsonNode first = new ObjectMapper().readTree(lines[0]);
		assertThat(first.get("instruction").asText()).isEmpty();
		assertThat(first.get("output").asText()).isEqualTo(samples.get(0).text());
		JsonNode meta = first.get("meta");
		assertThat(meta.get("root_name").asText()).isEqualTo("Shots");
		assertThat(meta.get("root_type").asText()).isEqualTo("RandomSequenceContainer");
		assertThat(meta.get("line_count").asInt()).isEqualTo(2);
		assertThat(meta.get("complexity").asText()).isEqualTo("simple");
		assertThat(meta.get("commands").get("CREATE").asInt()).isEqualTo(2);
		assertThat(meta.get("commands").get("ADD_ACTION").asInt()).isZero();
		assertThat(meta.get("source").asText()).isEqualTo("Weapons.wwu");
	}

	@Test
	void readerLoadsWhatWriterWrote() throws IOException {
		StringWriter out = new StringWriter();
		SampleRecordWriter writer = new SampleRecordWriter(out);
		writer.write(SampleRecord.from(samples.get(1)).withInstruction("Play the shot"));
		out.write("\n");

		List<SampleRecord> records = new SampleRecordReader().readAll(new StringReader(out.toString()));

		assertThat(records).containsExactly(SampleRecord.from(samples.get(1)).withInstruction("Play the shot"));
		assertThat(records.get(0).meta().commands()).containsEntry("ADD_ACTION", 1);
	}

	@Test
	void omitsMissingSource() throws IOException {
		Sample sample = new ReverseCompiler().compileAll(List.of(ObjectNode.of(ObjectType.SOUND, "Beep")), null).get(0);
		StringWriter out = new StringWriter();
		new SampleRecordWriter(out).write(sample);

		assertThat(new ObjectMapper().readTree(out.toString()).get("meta").has("source")).isFalse();
	}

	@Test
	void readerIgnoresUnknownFieldsAndReportsBadLines() {
		SampleRecordReader reader = new SampleRecordReader();

		SampleRecord record = reader.parse(1, "{\"output\": \"CREATE Sound \\\"A\\\" UNDER \\\"Root\\\"\", \"score\": 3}");
		assertThat(record.output()).isEqualTo("CREATE Sound \"A\" UNDER \"Root\"");
		assertThat(record.instruction()).isEmpty();

		assertThatThrownBy(() -> reader.readAll(new StringReader("\n{\"output\": \"x\"}\nnot json\n")))
				.isInstanceOf(DatasetFormatException.class)
				.hasMessageStartingWith("Line 3:")
				.extracting(e -> ((DatasetFormatException) e).lineNumber()).isEqualTo(3);
	}
}

package org.javai.wwisedsl.dataset;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.annotation.JsonPropertyOrder;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import org.javai.wwisedsl.dsl.StatementKind;
import org.javai.wwisedsl.reverse.Sample;
import org.javai.wwisedsl.reverse.SampleMetadata;

/**
 * One line of a dataset file.
 * <pre>
 * {"instruction": "", "input": "", "output": "CREATE ...",
 *  "meta": {"root_name": "...", "root_type": "...", "line_count": 3, "depth": 0,
 *           "complexity": "simple", "commands": {"CREATE": 1, ...}, "source": "..."}}
 * </pre>
 * The instruction and input are left empty here and filled in by downstream generators.
 *
 * @param instruction natural-language request the output answers
 * @param input additional context for the instruction
 * @param output the DSL text
 * @param meta sample description
 */
@JsonPropertyOrder({"instruction", "input", "output", "meta"})
public record SampleRecord(
		@JsonProperty("instruction") String instruction,
		@JsonProperty("input") String input,
		@JsonProperty("output") String output,
		@JsonProperty("meta") Meta meta
) {

	public SampleRecord {
		instruction = instruction != null ? instruction : "";
		input = input != null ? input : "";
		output = output != null ? output : "";
	}

	public static SampleRecord from(Sample sample) {
		return new SampleRecord("", "", sample.text(), Meta.from(sample.metadata()));
	}

	public SampleRecord withInstruction(String newInstruction) {
		return new SampleRecord(newInstruction, input, output, meta);
	}

	@JsonInclude(JsonInclude.Include.NON_NULL)
	@JsonPropertyOrder({"root_name", "root_type", "line_count", "depth", "complexity", "commands", "source"})
	public record Meta(
			@JsonProperty("root_name") String rootName,
			@JsonProperty("root_type") String rootType,
			@JsonProperty("line_count") int lineCount,
			@JsonProperty("depth") int depth,
			@JsonProperty("complexity") String complexity,
			@JsonProperty("commands") Map<String, Integer> commands,
			@JsonProperty("source") String source
	) {

		public Meta {
			commands = commands != null ? Collections.unmodifiableMap(new LinkedHashMap<>(commands)) : Map.of();
		}

		static Meta from(SampleMetadata metadata) {
			Map<String, Integer> commands = new LinkedHashMap<>();
			for (StatementKind kind : StatementKind.values()) {
				commands.put(kind.keyword(), metadata.count(kind));
			}
			return new Meta(metadata.rootName(), metadata.rootType().dslName(), metadata.lineCount(),
					metadata.depth(), metadata.complexity().label(), commands, metadata.source());
		}
	}
}

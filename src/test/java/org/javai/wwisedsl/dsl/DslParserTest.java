package org.javai.wwisedsl.dsl;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.assertj.core.api.Assertions.tuple;
import java.util.List;
import org.javai.wwisedsl.FailureKind;
import org.javai.wwisedsl.model.ActionKind;
import org.javai.wwisedsl.model.ObjectType;
import org.javai.wwisedsl.model.PropertyValue;
import org.javai.wwisedsl.model.Relation;
import org.junit.jupiter.api.Test;

class DslParserTest {

	private final DslParser parser = new DslParser();

	@Test
	void parsesAllStatementFormsInSourceOrder() {
		ParseResult result = parser.parse("""
				CREATE RandomSequenceContainer "Footsteps" UNDER "Default Work Unit"
				SET_PROP "Footsteps" "Volume" = -3
				LINK "Footsteps" TO "HostPlayerSkill" AS "Bus"
				ADD_ACTION "Play_Footsteps" PLAY "Footsteps"
				""");

		assertThat(result.isClean()).isTrue();
		assertThat(result.statements()).containsExactly(
				new Statement.Create(ObjectType.RANDOM_SEQUENCE_CONTAINER, "Footsteps", "Default Work Unit"),
				new Statement.SetProp("Footsteps", "Volume", new PropertyValue.Int(-3)),
				new Statement.Link("Footsteps", "HostPlayerSkill", Relation.OUTPUT_BUS),
				new Statement.AddAction("Play_Footsteps", ActionKind.PLAY, "Footsteps"));
	}

	@Test
	void skipsBlankLinesAndComments() {
		ParseResult result = parser.parse("""
				# header comment

				// another comment
				CREATE Sound "Step" UNDER "Root"
				""");

		assertThat(result.statements()).hasSize(1);
		assertThat(result.errors()).isEmpty();
	}

	@Test
	void keywordsAreCaseInsensitiveAndTypeSpellingsAreNormalized() {
		Statement statement = parser.parseLine("create Random Sequence Container \"Steps\" under \"Root\"");

		assertThat(statement).isEqualTo(
				new Statement.Create(ObjectType.RANDOM_SEQUENCE_CONTAINER, "Steps", "Root"));
	}

	@Test
	void stripsListNumberPrefix() {
		Statement statement = parser.parseLine("12. SET_PROP \"Steps\" \"Pitch\" = 200 cents");

		assertThat(statement).isEqualTo(new Statement.SetProp("Steps", "Pitch", new PropertyValue.Int(200)));
	}

	@Test
	void sanitizesTypographicQuotesAndInvisibleCharacters() {
		Statement statement = parser.parseLine("\uFEFFLINK \u201CSteps\u201D TO \u201CSFX\u200B\u201D AS \u201CBus\u201D");

		assertThat(statement).isEqualTo(new Statement.Link("Steps", "SFX", Relation.OUTPUT_BUS));
	}

	@Test
	void normalizesOnlyOutsideQuotedLiterals() {
		Statement create = parser.parseLine("CREATE Sound \"\uFF21\uFF081\uFF09\" UNDER \"Root\"");
		Statement setProp = parser.parseLine("SET_PROP \"A\" \"Volume\" \uFF1D \uFF0D\uFF13");

		assertThat(((Statement.Create) create).name()).isEqualTo("\uFF21\uFF081\uFF09");
		assertThat(setProp).isEqualTo(new Statement.SetProp("A", "Volume", new PropertyValue.Int(-3)));
	}

	@Test
	void namesMayContainEscapedQuotes() {
		Statement statement = parser.parseLine("CREATE Sound \"The \\\"Big\\\" One\" UNDER \"Root\"");

		assertThat(((Statement.Create) statement).name()).isEqualTo("The \"Big\" One");
	}

	@Test
	void bestEffortModeReportsAndSkipsBadLines() {
		ParseResult result = parser.parse(List.of(
				"CREATE Sound \"A\" UNDER \"Root\"",
				"CREATE Sound \"B UNDER \"Root\"",
				"DELETE \"A\"",
				"LINK \"A\" TO \"B\"",
				"SET_PROP \"A\" \"Volume\" = -6"));

		assertThat(result.statements()).hasSize(2);
		assertThat(result.errors()).extracting(ParseError::lineNumber, ParseError::kind).containsExactly(
				tuple(2, FailureKind.UNBALANCED_QUOTING),
				tuple(3, FailureKind.UNKNOWN_COMMAND),
				tuple(4, FailureKind.MALFORMED_STATEMENT));
	}

	@Test
	void unknownTypeRelationOrActionIsMalformed() {
		assertMalformed("CREATE Spaceship \"A\" UNDER \"Root\"");
		assertMalformed("LINK \"A\" TO \"B\" AS \"Sidechain\"");
		assertMalformed("ADD_ACTION \"E\" EXPLODE \"A\"");
		assertMalformed("SET_PROP \"A\" \"Volume\" =");
		assertMalformed("CREATE Sound \"\" UNDER \"Root\"");
		assertMalformed("CREATE Sound \"A\" UNDER \"Root\" extra");
	}

	@Test
	void strictModeAbortsWithLineNumber() {
		DslParser strict = DslParser.strict();

		assertThatThrownBy(() -> strict.parse("CREATE Sound \"A\" UNDER \"Root\"\nBOGUS \"A\""))
				.isInstanceOf(DslParseException.class)
				.hasMessageStartingWith("Line 2: ")
				.satisfies(ex -> {
					DslParseException parseException = (DslParseException) ex;
					assertThat(parseException.kind()).isEqualTo(FailureKind.UNKNOWN_COMMAND);
					assertThat(parseException.lineNumber()).isEqualTo(2);
				});
	}

	@Test
	void unbalancedQuoteInValue() {
		assertThatThrownBy(() -> parser.parseLine("SET_PROP \"A\" \"Color\" = \"red"))
				.isInstanceOf(DslParseException.class)
				.extracting(ex -> ((DslParseException) ex).kind())
				.isEqualTo(FailureKind.UNBALANCED_QUOTING);
	}

	private void assertMalformed(String line) {
		assertThatThrownBy(() -> parser.parseLine(line))
				.as(line)
				.isInstanceOf(DslParseException.class)
				.extracting(ex -> ((DslParseException) ex).kind())
				.isEqualTo(FailureKind.MALFORMED_STATEMENT);
	}
}

package org.javai.wwisedsl.dsl;

import static org.assertj.core.api.Assertions.assertThat;
import java.util.List;
import org.javai.wwisedsl.model.ActionKind;
import org.javai.wwisedsl.model.CurvePoint;
import org.javai.wwisedsl.model.ObjectType;
import org.javai.wwisedsl.model.PropertyValue;
import org.javai.wwisedsl.model.Relation;
import org.junit.jupiter.api.Test;

class DslRendererTest {

	@Test
	void rendersCanonicalLines() {
		assertThat(DslRenderer.render(new Statement.Create(ObjectType.ACTOR_MIXER, "Weapons", "Default Work Unit")))
				.isEqualTo("CREATE ActorMixer \"Weapons\" UNDER \"Default Work Unit\"");
		assertThat(DslRenderer.render(new Statement.SetProp("Weapons", "IsLoopingEnabled", PropertyValue.of(true))))
				.isEqualTo("SET_PROP \"Weapons\" \"IsLoopingEnabled\" = True");
		assertThat(DslRenderer.render(new Statement.Link("Weapons", "SFX", Relation.OUTPUT_BUS)))
				.isEqualTo("LINK \"Weapons\" TO \"SFX\" AS \"Bus\"");
		assertThat(DslRenderer.render(new Statement.AddAction("Fire", ActionKind.SET_SWITCH, "Weapons")))
				.isEqualTo("ADD_ACTION \"Fire\" SETSWITCH \"Weapons\"");
	}

	@Test
	void renderedTextParsesBackToEqualStatements() {
		List<Statement> statements = List.of(
				new Statement.Create(ObjectType.SWITCH_CONTAINER, "Surface \"Wet\"", "Root"),
				new Statement.SetProp("Surface \"Wet\"", "Volume", PropertyValue.of(-4.5)),
				new Statement.SetProp("Surface \"Wet\"", "Color", PropertyValue.text("path\\to")),
				new Statement.SetProp("Falloff", "VolumeDryUsage", new PropertyValue.Curve(List.of(
						new CurvePoint(0, 0), new CurvePoint(100, -96)))),
				new Statement.Link("Surface \"Wet\"", "Surface", Relation.SWITCH_GROUP_OR_STATE_GROUP),
				new Statement.AddAction("Play_Step", ActionKind.PLAY, "Surface \"Wet\""));

		ParseResult parsed = new DslParser().parse(DslRenderer.render(statements));

		assertThat(parsed.errors()).isEmpty();
		assertThat(parsed.statements()).isEqualTo(statements);
	}

	@Test
	void namesAndTextKeepCompatibilityCharactersAndLineBreaks() {
		String skill = "\u6280\u80FD\uFF08\u706B\uFF09";
		List<Statement> statements = List.of(
				new Statement.Create(ObjectType.ACTOR_MIXER, skill, "Default Work Unit"),
				new Statement.Create(ObjectType.SOUND, "\uFF21", skill),
				new Statement.Create(ObjectType.SOUND, "A", skill),
				new Statement.Create(ObjectType.SOUND, "Two\nLines", skill),
				new Statement.SetProp("A", "Notes", PropertyValue.text("first\r\nsecond \\n")));

		String text = DslRenderer.render(statements);
		ParseResult parsed = new DslParser().parse(text);

		assertThat(text.lines()).hasSize(5);
		assertThat(parsed.errors()).isEmpty();
		assertThat(parsed.statements()).isEqualTo(statements);
	}
}

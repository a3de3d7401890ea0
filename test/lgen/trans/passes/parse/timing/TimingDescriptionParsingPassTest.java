package lgen.trans.passes.parse.timing;

import lgen.errors.TopLevelIssueContext;
import lgen.model.timing.*;
import lgen.trans.passes.parse.IOErrorIssue;
import org.junit.Before;
import org.junit.Test;

import java.nio.file.Paths;
import java.util.Arrays;
import java.util.List;

import static org.hamcrest.CoreMatchers.*;
import static org.junit.Assert.*;

public class TimingDescriptionParsingPassTest {

	private TopLevelIssueContext ctx;

	@Before
	public void setup() {
		ctx = new TopLevelIssueContext();
	}

	private List<String> messages() {
		return ctx.getMessages();
	}

	@Test
	public void testFixture() {
		TimingDescription timing = TimingDescriptionParsingPass.perform(ctx, Paths.get("test", "timing", "practice_11.json"));
		assertFalse(ctx.hasErrors());
		assertThat(timing.getInputs().size(), is(2));
		assertThat(timing.getInputs().get(0).getComment(), is("시작 버튼"));
		assertThat(timing.getOutputs().get(2).getKind(), is(OutputKind.BUZZER));
		assertThat(timing.getSteps().size(), is(4));
		assertThat(timing.getSteps().get(1).getDelay().get(), is(5.0));
		assertTrue(timing.getSteps().get(0).isImmediate());
	}

	@Test
	public void testDefaults() {
		TimingDescription timing = TimingDescriptionParsingPass.perform(ctx,
				"{\"inputs\": [{\"name\": \"SW\"}], \"outputs\": [{\"name\": \"M1\"}]}");
		assertFalse(ctx.hasErrors());
		assertThat(timing.getDescription(), is(""));
		assertThat(timing.getInputs().get(0).getKind(), is(InputKind.PUSH_BUTTON));
		assertThat(timing.getInputs().get(0).getMode(), is(ActuationMode.MOMENTARY));
		assertThat(timing.getOutputs().get(0).getKind(), is(OutputKind.LAMP));
		assertTrue(timing.getSteps().isEmpty());
	}

	@Test
	public void testProblemsAreReportedAndDropped() {
		String text = "{"
				+ "\"inputs\": [{\"name\": \"PB1\", \"type\": \"lever\"}, {\"comment\": \"nameless\"}, 7],"
				+ "\"outputs\": [{\"name\": \"RL\", \"type\": \"siren\"}],"
				+ "\"sequences\": [{\"trigger\": \"PB1\", \"action\": \"RL ON\", \"delay\": \"soon\"},"
				+ "                {\"trigger\": \"PB1\"},"
				+ "                {\"trigger\": \"PB1\", \"action\": \"RL ON\", \"delay\": 2}]"
				+ "}";
		TimingDescription timing = TimingDescriptionParsingPass.perform(ctx, text);
		assertThat(messages(), is(Arrays.asList(
				"unable to parse timing description at inputs[0].type: unknown input type \"lever\"",
				"unable to parse timing description at inputs[1].name: missing name",
				"unable to parse timing description at inputs[2]: expected an object",
				"unable to parse timing description at outputs[0].type: unknown output type \"siren\"",
				"unable to parse timing description at sequences[0].delay: expected a number of seconds",
				"unable to parse timing description at sequences[1].action: missing action")));
		assertTrue(timing.getInputs().isEmpty());
		assertTrue(timing.getOutputs().isEmpty());
		assertThat(timing.getSteps().size(), is(1));
		assertThat(timing.getSteps().get(0).getDelay().get(), is(2.0));
	}

	@Test
	public void testNotAnArray() {
		TimingDescription timing = TimingDescriptionParsingPass.perform(ctx, "{\"inputs\": {\"name\": \"PB1\"}}");
		assertThat(messages(), is(Arrays.asList("unable to parse timing description at inputs: expected an array")));
		assertTrue(timing.getInputs().isEmpty());
	}

	@Test
	public void testMalformedJson() {
		assertThat(TimingDescriptionParsingPass.perform(ctx, "{\"inputs\": ["), is(nullValue()));
		assertThat(ctx.getIssues().size(), is(1));
		assertThat(ctx.getIssues().get(0).getMessage(), startsWith("unable to parse timing description: "));
	}

	@Test
	public void testMissingFile() {
		assertThat(TimingDescriptionParsingPass.perform(ctx, Paths.get("test", "timing", "no_such_file.json")),
				is(nullValue()));
		assertThat(ctx.getIssues().get(0), instanceOf(IOErrorIssue.class));
		assertThat(ctx.getMessages().get(0), containsString("no_such_file.json"));
	}
}

package lgen.trans.passes.synthesis;

import lgen.errors.TopLevelIssueContext;
import lgen.model.device.DeviceAddress;
import lgen.model.device.DeviceAllocation;
import lgen.model.device.DeviceType;
import lgen.model.il.InstructionSequence;
import lgen.model.ladder.LadderProgram;
import lgen.model.timing.TimingDescription;
import lgen.trans.passes.codegen.LadderCompilePass;
import lgen.trans.passes.parse.timing.TimingDescriptionParsingPass;
import lgen.trans.passes.validation.InstructionValidationPass;
import lgen.trans.patterns.PatternNotFoundException;
import lgen.trans.patterns.PatternRegistry;
import org.junit.Test;

import java.nio.file.Paths;
import java.util.*;

import static org.hamcrest.CoreMatchers.*;
import static org.junit.Assert.*;

public class SynthesisPassTest {

	private static TimingDescription load(String name) {
		TopLevelIssueContext ctx = new TopLevelIssueContext();
		TimingDescription timing = TimingDescriptionParsingPass.perform(ctx, Paths.get("test", "timing", name + ".json"));
		assertFalse(ctx.format(), ctx.hasErrors());
		return timing;
	}

	@Test
	public void testSimpleOnOff() {
		LadderProgram program = SynthesisPass.perform(load("simple_onoff"), PatternRegistry.createDefault());
		assertThat(program.getName(), is(SynthesisPass.DEFAULT_PROGRAM_NAME));
		assertThat(program.getPatternTags().toString(), is("[self_hold]"));
		assertThat(program.getDeviceMap().size(), is(4));
		assertThat(program.getDeviceMap().getAddressString("LAMP").get(), is("Y0"));
	}

	@Test
	public void testPractice11() {
		LadderProgram program = SynthesisPass.perform(load("practice_11"), PatternRegistry.createDefault());
		InstructionSequence sequence = LadderCompilePass.perform(program);
		List<String> lines = sequence.toLines();
		assertThat(lines.get(0), is("LD X0"));
		assertThat(lines.get(lines.size() - 1), is("END"));
		assertTrue(lines.contains("OUT T0 K50"));
		assertTrue(lines.contains("OUT T1 K100"));
		assertThat(InstructionValidationPass.validate(sequence), is(Collections.<String>emptyList()));
		assertThat(program.getPatternTags(), hasItems("self_hold", "timer_delay", "sequential"));
	}

	@Test
	public void testCarWash() {
		LadderProgram program = SynthesisPass.perform(load("car_wash"), PatternRegistry.createDefault());
		assertThat(program.getRungs().size(), is(23));

		List<Integer> stageK = new ArrayList<>();
		for (int i = 0; i <= 7; i++) {
			DeviceAllocation timer = program.getDeviceMap().getByAddress(
					DeviceAddress.parse("T" + i)).get();
			stageK.add(timer.getTimerConfig().get().getKValue());
		}
		assertThat(stageK, is(Arrays.asList(50, 30, 80, 60, 50, 50, 40, 100)));
		assertThat(program.getDeviceMap().getByName("T_FLICKER_BZ_ON").get().getTimerConfig().get().getKValue(), is(5));
		assertThat(program.getDeviceMap().getByName("T_FLICKER_BZ_OFF").get().getTimerConfig().get().getKValue(), is(5));

		// outputs are numbered in octal
		assertThat(program.getDeviceMap().getAddressString("BL").get(), is("Y10"));
		assertThat(program.getDeviceMap().getAddressString("BZ").get(), is("Y11"));
		assertThat(program.getDeviceMap().getAddressString("GL").get(), is("Y12"));

		assertThat(InstructionValidationPass.validate(LadderCompilePass.perform(program)),
				is(Collections.<String>emptyList()));
	}

	@Test
	public void testDeterministic() {
		TimingDescription timing = load("car_wash");
		LadderProgram first = SynthesisPass.perform(timing, PatternRegistry.createDefault());
		LadderProgram second = SynthesisPass.perform(timing, PatternRegistry.createDefault());
		assertThat(second, is(first));
		assertThat(LadderCompilePass.perform(second).toLines(), is(LadderCompilePass.perform(first).toLines()));
	}

	@Test(expected = PatternNotFoundException.class)
	public void testNoPattern() {
		TimingDescription timing = new TimingDescription("nothing", Collections.emptyList(),
				Collections.emptyList(), Collections.emptyList());
		SynthesisPass.perform(timing, PatternRegistry.createDefault());
	}

	@Test
	public void testProgramNameAndDeviceStart() {
		Map<DeviceType, Integer> start = new EnumMap<>(DeviceType.class);
		start.put(DeviceType.M, 50);
		start.put(DeviceType.X, 8);
		LadderProgram program = SynthesisPass.perform(load("simple_onoff"), PatternRegistry.createDefault(),
				"LINE1", start);
		assertThat(program.getName(), is("LINE1"));
		assertThat(LadderCompilePass.perform(program).toLines(), is(Arrays.asList(
				"LD X10", "OR M50", "ANI X11", "OUT M50", "LD M50", "OUT Y0", "END")));
	}
}

package lgen.trans.patterns;

import lgen.model.ladder.LadderProgram;
import lgen.model.ladder.builder.LadderBuilder;
import lgen.model.timing.InputDeclaration;
import lgen.model.timing.OutputDeclaration;
import lgen.model.timing.SequenceStep;
import lgen.model.timing.TimingDescription;
import lgen.trans.allocation.DeviceAllocator;
import lgen.trans.passes.codegen.LadderCompilePass;
import org.junit.Test;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;

import static org.hamcrest.CoreMatchers.is;
import static org.junit.Assert.*;

public class SequentialPatternTest {

	private static TimingDescription sequence(SequenceStep... steps) {
		List<OutputDeclaration> outputs = new ArrayList<>();
		for (String name : Arrays.asList("A", "B", "C", "D")) {
			outputs.add(new OutputDeclaration(name, ""));
		}
		return new TimingDescription("stages",
				Arrays.asList(new InputDeclaration("START", ""), new InputDeclaration("STOP", "")),
				outputs, Arrays.asList(steps));
	}

	private static LadderProgram generate(TimingDescription timing) {
		DeviceAllocator allocator = new DeviceAllocator();
		LadderBuilder builder = new LadderBuilder();
		SequentialPattern.generate(timing, allocator, builder);
		return builder.setDeviceMap(allocator.buildDeviceMap()).build();
	}

	@Test
	public void testMatches() {
		assertTrue(SequentialPattern.matches(sequence(
				new SequenceStep("START", "A ON"), new SequenceStep("A ON", "B ON", 2.0))));
		// no immediate start action
		assertFalse(SequentialPattern.matches(sequence(new SequenceStep("START", "A ON", 2.0))));
		// nothing delayed
		assertFalse(SequentialPattern.matches(sequence(new SequenceStep("START", "A ON"))));
	}

	@Test
	public void testIsChained() {
		assertFalse(SequentialPattern.isChained(sequence(
				new SequenceStep("START", "A ON"),
				new SequenceStep("A ON", "B ON", 2.0),
				new SequenceStep("A ON", "C ON", 4.0))));
		assertFalse(SequentialPattern.isChained(sequence(new SequenceStep("A ON", "B ON", 2.0))));
		assertTrue(SequentialPattern.isChained(sequence(
				new SequenceStep("A ON", "B ON", 2.0),
				new SequenceStep("B  on", "C ON", 4.0))));
	}

	@Test
	public void testCumulative() {
		LadderProgram program = generate(sequence(
				new SequenceStep("START", "A ON"),
				new SequenceStep("A ON", "B ON", 2.0),
				new SequenceStep("A ON", "C ON", 4.0),
				new SequenceStep("STOP", "ALL OFF")));
		assertThat(LadderCompilePass.perform(program).toLines(), is(Arrays.asList(
				"LD X0", "OR M0", "ANI X1", "OUT M0",
				"LD M0", "OUT Y0",
				"LD M0", "OUT T0 K20", "LD T0", "OUT Y1",
				"LD M0", "OUT T1 K40", "LD T1", "OUT Y2",
				"END")));
		assertThat(program.getPatternTags().toString(), is("[self_hold, timer_delay, sequential]"));
	}

	@Test
	public void testChainedWithFlickerAndCompletion() {
		LadderProgram program = generate(sequence(
				new SequenceStep("START", "A ON"),
				new SequenceStep("A ON", "B ON", 2.0),
				new SequenceStep("B ON", "C FLICKER", 1.0),
				new SequenceStep("B ON", "D ON", 1.0),
				new SequenceStep("STOP", "ALL OFF")));
		assertThat(program.getRungs().size(), is(10));
		assertThat(LadderCompilePass.perform(program).toLines(), is(Arrays.asList(
				"LD X0", "OR M0", "ANI X1", "OUT M0",
				"LD M0", "OUT T0 K20",
				"LD M0", "ANI T0", "OUT Y0",
				"LD T0", "OUT T1 K10",
				"LD T0", "ANI T1", "OUT Y1",
				"LD T1", "OUT M1",
				"LD M1", "ANI T3", "OUT T2 K5",
				"LD T2", "OUT T3 K5",
				"LD T2", "ANI T3", "OUT Y2",
				"LD M1", "OUT Y3",
				"END")));
		assertThat(program.getDeviceMap().getAddressString(SequentialPattern.COMPLETION_RELAY).get(), is("M1"));
		assertThat(program.getDeviceMap().getAddressString("T_FLICKER_C_ON").get(), is("T2"));
	}

	@Test
	public void testCyclicChainTerminates() {
		LadderProgram program = generate(sequence(
				new SequenceStep("START", "A ON"),
				new SequenceStep("A ON", "B ON", 1.0),
				new SequenceStep("B ON", "A ON", 1.0)));
		// self-hold plus a timer and a gated output per stage, no completion relay
		assertThat(program.getRungs().size(), is(5));
		assertFalse(program.getDeviceMap().getByName(SequentialPattern.COMPLETION_RELAY).isPresent());
	}

	@Test
	public void testOtherImmediatesAreDrivenByTheRelay() {
		LadderProgram program = generate(sequence(
				new SequenceStep("START", "D ON"),
				new SequenceStep("START", "A ON"),
				new SequenceStep("A ON", "B ON", 3.0),
				new SequenceStep("B ON", "C ON", 3.0)));
		List<String> lines = LadderCompilePass.perform(program).toLines();
		assertThat(lines.subList(4, 6), is(Arrays.asList("LD M0", "OUT Y0")));
		assertThat(program.getDeviceMap().getAddressString("D").get(), is("Y0"));
		assertThat(program.getDeviceMap().getAddressString("A").get(), is("Y1"));
	}
}

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

import java.util.Arrays;
import java.util.Collections;

import static org.hamcrest.CoreMatchers.is;
import static org.junit.Assert.*;

public class FlickerPatternTest {

	private static TimingDescription singleInput(String description, SequenceStep... steps) {
		return new TimingDescription(description,
				Collections.singletonList(new InputDeclaration("SW", "")),
				Collections.singletonList(new OutputDeclaration("RL", "")),
				Arrays.asList(steps));
	}

	@Test
	public void testKeywords() {
		assertTrue(FlickerPattern.matches(singleInput("RL should BLINK")));
		assertTrue(FlickerPattern.matches(singleInput("RL이 깜빡인다")));
		assertTrue(FlickerPattern.matches(singleInput("repeat: 반복")));
		assertFalse(FlickerPattern.matches(singleInput("RL turns on")));
	}

	@Test
	public void testSingleInputEnablesDirectly() {
		DeviceAllocator allocator = new DeviceAllocator();
		LadderBuilder builder = new LadderBuilder();
		FlickerPattern.generate(singleInput("blink", new SequenceStep("SW", "RL ON", 0.5)), allocator, builder);
		LadderProgram program = builder.build();
		assertThat(LadderCompilePass.perform(program).toLines(), is(Arrays.asList(
				"LD X0", "ANI T1", "OUT T0 K5",
				"LD T0", "OUT T1 K5",
				"LD T0", "ANI T1", "OUT Y0",
				"END")));
		assertThat(program.getPatternTags().toString(), is("[flicker]"));
		assertFalse(allocator.getAllocation("M_SW_HOLD").isPresent());
	}

	@Test
	public void testDefaultPeriod() {
		DeviceAllocator allocator = new DeviceAllocator();
		FlickerPattern.generate(singleInput("blink", new SequenceStep("SW", "RL ON")), allocator, new LadderBuilder());
		assertThat(allocator.getAllocation("T_FLICKER_ON").get().getTimerConfig().get().getKValue(), is(10));
		assertThat(allocator.getAllocation("T_FLICKER_OFF").get().getTimerConfig().get().getKValue(), is(10));
	}

	@Test
	public void testTwoInputsUseHoldRelay() {
		TimingDescription timing = new TimingDescription("점멸",
				Arrays.asList(new InputDeclaration("PB1", ""), new InputDeclaration("PB2", "")),
				Collections.singletonList(new OutputDeclaration("RL", "")),
				Collections.singletonList(new SequenceStep("PB1", "RL ON", 2.0)));
		LadderBuilder builder = new LadderBuilder();
		FlickerPattern.generate(timing, new DeviceAllocator(), builder);
		LadderProgram program = builder.build();
		assertThat(program.getRungs().size(), is(4));
		assertThat(program.getPatternTags().toString(), is("[self_hold, flicker]"));
		assertThat(LadderCompilePass.compileRung(program.getRungs().get(1)).get(2).toString(), is("OUT T0 K20"));
	}

	@Test
	public void testNothingToBlink() {
		TimingDescription timing = new TimingDescription("blink",
				Collections.singletonList(new InputDeclaration("SW", "")),
				Collections.emptyList(), Collections.emptyList());
		LadderBuilder builder = new LadderBuilder();
		FlickerPattern.generate(timing, new DeviceAllocator(), builder);
		assertThat(builder.getRungs().size(), is(0));
		assertTrue(builder.build().getPatternTags().isEmpty());
	}
}

package lgen.trans.patterns;

import lgen.model.device.DeviceAddress;
import lgen.model.ladder.builder.LadderBuilder;
import lgen.model.timing.InputDeclaration;
import lgen.model.timing.OutputDeclaration;
import lgen.model.timing.SequenceStep;
import lgen.model.timing.TimingDescription;
import lgen.trans.allocation.DeviceAllocator;
import lgen.trans.passes.codegen.LadderCompilePass;
import org.junit.Before;
import org.junit.Test;

import java.util.Arrays;

import static org.hamcrest.CoreMatchers.is;
import static org.junit.Assert.*;

public class TimerDelayPatternTest {

	private DeviceAllocator allocator;
	private LadderBuilder builder;

	@Before
	public void setup() {
		allocator = new DeviceAllocator();
		builder = new LadderBuilder();
	}

	private static TimingDescription delayed(SequenceStep... steps) {
		return new TimingDescription("delay",
				Arrays.asList(new InputDeclaration("PB1", ""), new InputDeclaration("PB2", "")),
				Arrays.asList(new OutputDeclaration("LAMP", ""), new OutputDeclaration("FAN", "")),
				Arrays.asList(steps));
	}

	@Test
	public void testMatches() {
		assertTrue(TimerDelayPattern.matches(delayed(new SequenceStep("PB1", "LAMP ON", 3.0))));
		assertFalse(TimerDelayPattern.matches(delayed(new SequenceStep("PB1", "LAMP ON", 0.0))));
		assertFalse(TimerDelayPattern.matches(delayed(new SequenceStep("PB1", "LAMP ON"))));
	}

	@Test
	public void testTriggerResolvesToInput() {
		TimerDelayPattern.generate(delayed(new SequenceStep("PB1", "LAMP ON", 3.0)), allocator, builder);
		assertThat(LadderCompilePass.perform(builder.build()).toLines(), is(Arrays.asList(
				"LD X0", "OUT T0 K30", "LD T0", "OUT Y0", "END")));
		assertThat(allocator.getAllocation("T_LAMP").get().getComment(), is("3s delay (LAMP)"));
	}

	@Test
	public void testTriggerPrefersHoldRelay() {
		allocator.allocateRelay("M_PB1_HOLD", "PB1 self-hold");
		TimerDelayPattern.generate(delayed(new SequenceStep("PB1", "FAN ON", 1.5)), allocator, builder);
		assertThat(LadderCompilePass.perform(builder.build()).toLines(), is(Arrays.asList(
				"LD M0", "OUT T0 K15", "LD T0", "OUT Y0", "END")));
	}

	@Test
	public void testUnresolvableStepsAreSkipped() {
		TimerDelayPattern.generate(delayed(
				new SequenceStep("SENSOR ON", "LAMP ON", 2.0),
				new SequenceStep("PB1", "HORN ON", 2.0),
				new SequenceStep("PB1", "ALL OFF", 2.0)), allocator, builder);
		assertThat(builder.getRungs().size(), is(0));
		assertThat(builder.build().getPatternTags().toString(), is("[timer_delay]"));
	}

	@Test
	public void testPreviousTimerAsTrigger() {
		TimerDelayPattern.generate(delayed(
				new SequenceStep("PB1", "LAMP ON", 1.0),
				new SequenceStep("T_LAMP", "FAN ON", 2.0)), allocator, builder);
		assertThat(LadderCompilePass.perform(builder.build()).toLines(), is(Arrays.asList(
				"LD X0", "OUT T0 K10", "LD T0", "OUT Y0",
				"LD T0", "OUT T1 K20", "LD T1", "OUT Y1", "END")));
		assertThat(allocator.getAllocation("FAN").get().getAddress(), is(DeviceAddress.parse("Y1")));
	}
}

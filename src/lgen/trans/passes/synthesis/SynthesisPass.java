package lgen.trans.passes.synthesis;

import lgen.model.device.DeviceType;
import lgen.model.ladder.LadderProgram;
import lgen.model.ladder.builder.LadderBuilder;
import lgen.model.timing.TimingDescription;
import lgen.trans.allocation.DeviceAllocator;
import lgen.trans.patterns.LadderPattern;
import lgen.trans.patterns.PatternNotFoundException;
import lgen.trans.patterns.PatternRegistry;

import java.util.Collections;
import java.util.Map;

public class SynthesisPass {
	public static final String DEFAULT_PROGRAM_NAME = "MAIN";

	private SynthesisPass() {}

	public static LadderProgram perform(TimingDescription timing, PatternRegistry registry) {
		return perform(timing, registry, DEFAULT_PROGRAM_NAME, Collections.emptyMap());
	}

	/**
	 * Generates a program from the highest-priority pattern matching the description.
	 * Every call uses its own allocator and builder.
	 *
	 * @param deviceStart first address to hand out per device type; types not listed start at 0
	 * @throws PatternNotFoundException if no registered pattern matches
	 */
	public static LadderProgram perform(TimingDescription timing, PatternRegistry registry, String programName,
										Map<DeviceType, Integer> deviceStart) {
		LadderPattern pattern = registry.findBest(timing).orElseThrow(() -> new PatternNotFoundException(
				"no pattern matches the timing description \"" + timing.getDescription() + "\""));
		DeviceAllocator allocator = new DeviceAllocator(deviceStart);
		LadderBuilder builder = new LadderBuilder(programName);
		pattern.generate(timing, allocator, builder);
		builder.setDeviceMap(allocator.buildDeviceMap());
		return builder.build();
	}
}

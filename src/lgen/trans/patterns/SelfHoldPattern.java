package lgen.trans.patterns;

import lgen.model.device.DeviceAddress;
import lgen.model.ladder.builder.LadderBuilder;
import lgen.model.timing.InputDeclaration;
import lgen.model.timing.SequenceStep;
import lgen.model.timing.TimingDescription;
import lgen.trans.allocation.DeviceAllocator;

/**
 * Start/stop latch: the first input sets a relay that holds itself until the last input
 * breaks the loop.
 *
 * <pre>
 *   LD  X0
 *   OR  M0
 *   ANI X1
 *   OUT M0
 * </pre>
 */
public final class SelfHoldPattern {
	public static final String NAME = "self_hold";
	public static final int PRIORITY = 10;

	private SelfHoldPattern() {}

	public static LadderPattern pattern() {
		return new LadderPattern(NAME, "self-hold circuit (start latches, stop releases)", PRIORITY,
				SelfHoldPattern::matches, SelfHoldPattern::generate);
	}

	public static boolean matches(TimingDescription timing) {
		boolean hasStart = false;
		boolean hasStop = false;
		for (SequenceStep step : timing.getSteps()) {
			if (step.getAction().isOn()) {
				hasStart = true;
			}
			if (step.getAction().isOff()) {
				hasStop = true;
			}
		}
		return hasStart && hasStop && timing.getInputs().size() >= 2;
	}

	public static void generate(TimingDescription timing, DeviceAllocator allocator, LadderBuilder builder) {
		if (timing.getInputs().size() < 2) {
			return;
		}
		InputDeclaration start = timing.getInputs().get(0);
		DeviceAddress relay = PatternSupport.addSelfHold(timing, allocator, builder,
				PatternSupport.holdRelayName(start), start.getName() + " self-hold");
		PatternSupport.addImmediateOutputs(timing, allocator, builder, relay);
		builder.addPatternTag(NAME);
	}
}

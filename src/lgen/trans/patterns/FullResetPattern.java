package lgen.trans.patterns;

import lgen.model.ladder.builder.LadderBuilder;
import lgen.model.timing.ActionLabel;
import lgen.model.timing.SequenceStep;
import lgen.model.timing.TimingDescription;
import lgen.trans.allocation.DeviceAllocator;

/**
 * "Everything off" on a stop input. The reset itself is the normally closed stop contact
 * inside the self-hold rung, so this pattern only records that the idiom is present.
 */
public final class FullResetPattern {
	public static final String NAME = "full_reset";
	public static final int PRIORITY = 3;

	private FullResetPattern() {}

	public static LadderPattern pattern() {
		return new LadderPattern(NAME, "full reset (stop turns every output off)", PRIORITY,
				FullResetPattern::matches, FullResetPattern::generate);
	}

	public static boolean matches(TimingDescription timing) {
		for (SequenceStep step : timing.getSteps()) {
			ActionLabel action = step.getAction();
			if (action.isAll() && action.isOff()) {
				return true;
			}
		}
		return false;
	}

	public static void generate(TimingDescription timing, DeviceAllocator allocator, LadderBuilder builder) {
		builder.addPatternTag(NAME);
	}
}

package lgen.trans.patterns;

import lgen.model.device.DeviceAddress;
import lgen.model.device.DeviceAllocation;
import lgen.model.ladder.builder.LadderBuilder;
import lgen.model.timing.*;
import lgen.trans.allocation.DeviceAllocator;

import java.util.Optional;

/**
 * On-delay: N seconds after the trigger, the target output turns on.
 *
 * <pre>
 *   LD  M0
 *   OUT T0 K50
 *   LD  T0
 *   OUT Y1
 * </pre>
 */
public final class TimerDelayPattern {
	public static final String NAME = "timer_delay";
	public static final int PRIORITY = 5;

	private TimerDelayPattern() {}

	public static LadderPattern pattern() {
		return new LadderPattern(NAME, "timer delay (output on N seconds after its trigger)", PRIORITY,
				TimerDelayPattern::matches, TimerDelayPattern::generate);
	}

	public static boolean matches(TimingDescription timing) {
		for (SequenceStep step : timing.getSteps()) {
			if (step.isDelayed()) {
				return true;
			}
		}
		return false;
	}

	public static void generate(TimingDescription timing, DeviceAllocator allocator, LadderBuilder builder) {
		for (SequenceStep step : timing.getDelayedSteps()) {
			Optional<DeviceAddress> source = resolveSource(step.getTrigger(), timing, allocator);
			if (!source.isPresent() || step.getAction().isAll()) {
				continue;
			}
			String target = step.getAction().getDeviceName();
			Optional<OutputDeclaration> output = timing.findOutput(target);
			if (!output.isPresent()) {
				continue;
			}
			double seconds = step.getDelay().get();
			String delay = PatternSupport.formatSeconds(seconds);
			DeviceAllocation timer = allocator.allocateTimer("T_" + target, seconds, delay + " delay (" + target + ")");
			DeviceAddress outputAddress = PatternSupport.allocateOutput(allocator, output.get());
			builder.addTimerRung(source.get(), timer.getAddress(), PatternSupport.kValueOf(timer),
					delay + " timer (" + target + ")");
			builder.addOutputRung(timer.getAddress(), outputAddress, target + " output");
		}
		builder.addPatternTag(NAME);
	}

	/**
	 * A trigger resolves to its self-hold relay, then to any device already allocated
	 * under its name, then to a declared input.
	 */
	static Optional<DeviceAddress> resolveSource(ActionLabel trigger, TimingDescription timing,
												 DeviceAllocator allocator) {
		String name = trigger.getDeviceName();
		Optional<DeviceAllocation> relay = allocator.getAllocation("M_" + name + "_HOLD");
		if (relay.isPresent()) {
			return Optional.of(relay.get().getAddress());
		}
		Optional<DeviceAllocation> existing = allocator.getAllocation(name);
		if (existing.isPresent()) {
			return Optional.of(existing.get().getAddress());
		}
		Optional<InputDeclaration> input = timing.findInput(name);
		if (input.isPresent()) {
			return Optional.of(allocator.allocateInput(name, input.get().getCommentOr(name)).getAddress());
		}
		return Optional.empty();
	}
}

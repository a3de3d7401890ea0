package lgen.trans.patterns;

import lgen.model.device.DeviceAddress;
import lgen.model.device.DeviceAllocation;
import lgen.model.ladder.builder.LadderBuilder;
import lgen.model.timing.OutputDeclaration;
import lgen.model.timing.SequenceStep;
import lgen.model.timing.TimingDescription;
import lgen.trans.allocation.DeviceAllocator;

import java.util.Arrays;
import java.util.List;
import java.util.Locale;
import java.util.Optional;

/**
 * Blinking output driven by two cross-coupled timers of equal period.
 */
public final class FlickerPattern {
	public static final String NAME = "flicker";
	public static final int PRIORITY = 15;

	private static final List<String> KEYWORDS = Arrays.asList("점멸", "flicker", "blink", "반복", "깜빡");
	private static final double DEFAULT_PERIOD = 1.0;

	private FlickerPattern() {}

	public static LadderPattern pattern() {
		return new LadderPattern(NAME, "flicker (output repeats ON/OFF every N seconds)", PRIORITY,
				FlickerPattern::matches, FlickerPattern::generate);
	}

	public static boolean matches(TimingDescription timing) {
		String description = timing.getDescription().toLowerCase(Locale.ROOT);
		for (String keyword : KEYWORDS) {
			if (description.contains(keyword)) {
				return true;
			}
		}
		return false;
	}

	/**
	 * The period is the last positive delay in the sequence and the output the last action
	 * naming a declared output, falling back to the first output. With two or more inputs
	 * the circuit is enabled by a self-hold relay, otherwise directly by the single input.
	 */
	public static void generate(TimingDescription timing, DeviceAllocator allocator, LadderBuilder builder) {
		double period = DEFAULT_PERIOD;
		Optional<OutputDeclaration> output = Optional.empty();
		for (SequenceStep step : timing.getSteps()) {
			if (step.isDelayed()) {
				period = step.getDelay().get();
			}
			Optional<OutputDeclaration> named = timing.findOutput(step.getAction().getDeviceName());
			if (named.isPresent()) {
				output = named;
			}
		}
		if (!output.isPresent() && !timing.getOutputs().isEmpty()) {
			output = Optional.of(timing.getOutputs().get(0));
		}
		if (!output.isPresent() || timing.getInputs().isEmpty()) {
			return;
		}

		DeviceAddress enable;
		if (timing.getInputs().size() >= 2) {
			enable = PatternSupport.addSelfHold(timing, allocator, builder,
					PatternSupport.holdRelayName(timing.getInputs().get(0)),
					timing.getInputs().get(0).getName() + " self-hold");
			builder.addPatternTag(SelfHoldPattern.NAME);
		} else {
			enable = PatternSupport.allocateStart(timing, allocator);
		}

		String seconds = PatternSupport.formatSeconds(period);
		DeviceAllocation onTimer = allocator.allocateTimer("T_FLICKER_ON", period, "flicker ON timer (" + seconds + ")");
		DeviceAllocation offTimer = allocator.allocateTimer("T_FLICKER_OFF", period, "flicker OFF timer (" + seconds + ")");
		DeviceAddress outputAddress = PatternSupport.allocateOutput(allocator, output.get());
		FlickerCircuit.add(builder, enable, onTimer.getAddress(), offTimer.getAddress(),
				PatternSupport.kValueOf(onTimer), outputAddress, output.get().getName());
		builder.addPatternTag(NAME);
	}
}

package lgen.trans.patterns;

import lgen.model.device.DeviceAddress;
import lgen.model.device.DeviceAllocation;
import lgen.model.ladder.builder.LadderBuilder;
import lgen.model.timing.*;
import lgen.trans.allocation.DeviceAllocator;

import java.util.*;

/**
 * Self-hold followed by timed stages. Two layouts are generated:
 *
 *   * cumulative, when every delayed step shares one trigger: each stage has its own
 *     timer driven by the hold relay, so all stages count from the start;
 *   * chained, when delayed steps have different triggers: each stage's timer is driven
 *     by the previous stage's timer, and the stage output is on while its own timer has
 *     not yet elapsed.
 *
 * A chain ends in a completion relay fed by the last stage timer. Terminal FLICKER
 * actions get a flicker circuit off that relay; other terminal actions are driven by it
 * directly.
 */
public final class SequentialPattern {
	public static final String NAME = "sequential";
	public static final int PRIORITY = 20;

	static final String HOLD_RELAY = "M_HOLD";
	static final String COMPLETION_RELAY = "M_COMPLETE";
	static final double CHAINED_FLICKER_PERIOD = 0.5;

	private SequentialPattern() {}

	public static LadderPattern pattern() {
		return new LadderPattern(NAME, "sequential control (self-hold with timed stages)", PRIORITY,
				SequentialPattern::matches, SequentialPattern::generate);
	}

	public static boolean matches(TimingDescription timing) {
		if (timing.getInputs().size() < 2) {
			return false;
		}
		String start = timing.getInputs().get(0).getName();
		boolean hasStart = false;
		boolean hasTimer = false;
		for (SequenceStep step : timing.getSteps()) {
			if (step.isImmediate() && step.getAction().isOn() && step.getTrigger().getDeviceName().equals(start)) {
				hasStart = true;
			}
			if (step.isDelayed()) {
				hasTimer = true;
			}
		}
		return hasStart && hasTimer;
	}

	/**
	 * @return true if the delayed steps have more than one distinct trigger
	 */
	public static boolean isChained(TimingDescription timing) {
		List<SequenceStep> delayed = timing.getDelayedSteps();
		if (delayed.size() < 2) {
			return false;
		}
		Set<String> triggers = new HashSet<>();
		for (SequenceStep step : delayed) {
			triggers.add(step.getTrigger().canonical());
		}
		return triggers.size() > 1;
	}

	public static void generate(TimingDescription timing, DeviceAllocator allocator, LadderBuilder builder) {
		DeviceAddress relay = PatternSupport.addSelfHold(timing, allocator, builder, HOLD_RELAY, "run self-hold");
		if (isChained(timing)) {
			generateChained(timing, allocator, builder, relay);
		} else {
			generateCumulative(timing, allocator, builder, relay);
		}
		builder.addPatternTag(SelfHoldPattern.NAME);
		builder.addPatternTag(TimerDelayPattern.NAME);
		builder.addPatternTag(NAME);
	}

	private static void generateCumulative(TimingDescription timing, DeviceAllocator allocator,
										   LadderBuilder builder, DeviceAddress relay) {
		PatternSupport.addImmediateOutputs(timing, allocator, builder, relay);
		for (SequenceStep step : timing.getDelayedSteps()) {
			if (step.getAction().isAll()) {
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
			builder.addTimerRung(relay, timer.getAddress(), PatternSupport.kValueOf(timer),
					delay + " timer (" + target + ")");
			builder.addOutputRung(timer.getAddress(), outputAddress, target + " output");
		}
	}

	private static final class StageEntry {
		final double delay;
		final ActionLabel action;

		StageEntry(double delay, ActionLabel action) {
			this.delay = delay;
			this.action = action;
		}
	}

	private static void generateChained(TimingDescription timing, DeviceAllocator allocator,
										LadderBuilder builder, DeviceAddress relay) {
		// "<name> ON" trigger -> the delayed actions it starts, in declaration order
		Map<String, List<StageEntry>> stages = new LinkedHashMap<>();
		for (SequenceStep step : timing.getDelayedSteps()) {
			if (step.getAction().isAll()) {
				continue;
			}
			stages.computeIfAbsent(step.getTrigger().canonical(), k -> new ArrayList<>())
					.add(new StageEntry(step.getDelay().get(), step.getAction()));
		}

		String start = timing.getInputs().get(0).getName();
		String chainStarter = null;
		for (SequenceStep step : timing.getSteps()) {
			if (!step.isImmediate() || !step.getTrigger().getDeviceName().equals(start) || step.getAction().isAll()) {
				continue;
			}
			String name = step.getAction().getDeviceName();
			if (chainStarter == null && stages.containsKey(ActionLabel.on(name).canonical())) {
				chainStarter = name;
			} else {
				PatternSupport.addOutput(timing, allocator, builder, relay, name);
			}
		}
		if (chainStarter == null) {
			return;
		}

		String current = chainStarter;
		DeviceAddress enable = relay;
		DeviceAddress lastTimer = null;
		List<String> flickerOutputs = new ArrayList<>();
		List<String> completionOutputs = new ArrayList<>();
		Set<String> visited = new HashSet<>();
		while (stages.containsKey(ActionLabel.on(current).canonical()) && visited.add(current)) {
			List<StageEntry> entries = stages.get(ActionLabel.on(current).canonical());
			String next = null;
			for (StageEntry entry : entries) {
				String name = entry.action.getDeviceName();
				if (entry.action.isFlicker()) {
					flickerOutputs.add(name);
				} else if (stages.containsKey(ActionLabel.on(name).canonical())) {
					next = name;
				} else {
					completionOutputs.add(name);
				}
			}

			// the stage lasts until its first follow-up fires
			double seconds = entries.get(0).delay;
			String duration = PatternSupport.formatSeconds(seconds);
			DeviceAllocation timer = allocator.allocateTimer("T_" + current, seconds,
					current + " timer (" + duration + ")");
			builder.addTimerRung(enable, timer.getAddress(), PatternSupport.kValueOf(timer),
					duration + " timer (" + current + ")");
			Optional<OutputDeclaration> output = timing.findOutput(current);
			if (output.isPresent()) {
				builder.addStageGatedRung(enable, timer.getAddress(),
						PatternSupport.allocateOutput(allocator, output.get()), current + " output");
			}
			lastTimer = timer.getAddress();

			if (next == null) {
				break;
			}
			enable = timer.getAddress();
			current = next;
		}

		if (lastTimer == null || (flickerOutputs.isEmpty() && completionOutputs.isEmpty())) {
			return;
		}
		DeviceAddress completion = allocator.allocateRelay(COMPLETION_RELAY, "sequence complete").getAddress();
		builder.addOutputRung(lastTimer, completion, "sequence complete");
		for (String name : flickerOutputs) {
			addFlicker(timing, allocator, builder, completion, name);
		}
		for (String name : completionOutputs) {
			PatternSupport.addOutput(timing, allocator, builder, completion, name);
		}
	}

	private static void addFlicker(TimingDescription timing, DeviceAllocator allocator, LadderBuilder builder,
								   DeviceAddress enable, String outputName) {
		Optional<OutputDeclaration> output = timing.findOutput(outputName);
		if (!output.isPresent()) {
			return;
		}
		DeviceAllocation onTimer = allocator.allocateTimer("T_FLICKER_" + outputName + "_ON",
				CHAINED_FLICKER_PERIOD, "flicker ON (" + outputName + ")");
		DeviceAllocation offTimer = allocator.allocateTimer("T_FLICKER_" + outputName + "_OFF",
				CHAINED_FLICKER_PERIOD, "flicker OFF (" + outputName + ")");
		DeviceAddress outputAddress = PatternSupport.allocateOutput(allocator, output.get());
		FlickerCircuit.add(builder, enable, onTimer.getAddress(), offTimer.getAddress(),
				PatternSupport.kValueOf(onTimer), outputAddress, outputName);
	}
}

package lgen.trans.patterns;

import lgen.InternalCompilerError;
import lgen.model.device.DeviceAddress;
import lgen.model.device.DeviceAllocation;
import lgen.model.ladder.builder.LadderBuilder;
import lgen.model.timing.InputDeclaration;
import lgen.model.timing.OutputDeclaration;
import lgen.model.timing.SequenceStep;
import lgen.model.timing.TimingDescription;
import lgen.trans.allocation.DeviceAllocator;

import java.util.Optional;

/**
 * Device and rung plumbing shared by the pattern generators.
 */
final class PatternSupport {
	private PatternSupport() {}

	static String holdRelayName(InputDeclaration start) {
		return "M_" + start.getName() + "_HOLD";
	}

	static DeviceAddress allocateStart(TimingDescription timing, DeviceAllocator allocator) {
		InputDeclaration start = timing.getInputs().get(0);
		return allocator.allocateInput(start.getName(), start.getCommentOr(start.getName() + " (start)")).getAddress();
	}

	static DeviceAddress allocateStop(TimingDescription timing, DeviceAllocator allocator) {
		InputDeclaration stop = timing.getInputs().get(timing.getInputs().size() - 1);
		return allocator.allocateInput(stop.getName(), stop.getCommentOr(stop.getName() + " (stop)")).getAddress();
	}

	/**
	 * Latches a relay on the first input and releases it on the last one.
	 *
	 * @return the relay's address
	 */
	static DeviceAddress addSelfHold(TimingDescription timing, DeviceAllocator allocator, LadderBuilder builder,
									 String relayName, String relayComment) {
		InputDeclaration start = timing.getInputs().get(0);
		DeviceAddress startAddress = allocateStart(timing, allocator);
		DeviceAddress stopAddress = allocateStop(timing, allocator);
		DeviceAddress relay = allocator.allocateRelay(relayName, relayComment).getAddress();
		builder.addSelfHoldRung(startAddress, stopAddress, relay, start.getName() + " self-hold circuit");
		return relay;
	}

	/**
	 * Drives a declared output from a single contact. Undeclared outputs are skipped.
	 *
	 * @return true if a rung was added
	 */
	static boolean addOutput(TimingDescription timing, DeviceAllocator allocator, LadderBuilder builder,
							 DeviceAddress contact, String outputName) {
		Optional<OutputDeclaration> output = timing.findOutput(outputName);
		if (!output.isPresent()) {
			return false;
		}
		DeviceAddress address = allocateOutput(allocator, output.get());
		builder.addOutputRung(contact, address, output.get().getName() + " output");
		return true;
	}

	static DeviceAddress allocateOutput(DeviceAllocator allocator, OutputDeclaration output) {
		return allocator.allocateOutput(output.getName(), output.getCommentOr(output.getName())).getAddress();
	}

	/**
	 * Immediate steps triggered by the start input become outputs driven by the relay.
	 */
	static void addImmediateOutputs(TimingDescription timing, DeviceAllocator allocator, LadderBuilder builder,
									DeviceAddress relay) {
		String start = timing.getInputs().get(0).getName();
		for (SequenceStep step : timing.getSteps()) {
			if (step.isImmediate() && step.getTrigger().getDeviceName().equals(start)) {
				addOutput(timing, allocator, builder, relay, step.getAction().getDeviceName());
			}
		}
	}

	static int kValueOf(DeviceAllocation timer) {
		return timer.getTimerConfig()
				.orElseThrow(() -> new InternalCompilerError(timer.getLogicalName() + " is not a timer"))
				.getKValue();
	}

	static String formatSeconds(double seconds) {
		if (seconds == Math.rint(seconds)) {
			return Long.toString((long) seconds) + "s";
		}
		return seconds + "s";
	}
}

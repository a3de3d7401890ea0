package lgen.trans.patterns;

import lgen.model.device.DeviceAddress;
import lgen.model.ladder.builder.LadderBuilder;
import lgen.model.ladder.builder.RungBuilder;

/**
 * The astable idiom: two timers that restart each other, with the output on while the
 * first one has elapsed and the second one has not.
 *
 * <pre>
 *   enable AND NOT offTimer -> onTimer
 *   onTimer                 -> offTimer
 *   onTimer AND NOT offTimer -> output
 * </pre>
 */
final class FlickerCircuit {
	private FlickerCircuit() {}

	static void add(LadderBuilder builder, DeviceAddress enable, DeviceAddress onTimer, DeviceAddress offTimer,
					int kValue, DeviceAddress output, String outputName) {
		try (RungBuilder rung = builder.rung("flicker ON timer (" + outputName + ")")) {
			rung.noContact(enable).ncContact(offTimer).timer(onTimer, kValue);
		}
		try (RungBuilder rung = builder.rung("flicker OFF timer (" + outputName + ")")) {
			rung.noContact(onTimer).timer(offTimer, kValue);
		}
		builder.addStageGatedRung(onTimer, offTimer, output, outputName + " flicker output");
	}
}

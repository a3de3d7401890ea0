package lgen.trans.passes.analysis;

import lgen.model.timing.*;
import lgen.trans.patterns.FlickerPattern;
import lgen.trans.patterns.FullResetPattern;
import lgen.trans.patterns.SelfHoldPattern;
import lgen.trans.patterns.SequentialPattern;
import lgen.trans.patterns.TimerDelayPattern;

import java.util.*;

/**
 * Reports which idioms a timing description exhibits, without generating anything.
 */
public class TimingAnalysisPass {
	private TimingAnalysisPass() {}

	public static TimingAnalysis perform(TimingDescription timing) {
		List<DetectedPattern> detected = new ArrayList<>();
		List<String> warnings = new ArrayList<>();

		boolean hasStart = false;
		boolean hasStop = false;
		for (SequenceStep step : timing.getSteps()) {
			if (step.isImmediate() && step.getAction().isOn()) {
				hasStart = true;
			}
			if (step.getAction().isOff()) {
				hasStop = true;
			}
		}
		boolean selfHold = hasStart && hasStop && timing.getInputs().size() >= 2;
		if (selfHold) {
			Map<String, Object> details = new LinkedHashMap<>();
			details.put("start", timing.getInputs().get(0).getName());
			details.put("stop", timing.getInputs().get(timing.getInputs().size() - 1).getName());
			detected.add(new DetectedPattern(SelfHoldPattern.NAME, 0.9, details));
		}

		List<SequenceStep> delayed = timing.getDelayedSteps();
		if (!delayed.isEmpty()) {
			List<Double> delays = new ArrayList<>();
			for (SequenceStep step : delayed) {
				delays.add(step.getDelay().get());
			}
			Map<String, Object> details = new LinkedHashMap<>();
			details.put("count", delayed.size());
			details.put("delays", delays);
			detected.add(new DetectedPattern(TimerDelayPattern.NAME, 0.95, details));
		}

		if (FlickerPattern.matches(timing)) {
			detected.add(new DetectedPattern(FlickerPattern.NAME, 0.85));
		}
		if (FullResetPattern.matches(timing)) {
			detected.add(new DetectedPattern(FullResetPattern.NAME, 0.95));
		}
		if (selfHold && !delayed.isEmpty()) {
			detected.add(new DetectedPattern(SequentialPattern.NAME, 0.9));
		}

		if (timing.getInputs().isEmpty()) {
			warnings.add("no input devices declared");
		}
		if (timing.getOutputs().isEmpty()) {
			warnings.add("no output devices declared");
		}
		if (timing.getSteps().isEmpty()) {
			warnings.add("no sequence steps declared");
		}
		return new TimingAnalysis(timing, detected, warnings);
	}
}

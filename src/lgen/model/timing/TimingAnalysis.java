package lgen.model.timing;

import java.util.*;

/**
 * The idioms a {@link TimingDescription} exhibits, with warnings about what it lacks.
 */
public final class TimingAnalysis {
	private final TimingDescription timing;
	private final List<DetectedPattern> detectedPatterns;
	private final List<String> warnings;

	public TimingAnalysis(TimingDescription timing, List<DetectedPattern> detectedPatterns, List<String> warnings) {
		this.timing = Objects.requireNonNull(timing);
		this.detectedPatterns = Collections.unmodifiableList(new ArrayList<>(detectedPatterns));
		this.warnings = Collections.unmodifiableList(new ArrayList<>(warnings));
	}

	public TimingDescription getTiming() {
		return timing;
	}

	public List<DetectedPattern> getDetectedPatterns() {
		return detectedPatterns;
	}

	public List<String> getWarnings() {
		return warnings;
	}

	public Optional<DetectedPattern> getDetected(String type) {
		for (DetectedPattern pattern : detectedPatterns) {
			if (pattern.getType().equals(type)) {
				return Optional.of(pattern);
			}
		}
		return Optional.empty();
	}

	public boolean hasSelfHold() {
		return getDetected("self_hold").isPresent();
	}

	public boolean hasTimer() {
		return getDetected("timer_delay").isPresent();
	}

	public boolean hasFlicker() {
		return getDetected("flicker").isPresent();
	}

	public boolean hasFullReset() {
		return getDetected("full_reset").isPresent();
	}

	public boolean hasSequential() {
		return getDetected("sequential").isPresent();
	}
}

package lgen.model.timing;

import java.util.*;

public final class DetectedPattern {
	private final String type;
	private final double confidence;
	private final Map<String, Object> details;

	public DetectedPattern(String type, double confidence, Map<String, Object> details) {
		if (confidence < 0 || confidence > 1) {
			throw new IllegalArgumentException("confidence must be within [0, 1], got " + confidence);
		}
		this.type = Objects.requireNonNull(type);
		this.confidence = confidence;
		this.details = Collections.unmodifiableMap(new LinkedHashMap<>(details));
	}

	public DetectedPattern(String type, double confidence) {
		this(type, confidence, Collections.emptyMap());
	}

	public String getType() {
		return type;
	}

	public double getConfidence() {
		return confidence;
	}

	public Map<String, Object> getDetails() {
		return details;
	}

	@Override
	public boolean equals(Object o) {
		if (this == o) return true;
		if (o == null || getClass() != o.getClass()) return false;
		DetectedPattern that = (DetectedPattern) o;
		return Double.compare(that.confidence, confidence) == 0 && type.equals(that.type) && details.equals(that.details);
	}

	@Override
	public int hashCode() {
		return Objects.hash(type, confidence, details);
	}

	@Override
	public String toString() {
		return type + " (" + confidence + ")" + (details.isEmpty() ? "" : " " + details);
	}
}

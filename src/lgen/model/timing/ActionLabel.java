package lgen.model.timing;

import java.util.*;

/**
 * A tokenized trigger or action label such as "RL ON" or "ALL OFF". The first token names a
 * device, the remaining tokens are intent keywords, kept upper-cased.
 */
public final class ActionLabel {
	private static final Set<String> ALL_WORDS = new HashSet<>(Arrays.asList("ALL", "전체"));
	private static final Set<String> OFF_WORDS = new HashSet<>(Arrays.asList("OFF", "STOP", "정지"));
	private static final Set<String> FLICKER_WORDS = new HashSet<>(Arrays.asList("FLICKER", "점멸"));

	private final String deviceName;
	private final List<String> keywords;

	public ActionLabel(String deviceName, List<String> keywords) {
		this.deviceName = Objects.requireNonNull(deviceName);
		this.keywords = Collections.unmodifiableList(new ArrayList<>(keywords));
	}

	public static ActionLabel parse(String label) {
		String trimmed = label == null ? "" : label.trim();
		if (trimmed.isEmpty()) {
			return new ActionLabel("", Collections.emptyList());
		}
		String[] tokens = trimmed.split("\\s+");
		List<String> keywords = new ArrayList<>();
		for (int i = 1; i < tokens.length; i++) {
			keywords.add(tokens[i].toUpperCase(Locale.ROOT));
		}
		return new ActionLabel(tokens[0], keywords);
	}

	/**
	 * Label of a device switching on, in the form chained steps use as their trigger.
	 */
	public static ActionLabel on(String deviceName) {
		return new ActionLabel(deviceName, Collections.singletonList("ON"));
	}

	public String getDeviceName() {
		return deviceName;
	}

	public List<String> getKeywords() {
		return keywords;
	}

	/**
	 * @return the first intent keyword, ON when the label has none
	 */
	public String getIntent() {
		return keywords.isEmpty() ? "ON" : keywords.get(0);
	}

	public boolean isAll() {
		if (ALL_WORDS.contains(deviceName.toUpperCase(Locale.ROOT))) {
			return true;
		}
		for (String keyword : keywords) {
			if (ALL_WORDS.contains(keyword)) {
				return true;
			}
		}
		return false;
	}

	public boolean isOn() {
		return keywords.contains("ON") && !isAll();
	}

	public boolean isOff() {
		for (String keyword : keywords) {
			if (OFF_WORDS.contains(keyword)) {
				return true;
			}
		}
		return false;
	}

	public boolean isFlicker() {
		return FLICKER_WORDS.contains(getIntent());
	}

	/**
	 * @return the label normalized to single spaces with upper-cased keywords
	 */
	public String canonical() {
		if (keywords.isEmpty()) {
			return deviceName;
		}
		return deviceName + " " + String.join(" ", keywords);
	}

	@Override
	public boolean equals(Object o) {
		if (this == o) return true;
		if (o == null || getClass() != o.getClass()) return false;
		ActionLabel that = (ActionLabel) o;
		return deviceName.equals(that.deviceName) && keywords.equals(that.keywords);
	}

	@Override
	public int hashCode() {
		return Objects.hash(deviceName, keywords);
	}

	@Override
	public String toString() {
		return canonical();
	}
}

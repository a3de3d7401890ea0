package lgen.model.device;

import java.util.Objects;

/**
 * Timer preset. The K value counts 100 ms ticks.
 */
public final class TimerConfig {
	public static final int MAX_PRESET = 32767;

	private final int kValue;
	private final double seconds;
	private final String comment;

	public TimerConfig(int kValue, double seconds, String comment) {
		if (kValue <= 0) {
			throw new IllegalArgumentException("timer K value must be positive, got " + kValue);
		}
		if (!(seconds > 0)) {
			throw new IllegalArgumentException("timer duration must be positive, got " + seconds);
		}
		this.kValue = kValue;
		this.seconds = seconds;
		this.comment = comment == null ? "" : comment;
	}

	/**
	 * Sub-tick durations floor to a single tick rather than being rejected.
	 *
	 * @throws PresetRangeException if the duration needs more than {@link #MAX_PRESET} ticks
	 */
	public static TimerConfig fromSeconds(double seconds, String comment) {
		if (Double.isNaN(seconds) || Double.isInfinite(seconds)) {
			throw new IllegalArgumentException("timer duration must be finite, got " + seconds);
		}
		long ticks = Math.max(1L, Math.round(seconds * 10));
		if (ticks > MAX_PRESET) {
			throw new PresetRangeException("timer duration " + seconds + "s needs K" + ticks
					+ ", above the K" + MAX_PRESET + " limit");
		}
		return new TimerConfig((int) ticks, seconds, comment);
	}

	public int getKValue() {
		return kValue;
	}

	public double getSeconds() {
		return seconds;
	}

	public String getComment() {
		return comment;
	}

	@Override
	public boolean equals(Object o) {
		if (this == o) return true;
		if (o == null || getClass() != o.getClass()) return false;
		TimerConfig that = (TimerConfig) o;
		return kValue == that.kValue &&
				Double.compare(that.seconds, seconds) == 0 &&
				comment.equals(that.comment);
	}

	@Override
	public int hashCode() {
		return Objects.hash(kValue, seconds, comment);
	}

	@Override
	public String toString() {
		return "K" + kValue + " (" + seconds + "s)";
	}
}

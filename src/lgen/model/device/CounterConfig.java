package lgen.model.device;

import java.util.Objects;

public final class CounterConfig {
	private final int kValue;
	private final String comment;

	public CounterConfig(int kValue, String comment) {
		if (kValue <= 0) {
			throw new IllegalArgumentException("counter K value must be positive, got " + kValue);
		}
		if (kValue > TimerConfig.MAX_PRESET) {
			throw new PresetRangeException("counter preset K" + kValue + " is above the K" + TimerConfig.MAX_PRESET + " limit");
		}
		this.kValue = kValue;
		this.comment = comment == null ? "" : comment;
	}

	public int getKValue() {
		return kValue;
	}

	public String getComment() {
		return comment;
	}

	@Override
	public boolean equals(Object o) {
		if (this == o) return true;
		if (o == null || getClass() != o.getClass()) return false;
		CounterConfig that = (CounterConfig) o;
		return kValue == that.kValue && comment.equals(that.comment);
	}

	@Override
	public int hashCode() {
		return Objects.hash(kValue, comment);
	}
}

package lgen.model.ladder;

import lgen.model.device.DeviceAddress;

import java.util.Objects;

/**
 * Timer coil. The K value counts 100 ms ticks.
 */
public class LadderTimer extends LadderOutput {
	private final DeviceAddress device;
	private final int kValue;

	public LadderTimer(DeviceAddress device, int kValue) {
		if (kValue <= 0) {
			throw new IllegalArgumentException("timer K value must be positive, got " + kValue);
		}
		this.device = Objects.requireNonNull(device);
		this.kValue = kValue;
	}

	public DeviceAddress getDevice() {
		return device;
	}

	public int getKValue() {
		return kValue;
	}

	@Override
	public <T, E extends Throwable> T accept(LadderOutputVisitor<T, E> v) throws E {
		return v.visit(this);
	}

	@Override
	public boolean equals(Object o) {
		if (this == o) return true;
		if (o == null || getClass() != o.getClass()) return false;
		LadderTimer that = (LadderTimer) o;
		return kValue == that.kValue && device.equals(that.device);
	}

	@Override
	public int hashCode() {
		return Objects.hash(device, kValue);
	}
}

package lgen.model.ladder;

import lgen.model.device.DeviceAddress;

import java.util.Objects;

public class LadderCounter extends LadderOutput {
	private final DeviceAddress device;
	private final int kValue;

	public LadderCounter(DeviceAddress device, int kValue) {
		if (kValue <= 0) {
			throw new IllegalArgumentException("counter K value must be positive, got " + kValue);
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
		LadderCounter that = (LadderCounter) o;
		return kValue == that.kValue && device.equals(that.device);
	}

	@Override
	public int hashCode() {
		return Objects.hash(device, kValue);
	}
}

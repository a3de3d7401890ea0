package lgen.model.ladder;

import lgen.model.device.DeviceAddress;

import java.util.Objects;

public class LadderCoil extends LadderOutput {
	private final DeviceAddress device;

	public LadderCoil(DeviceAddress device) {
		this.device = Objects.requireNonNull(device);
	}

	public DeviceAddress getDevice() {
		return device;
	}

	@Override
	public <T, E extends Throwable> T accept(LadderOutputVisitor<T, E> v) throws E {
		return v.visit(this);
	}

	@Override
	public boolean equals(Object o) {
		if (this == o) return true;
		if (o == null || getClass() != o.getClass()) return false;
		return device.equals(((LadderCoil) o).device);
	}

	@Override
	public int hashCode() {
		return Objects.hash(device);
	}
}

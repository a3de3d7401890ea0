package lgen.model.ladder;

import lgen.model.device.DeviceAddress;

import java.util.Objects;

/**
 * Latching SET or unlatching RST of a device.
 */
public class LadderSetReset extends LadderOutput {

	public enum Operation {
		SET,
		RESET,
	}

	private final DeviceAddress device;
	private final Operation operation;

	public LadderSetReset(DeviceAddress device, Operation operation) {
		this.device = Objects.requireNonNull(device);
		this.operation = Objects.requireNonNull(operation);
	}

	public DeviceAddress getDevice() {
		return device;
	}

	public Operation getOperation() {
		return operation;
	}

	@Override
	public <T, E extends Throwable> T accept(LadderOutputVisitor<T, E> v) throws E {
		return v.visit(this);
	}

	@Override
	public boolean equals(Object o) {
		if (this == o) return true;
		if (o == null || getClass() != o.getClass()) return false;
		LadderSetReset that = (LadderSetReset) o;
		return device.equals(that.device) && operation == that.operation;
	}

	@Override
	public int hashCode() {
		return Objects.hash(device, operation);
	}
}

package lgen.model.ladder;

import lgen.model.device.DeviceAddress;

import java.util.Objects;

public class LadderContact extends LadderNode implements LadderSeriesMember {
	private final DeviceAddress device;
	private final ContactMode mode;

	public LadderContact(DeviceAddress device, ContactMode mode) {
		this.device = Objects.requireNonNull(device);
		this.mode = Objects.requireNonNull(mode);
	}

	public static LadderContact normallyOpen(DeviceAddress device) {
		return new LadderContact(device, ContactMode.NO);
	}

	public static LadderContact normallyClosed(DeviceAddress device) {
		return new LadderContact(device, ContactMode.NC);
	}

	public DeviceAddress getDevice() {
		return device;
	}

	public ContactMode getMode() {
		return mode;
	}

	@Override
	public <T, E extends Throwable> T accept(LadderSeriesMemberVisitor<T, E> v) throws E {
		return v.visit(this);
	}

	@Override
	public <T, E extends Throwable> T accept(LadderNodeVisitor<T, E> v) throws E {
		return v.visit(this);
	}

	@Override
	public boolean equals(Object o) {
		if (this == o) return true;
		if (o == null || getClass() != o.getClass()) return false;
		LadderContact that = (LadderContact) o;
		return device.equals(that.device) && mode == that.mode;
	}

	@Override
	public int hashCode() {
		return Objects.hash(device, mode);
	}
}

package lgen.model.device;

import java.util.Objects;

/**
 * A device address. The address is the internal sequential number; X/Y devices render it
 * in octal (internal 8 is "X10"), all others in decimal.
 */
public final class DeviceAddress {
	private final DeviceType type;
	private final int address;

	public DeviceAddress(DeviceType type, int address) {
		if (address < 0) {
			throw new IllegalArgumentException("device address must be non-negative, got " + address);
		}
		this.type = Objects.requireNonNull(type);
		this.address = address;
	}

	public DeviceType getType() {
		return type;
	}

	public int getAddress() {
		return address;
	}

	public String render() {
		return type.name() + Integer.toString(address, type.getRadix()).toUpperCase();
	}

	public static DeviceAddress parse(String s) {
		if (s == null || s.length() < 2) {
			throw new IllegalArgumentException("Invalid device string: " + s);
		}
		DeviceType type = DeviceType.fromLetter(s.charAt(0));
		String digits = s.substring(1);
		for (int i = 0; i < digits.length(); i++) {
			if (Character.digit(digits.charAt(i), type.getRadix()) < 0) {
				throw new IllegalArgumentException(
						"Invalid " + (type.isOctal() ? "octal" : "decimal") + " address in device string: " + s);
			}
		}
		try {
			return new DeviceAddress(type, Integer.parseInt(digits, type.getRadix()));
		} catch (NumberFormatException e) {
			throw new IllegalArgumentException("Invalid device string: " + s, e);
		}
	}

	@Override
	public boolean equals(Object o) {
		if (this == o) return true;
		if (o == null || getClass() != o.getClass()) return false;
		DeviceAddress that = (DeviceAddress) o;
		return address == that.address && type == that.type;
	}

	@Override
	public int hashCode() {
		return Objects.hash(type, address);
	}

	@Override
	public String toString() {
		return render();
	}
}

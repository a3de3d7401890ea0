package lgen.model.device;

/**
 * MELSEC-Q device classes. X and Y are addressed in octal on the wire; everything
 * else is decimal. The capacity bounds the internal (sequential) address space.
 */
public enum DeviceType {
	X(true, 32),   // input, X0-X37
	Y(true, 32),   // output, Y0-Y37
	M(false, 100), // internal relay
	T(false, 100), // timer
	C(false, 100), // counter
	D(false, 100); // data register

	private final boolean octal;
	private final int capacity;

	DeviceType(boolean octal, int capacity) {
		this.octal = octal;
		this.capacity = capacity;
	}

	public boolean isOctal() {
		return octal;
	}

	public int getRadix() {
		return octal ? 8 : 10;
	}

	public int getCapacity() {
		return capacity;
	}

	public static DeviceType fromLetter(char letter) {
		for (DeviceType type : values()) {
			if (type.name().charAt(0) == Character.toUpperCase(letter)) {
				return type;
			}
		}
		throw new IllegalArgumentException("Unknown device type: " + letter);
	}
}

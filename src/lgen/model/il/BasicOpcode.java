package lgen.model.il;

import java.util.Optional;

/**
 * The sequence instructions the compiler emits directly.
 */
public enum BasicOpcode {
	LD, LDI, AND, ANI, OR, ORI, OUT, SET, RST, ORB, ANB, MPS, MRD, MPP, END;

	/**
	 * @return true if the instruction reads a device as a contact
	 */
	public boolean isContact() {
		switch (this) {
			case LD:
			case LDI:
			case AND:
			case ANI:
			case OR:
			case ORI:
				return true;
			default:
				return false;
		}
	}

	/**
	 * @return true if the instruction drives a device
	 */
	public boolean isCoil() {
		return this == OUT || this == SET || this == RST;
	}

	/**
	 * @return true for block and branch-stack instructions, which never carry a device
	 */
	public boolean isDeviceless() {
		return !isContact() && !isCoil();
	}

	public static Optional<BasicOpcode> fromMnemonic(String mnemonic) {
		for (BasicOpcode op : values()) {
			if (op.name().equals(mnemonic)) {
				return Optional.of(op);
			}
		}
		return Optional.empty();
	}
}

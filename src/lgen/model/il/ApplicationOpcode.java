package lgen.model.il;

import java.util.Optional;

/**
 * Application instructions with a fixed operand count.
 */
public enum ApplicationOpcode {
	MOV("MOV", 2),
	DMOV("DMOV", 2),
	SMOV("$MOV", 2),
	BCD("BCD", 2),
	BIN("BIN", 2),
	ADD("+", 3),
	SUB("-", 3),
	MUL("*", 3),
	DIV("/", 3),
	CMP("CMP", 3),
	INC("INC", 1),
	DEC("DEC", 1);

	private final String mnemonic;
	private final int arity;

	ApplicationOpcode(String mnemonic, int arity) {
		this.mnemonic = mnemonic;
		this.arity = arity;
	}

	public String getMnemonic() {
		return mnemonic;
	}

	public int getArity() {
		return arity;
	}

	public static Optional<ApplicationOpcode> fromMnemonic(String mnemonic) {
		for (ApplicationOpcode op : values()) {
			if (op.mnemonic.equals(mnemonic)) {
				return Optional.of(op);
			}
		}
		return Optional.empty();
	}
}

package lgen.model.il;

import java.util.*;

/**
 * One line of an instruction list. Basic instructions carry an optional device and an
 * optional K constant; application instructions carry their operands verbatim.
 */
public final class Instruction {
	private final String mnemonic;
	private final String device;
	private final Integer kValue;
	private final List<String> operands;

	public Instruction(String mnemonic, String device, Integer kValue, List<String> operands) {
		this.mnemonic = Objects.requireNonNull(mnemonic);
		this.device = device;
		this.kValue = kValue;
		this.operands = Collections.unmodifiableList(new ArrayList<>(operands));
	}

	public static Instruction of(BasicOpcode opcode) {
		return new Instruction(opcode.name(), null, null, Collections.emptyList());
	}

	public static Instruction of(BasicOpcode opcode, String device) {
		return new Instruction(opcode.name(), device, null, Collections.emptyList());
	}

	public static Instruction of(BasicOpcode opcode, String device, int kValue) {
		return new Instruction(opcode.name(), device, kValue, Collections.emptyList());
	}

	public static Instruction application(String mnemonic, List<String> operands) {
		return new Instruction(mnemonic, null, null, operands);
	}

	public static Instruction application(String mnemonic, String... operands) {
		return application(mnemonic, Arrays.asList(operands));
	}

	public String getMnemonic() {
		return mnemonic;
	}

	public Optional<BasicOpcode> getBasicOpcode() {
		return BasicOpcode.fromMnemonic(mnemonic);
	}

	public boolean is(BasicOpcode opcode) {
		return mnemonic.equals(opcode.name());
	}

	public Optional<String> getDevice() {
		return Optional.ofNullable(device);
	}

	public Optional<Integer> getKValue() {
		return Optional.ofNullable(kValue);
	}

	public List<String> getOperands() {
		return operands;
	}

	@Override
	public boolean equals(Object o) {
		if (this == o) return true;
		if (o == null || getClass() != o.getClass()) return false;
		Instruction that = (Instruction) o;
		return mnemonic.equals(that.mnemonic) &&
				Objects.equals(device, that.device) &&
				Objects.equals(kValue, that.kValue) &&
				operands.equals(that.operands);
	}

	@Override
	public int hashCode() {
		return Objects.hash(mnemonic, device, kValue, operands);
	}

	@Override
	public String toString() {
		StringBuilder sb = new StringBuilder(mnemonic);
		if (device != null) {
			sb.append(' ').append(device);
		}
		if (kValue != null) {
			sb.append(" K").append(kValue);
		}
		for (String operand : operands) {
			sb.append(' ').append(operand);
		}
		return sb.toString();
	}
}

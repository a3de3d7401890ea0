package lgen.trans.passes.validation;

import lgen.errors.IssueContext;
import lgen.errors.TopLevelIssueContext;
import lgen.model.device.DeviceAddress;
import lgen.model.device.DeviceType;
import lgen.model.il.ApplicationOpcode;
import lgen.model.il.BasicOpcode;
import lgen.model.il.Instruction;
import lgen.model.il.InstructionSequence;

import java.util.*;

/**
 * Structural checks on an instruction list. Problems are reported as issues; nothing here
 * throws.
 *
 *   * the list is non-empty and ends with exactly one END
 *   * every MPP has a preceding MPS and no MPS is left open
 *   * device-bearing instructions carry a well-formed device of a class they may use,
 *     timer and counter coils carry a K constant, application instructions carry the
 *     expected number of operands, and block instructions carry no device
 */
public class InstructionValidationPass {
	private static final Set<DeviceType> CONTACT_DEVICES =
			EnumSet.of(DeviceType.X, DeviceType.Y, DeviceType.M, DeviceType.T, DeviceType.C);
	private static final Set<DeviceType> COIL_DEVICES =
			EnumSet.of(DeviceType.Y, DeviceType.M, DeviceType.T, DeviceType.C);

	private InstructionValidationPass() {}

	public static void perform(IssueContext ctx, InstructionSequence sequence) {
		if (!checkEnd(ctx, sequence)) {
			return;
		}
		checkStackBalance(ctx, sequence);
		checkOperands(ctx, sequence);
	}

	/**
	 * @return the rendered issues, empty if the sequence is well-formed
	 */
	public static List<String> validate(InstructionSequence sequence) {
		TopLevelIssueContext ctx = new TopLevelIssueContext();
		perform(ctx, sequence);
		return ctx.getMessages();
	}

	private static boolean checkEnd(IssueContext ctx, InstructionSequence sequence) {
		if (sequence.isEmpty()) {
			ctx.error(new EmptySequenceIssue());
			return false;
		}
		int last = sequence.size() - 1;
		if (!sequence.get(last).is(BasicOpcode.END)) {
			ctx.error(new MissingEndIssue());
		}
		for (int i = 0; i < last; i++) {
			if (sequence.get(i).is(BasicOpcode.END)) {
				ctx.error(new MisplacedEndIssue(i));
			}
		}
		return true;
	}

	private static void checkStackBalance(IssueContext ctx, InstructionSequence sequence) {
		int depth = 0;
		for (int i = 0; i < sequence.size(); i++) {
			Instruction instruction = sequence.get(i);
			if (instruction.is(BasicOpcode.MPS)) {
				depth++;
			} else if (instruction.is(BasicOpcode.MPP)) {
				depth--;
				if (depth < 0) {
					ctx.error(new UnmatchedStackPopIssue(i));
					depth = 0;
				}
			}
		}
		if (depth != 0) {
			ctx.error(new BranchStackImbalanceIssue(depth));
		}
	}

	private static void checkOperands(IssueContext ctx, InstructionSequence sequence) {
		for (int i = 0; i < sequence.size(); i++) {
			Instruction instruction = sequence.get(i);
			Optional<BasicOpcode> basic = instruction.getBasicOpcode();
			if (basic.isPresent()) {
				checkBasic(ctx, i, instruction, basic.get());
			} else {
				checkApplication(ctx, i, instruction);
			}
		}
	}

	private static void checkBasic(IssueContext ctx, int position, Instruction instruction, BasicOpcode opcode) {
		String mnemonic = instruction.getMnemonic();
		if (opcode.isDeviceless()) {
			if (instruction.getDevice().isPresent()) {
				ctx.error(new UnexpectedDeviceIssue(mnemonic, position));
			}
			return;
		}
		if (!instruction.getDevice().isPresent()) {
			ctx.error(new MissingDeviceIssue(mnemonic, position));
			return;
		}
		String device = instruction.getDevice().get();
		DeviceAddress address;
		try {
			address = DeviceAddress.parse(device);
		} catch (IllegalArgumentException e) {
			ctx.error(new InvalidDeviceIssue(position, device, e.getMessage()));
			return;
		}
		Set<DeviceType> allowed = opcode.isContact() ? CONTACT_DEVICES : COIL_DEVICES;
		if (!allowed.contains(address.getType())) {
			ctx.error(new DeviceClassIssue(mnemonic, position, device));
			return;
		}
		boolean counting = address.getType() == DeviceType.T || address.getType() == DeviceType.C;
		if (opcode == BasicOpcode.OUT && counting && !instruction.getKValue().isPresent()) {
			ctx.error(new MissingConstantIssue(mnemonic, device, position));
		}
	}

	private static void checkApplication(IssueContext ctx, int position, Instruction instruction) {
		String mnemonic = instruction.getMnemonic();
		int actual = instruction.getOperands().size();
		if (actual == 0) {
			ctx.error(new MissingOperandsIssue(mnemonic, position));
			return;
		}
		Optional<ApplicationOpcode> known = ApplicationOpcode.fromMnemonic(mnemonic);
		if (known.isPresent() && known.get().getArity() != actual) {
			ctx.error(new OperandCountMismatchIssue(mnemonic, position, known.get().getArity(), actual));
		}
	}
}

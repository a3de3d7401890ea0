package lgen.trans.passes.codegen;

import lgen.model.il.BasicOpcode;
import lgen.model.il.Instruction;
import lgen.model.ladder.*;

public class LadderOutputCompileVisitor extends LadderOutputVisitor<Instruction, RuntimeException> {

	@Override
	public Instruction visit(LadderCoil coil) {
		return Instruction.of(BasicOpcode.OUT, coil.getDevice().render());
	}

	@Override
	public Instruction visit(LadderTimer timer) {
		return Instruction.of(BasicOpcode.OUT, timer.getDevice().render(), timer.getKValue());
	}

	@Override
	public Instruction visit(LadderCounter counter) {
		return Instruction.of(BasicOpcode.OUT, counter.getDevice().render(), counter.getKValue());
	}

	@Override
	public Instruction visit(LadderSetReset setReset) {
		BasicOpcode opcode = setReset.getOperation() == LadderSetReset.Operation.SET ? BasicOpcode.SET : BasicOpcode.RST;
		return Instruction.of(opcode, setReset.getDevice().render());
	}

	@Override
	public Instruction visit(LadderApplication application) {
		return Instruction.application(application.getMnemonic(), application.getOperands());
	}
}

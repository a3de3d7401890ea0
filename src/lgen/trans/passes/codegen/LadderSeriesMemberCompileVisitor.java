package lgen.trans.passes.codegen;

import lgen.model.il.BasicOpcode;
import lgen.model.il.Instruction;
import lgen.model.ladder.*;

import java.util.List;

/**
 * Lowers one member of a series connection. The first member loads, later contacts AND
 * onto the accumulator, and later parallel branches are evaluated on their own and then
 * merged with ANB.
 */
public class LadderSeriesMemberCompileVisitor extends LadderSeriesMemberVisitor<Void, RuntimeException> {
	private final LadderRung rung;
	private final List<Instruction> out;
	private final boolean first;

	public LadderSeriesMemberCompileVisitor(LadderRung rung, List<Instruction> out, boolean first) {
		this.rung = rung;
		this.out = out;
		this.first = first;
	}

	@Override
	public Void visit(LadderContact contact) {
		BasicOpcode opcode;
		if (first) {
			opcode = contact.getMode() == ContactMode.NO ? BasicOpcode.LD : BasicOpcode.LDI;
		} else {
			opcode = contact.getMode() == ContactMode.NO ? BasicOpcode.AND : BasicOpcode.ANI;
		}
		out.add(Instruction.of(opcode, contact.getDevice().render()));
		return null;
	}

	@Override
	public Void visit(LadderParallelBranch parallel) {
		parallel.accept(new LadderInputSectionCompileVisitor(rung, out));
		if (!first) {
			out.add(Instruction.of(BasicOpcode.ANB));
		}
		return null;
	}
}

package lgen.trans.passes.codegen;

import lgen.model.il.BasicOpcode;
import lgen.model.il.Instruction;
import lgen.model.ladder.*;

import java.util.List;

public class LadderInputSectionCompileVisitor extends LadderInputSectionVisitor<Void, RuntimeException> {
	private final LadderRung rung;
	private final List<Instruction> out;

	public LadderInputSectionCompileVisitor(LadderRung rung, List<Instruction> out) {
		this.rung = rung;
		this.out = out;
	}

	@Override
	public Void visit(LadderSeriesConnection series) {
		List<LadderSeriesMember> members = series.getMembers();
		if (members.isEmpty()) {
			throw new LadderCompileException("rung " + rung.getIndex() + " has an empty series connection");
		}
		for (int i = 0; i < members.size(); i++) {
			members.get(i).accept(new LadderSeriesMemberCompileVisitor(rung, out, i == 0));
		}
		return null;
	}

	@Override
	public Void visit(LadderParallelBranch parallel) {
		List<LadderSeriesConnection> legs = parallel.getLegs();
		if (legs.isEmpty()) {
			throw new LadderCompileException("rung " + rung.getIndex() + " has a parallel branch without legs");
		}
		if (parallel.isContactsOnly()) {
			for (int i = 0; i < legs.size(); i++) {
				LadderContact contact = (LadderContact) legs.get(i).getMembers().get(0);
				BasicOpcode opcode;
				if (i == 0) {
					opcode = contact.getMode() == ContactMode.NO ? BasicOpcode.LD : BasicOpcode.LDI;
				} else {
					opcode = contact.getMode() == ContactMode.NO ? BasicOpcode.OR : BasicOpcode.ORI;
				}
				out.add(Instruction.of(opcode, contact.getDevice().render()));
			}
			return null;
		}
		for (int i = 0; i < legs.size(); i++) {
			// each leg starts a fresh block with its own load
			legs.get(i).accept(this);
			if (i != 0) {
				out.add(Instruction.of(BasicOpcode.ORB));
			}
		}
		return null;
	}
}

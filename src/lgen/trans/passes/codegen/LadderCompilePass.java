package lgen.trans.passes.codegen;

import lgen.model.il.BasicOpcode;
import lgen.model.il.Instruction;
import lgen.model.il.InstructionSequence;
import lgen.model.ladder.LadderOutput;
import lgen.model.ladder.LadderProgram;
import lgen.model.ladder.LadderRung;

import java.util.ArrayList;
import java.util.List;

/**
 * Lowers a ladder program to a MELSEC-Q instruction list.
 *
 * A rung's input network is evaluated first. A single output is then emitted directly;
 * several outputs share the evaluated condition through the branch stack:
 * MPS before the first, MRD before each interior one and MPP before the last.
 */
public class LadderCompilePass {
	private LadderCompilePass() {}

	public static InstructionSequence perform(LadderProgram program) {
		List<Instruction> out = new ArrayList<>();
		for (LadderRung rung : program.getRungs()) {
			compileRung(rung, out);
		}
		out.add(Instruction.of(BasicOpcode.END));
		return new InstructionSequence(out);
	}

	public static List<Instruction> compileRung(LadderRung rung) {
		List<Instruction> out = new ArrayList<>();
		compileRung(rung, out);
		return out;
	}

	private static void compileRung(LadderRung rung, List<Instruction> out) {
		List<LadderOutput> outputs = rung.getOutputs();
		if (outputs.isEmpty()) {
			throw new LadderCompileException("rung " + rung.getIndex() + " has no outputs");
		}
		rung.getInputSection().accept(new LadderInputSectionCompileVisitor(rung, out));
		LadderOutputCompileVisitor outputs2il = new LadderOutputCompileVisitor();
		if (outputs.size() == 1) {
			out.add(outputs.get(0).accept(outputs2il));
			return;
		}
		for (int i = 0; i < outputs.size(); i++) {
			if (i == 0) {
				out.add(Instruction.of(BasicOpcode.MPS));
			} else if (i == outputs.size() - 1) {
				out.add(Instruction.of(BasicOpcode.MPP));
			} else {
				out.add(Instruction.of(BasicOpcode.MRD));
			}
			out.add(outputs.get(i).accept(outputs2il));
		}
	}
}

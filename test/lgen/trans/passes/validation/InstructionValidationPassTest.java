package lgen.trans.passes.validation;

import lgen.errors.TopLevelIssueContext;
import lgen.model.il.BasicOpcode;
import lgen.model.il.Instruction;
import lgen.model.il.InstructionSequence;
import org.junit.Test;

import java.util.Arrays;
import java.util.Collections;
import java.util.List;

import static org.hamcrest.CoreMatchers.*;
import static org.junit.Assert.*;

public class InstructionValidationPassTest {

	private static Instruction ld(String device) {
		return Instruction.of(BasicOpcode.LD, device);
	}

	private static Instruction out(String device) {
		return Instruction.of(BasicOpcode.OUT, device);
	}

	private static Instruction end() {
		return Instruction.of(BasicOpcode.END);
	}

	@Test
	public void testWellFormed() {
		InstructionSequence sequence = new InstructionSequence(
				ld("X0"), Instruction.of(BasicOpcode.OR, "M0"), Instruction.of(BasicOpcode.ANI, "X1"), out("M0"),
				ld("M0"), Instruction.of(BasicOpcode.MPS), Instruction.of(BasicOpcode.OUT, "T0", 50),
				Instruction.of(BasicOpcode.MPP), Instruction.of(BasicOpcode.SET, "Y0"),
				ld("X2"), Instruction.application("MOV", "K1", "D0"),
				end());
		assertThat(InstructionValidationPass.validate(sequence), is(Collections.<String>emptyList()));
	}

	@Test
	public void testEmpty() {
		assertThat(InstructionValidationPass.validate(new InstructionSequence(Collections.emptyList())),
				is(Collections.singletonList("Empty instruction sequence")));
	}

	@Test
	public void testMissingEnd() {
		assertThat(InstructionValidationPass.validate(new InstructionSequence(ld("X0"), out("Y0"))),
				is(Collections.singletonList("Program must end with END instruction")));
	}

	@Test
	public void testMisplacedEnd() {
		assertThat(InstructionValidationPass.validate(new InstructionSequence(ld("X0"), end(), out("Y0"), end())),
				is(Collections.singletonList("END instruction found at position 1 (not at end)")));
	}

	@Test
	public void testUnmatchedMpp() {
		InstructionSequence sequence = new InstructionSequence(
				ld("X0"), Instruction.of(BasicOpcode.MPP), out("Y0"), end());
		assertThat(InstructionValidationPass.validate(sequence),
				is(Collections.singletonList("MPP at position 1 without matching MPS")));
	}

	@Test
	public void testOpenMps() {
		InstructionSequence sequence = new InstructionSequence(
				ld("X0"), Instruction.of(BasicOpcode.MPS), out("Y0"), Instruction.of(BasicOpcode.MPS), out("Y1"), end());
		assertThat(InstructionValidationPass.validate(sequence),
				is(Collections.singletonList("MPS/MPP stack imbalance: 2 unmatched MPS")));
	}

	@Test
	public void testDeviceProblems() {
		InstructionSequence sequence = new InstructionSequence(
				Instruction.of(BasicOpcode.LD),
				ld("Z5"),
				ld("X8"),
				ld("D0"),
				out("X3"),
				out("T0"),
				Instruction.of(BasicOpcode.OUT, "C1"),
				Instruction.of(BasicOpcode.ANB, "M0"),
				end());
		assertThat(InstructionValidationPass.validate(sequence), is(Arrays.asList(
				"LD at position 0 requires a device",
				"Invalid device at position 1: Unknown device type: Z",
				"Invalid device at position 2: Invalid octal address in device string: X8",
				"LD at position 3 cannot address D0",
				"OUT at position 4 cannot address X3",
				"OUT T0 at position 5 requires K value",
				"OUT C1 at position 6 requires K value",
				"ANB at position 7 should not have a device")));
	}

	@Test
	public void testApplicationOperands() {
		InstructionSequence sequence = new InstructionSequence(
				ld("X0"),
				Instruction.application("MOV"),
				Instruction.application("+", "D0", "D1"),
				Instruction.application("INC", "D0"),
				Instruction.application("ZRST", "M0", "M9"),
				end());
		assertThat(InstructionValidationPass.validate(sequence), is(Arrays.asList(
				"MOV at position 1 requires operands",
				"+ at position 2 requires 3 operands, got 2")));
	}

	@Test
	public void testStructuralAndOperandIssuesTogether() {
		TopLevelIssueContext ctx = new TopLevelIssueContext();
		InstructionSequence sequence = new InstructionSequence(
				ld("X0"), Instruction.of(BasicOpcode.MPS), out("T3"));
		InstructionValidationPass.perform(ctx, sequence);
		assertTrue(ctx.hasErrors());
		assertThat(ctx.getIssues().size(), is(3));
		assertThat(ctx.getIssues().get(0), instanceOf(MissingEndIssue.class));
		assertThat(ctx.getIssues().get(1), instanceOf(BranchStackImbalanceIssue.class));
		assertThat(ctx.getIssues().get(2), instanceOf(MissingConstantIssue.class));
		assertThat(ctx.format(), containsString("Detected 3 issues:"));
	}

	@Test
	public void testValidateLeavesSequenceUntouched() {
		List<Instruction> instructions = Arrays.asList(ld("X0"), out("Y0"), end());
		InstructionSequence sequence = new InstructionSequence(instructions);
		InstructionValidationPass.validate(sequence);
		assertThat(sequence.size(), is(3));
		assertFalse(sequence.isEmpty());
	}
}

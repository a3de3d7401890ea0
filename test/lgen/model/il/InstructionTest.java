package lgen.model.il;

import org.junit.Test;

import static org.hamcrest.CoreMatchers.is;
import static org.junit.Assert.assertThat;

public class InstructionTest {

	@Test
	public void testRendering() {
		assertThat(Instruction.of(BasicOpcode.LD, "X0").toString(), is("LD X0"));
		assertThat(Instruction.of(BasicOpcode.OUT, "T0", 50).toString(), is("OUT T0 K50"));
		assertThat(Instruction.of(BasicOpcode.MPS).toString(), is("MPS"));
		assertThat(Instruction.application("+", "D0", "K1", "D1").toString(), is("+ D0 K1 D1"));
	}

	@Test
	public void testOpcodeLookup() {
		assertThat(Instruction.of(BasicOpcode.ANI, "T1").getBasicOpcode().get(), is(BasicOpcode.ANI));
		assertThat(Instruction.application("MOV", "K1", "D0").getBasicOpcode().isPresent(), is(false));
		assertThat(ApplicationOpcode.fromMnemonic("$MOV").get(), is(ApplicationOpcode.SMOV));
		assertThat(ApplicationOpcode.fromMnemonic("CMP").get().getArity(), is(3));
		assertThat(ApplicationOpcode.fromMnemonic("ZRST").isPresent(), is(false));
	}

	@Test
	public void testSequenceLines() {
		InstructionSequence sequence = new InstructionSequence(
				Instruction.of(BasicOpcode.LD, "X0"),
				Instruction.of(BasicOpcode.OUT, "Y0"),
				Instruction.of(BasicOpcode.END));
		assertThat(sequence.toLines().toString(), is("[LD X0, OUT Y0, END]"));
		assertThat(sequence.size(), is(3));
	}
}

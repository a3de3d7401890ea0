package lgen.formatters;

import lgen.model.device.DeviceAddress;
import lgen.model.ladder.LadderProgram;
import lgen.model.ladder.LadderRung;
import lgen.model.ladder.builder.LadderBuilder;
import org.junit.Test;

import static org.hamcrest.CoreMatchers.is;
import static org.junit.Assert.assertThat;

public class LadderNodeFormattingVisitorTest {

	@Test
	public void testRung() {
		LadderRung rung = new LadderBuilder().rung("mixed")
				.noContact("X0").orContact("M0").ncContact("X1")
				.coil("Y0").timer("T0", 50).set("M1").application("MOV", "K1", "D0")
				.build();
		assertThat(rung.toString(), is("0: {-| |-X0 | -| |-M0} -|/|-X1 -- (Y0) (T0 K50) [SET M1] [MOV K1 D0]  ; mixed"));
	}

	@Test
	public void testProgram() {
		LadderBuilder builder = new LadderBuilder("LINE1");
		builder.addOutputRung(DeviceAddress.parse("X0"), DeviceAddress.parse("Y0"), "");
		builder.addPatternTag("self_hold");
		LadderProgram program = builder.build();
		assertThat(program.toString(), is("program LINE1 [self_hold]" + System.lineSeparator()
				+ "    0: -| |-X0 -- (Y0)  ; X0 -> Y0"));
	}
}

package lgen.trans.passes.analysis;

import lgen.model.timing.*;
import org.junit.Test;

import java.util.Arrays;
import java.util.Collections;

import static org.hamcrest.CoreMatchers.is;
import static org.junit.Assert.*;

public class TimingAnalysisPassTest {

	@Test
	public void testSequentialDescription() {
		TimingDescription timing = new TimingDescription("RL then GL",
				Arrays.asList(new InputDeclaration("PB1", ""), new InputDeclaration("PB2", "")),
				Arrays.asList(new OutputDeclaration("RL", ""), new OutputDeclaration("GL", "")),
				Arrays.asList(
						new SequenceStep("PB1", "RL ON"),
						new SequenceStep("RL ON", "GL ON", 5.0),
						new SequenceStep("PB2", "ALL OFF")));
		TimingAnalysis analysis = TimingAnalysisPass.perform(timing);
		assertTrue(analysis.hasSelfHold());
		assertTrue(analysis.hasTimer());
		assertTrue(analysis.hasFullReset());
		assertTrue(analysis.hasSequential());
		assertFalse(analysis.hasFlicker());
		assertTrue(analysis.getWarnings().isEmpty());

		DetectedPattern selfHold = analysis.getDetected("self_hold").get();
		assertThat(selfHold.getConfidence(), is(0.9));
		assertThat(selfHold.getDetails().get("start"), is((Object) "PB1"));
		assertThat(selfHold.getDetails().get("stop"), is((Object) "PB2"));

		DetectedPattern timer = analysis.getDetected("timer_delay").get();
		assertThat(timer.getDetails().get("count"), is((Object) 1));
		assertThat(timer.getDetails().get("delays"), is((Object) Collections.singletonList(5.0)));
	}

	@Test
	public void testFlickerOnly() {
		TimingDescription timing = new TimingDescription("BZ 점멸",
				Collections.singletonList(new InputDeclaration("SW", "")),
				Collections.singletonList(new OutputDeclaration("BZ", "")),
				Collections.singletonList(new SequenceStep("SW", "BZ ON")));
		TimingAnalysis analysis = TimingAnalysisPass.perform(timing);
		assertTrue(analysis.hasFlicker());
		assertFalse(analysis.hasSelfHold());
		assertFalse(analysis.hasTimer());
		assertThat(analysis.getDetectedPatterns().size(), is(1));
		assertThat(analysis.getDetected("flicker").get().getConfidence(), is(0.85));
	}

	@Test
	public void testEmptyDescriptionWarns() {
		TimingAnalysis analysis = TimingAnalysisPass.perform(new TimingDescription("",
				Collections.emptyList(), Collections.emptyList(), Collections.emptyList()));
		assertTrue(analysis.getDetectedPatterns().isEmpty());
		assertThat(analysis.getWarnings(), is(Arrays.asList(
				"no input devices declared", "no output devices declared", "no sequence steps declared")));
	}
}

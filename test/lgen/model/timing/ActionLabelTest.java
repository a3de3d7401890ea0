package lgen.model.timing;

import org.junit.Test;

import java.util.Arrays;
import java.util.Collections;

import static org.hamcrest.CoreMatchers.is;
import static org.junit.Assert.assertFalse;
import static org.junit.Assert.assertThat;
import static org.junit.Assert.assertTrue;

public class ActionLabelTest {

	@Test
	public void testTokenizing() {
		ActionLabel label = ActionLabel.parse("  RL   on ");
		assertThat(label.getDeviceName(), is("RL"));
		assertThat(label.getKeywords(), is(Collections.singletonList("ON")));
		assertThat(label.canonical(), is("RL ON"));
		assertTrue(label.isOn());
		assertFalse(label.isOff());
	}

	@Test
	public void testBareLabel() {
		ActionLabel label = ActionLabel.parse("PB1");
		assertThat(label.getIntent(), is("ON"));
		assertFalse(label.isOn());
		assertThat(label.canonical(), is("PB1"));
	}

	@Test
	public void testAllOff() {
		ActionLabel label = ActionLabel.parse("ALL OFF");
		assertTrue(label.isAll());
		assertTrue(label.isOff());
		assertFalse(label.isOn());
	}

	@Test
	public void testKoreanSynonyms() {
		ActionLabel stopAll = ActionLabel.parse("전체 정지");
		assertTrue(stopAll.isAll());
		assertTrue(stopAll.isOff());
		assertTrue(ActionLabel.parse("BZ 점멸").isFlicker());
	}

	@Test
	public void testFlicker() {
		ActionLabel label = ActionLabel.parse("BZ FLICKER");
		assertTrue(label.isFlicker());
		assertThat(label.getKeywords(), is(Arrays.asList("FLICKER")));
		assertThat(ActionLabel.on("BZ"), is(ActionLabel.parse("BZ ON")));
	}
}

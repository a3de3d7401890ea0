package lgen.model.ladder.builder;

import lgen.model.device.DeviceAddress;
import lgen.model.device.DeviceMap;
import lgen.model.ladder.*;

import java.util.*;

/**
 * Assembles a {@link LadderProgram}. The builder owns the rung counter: every rung gets
 * the next index, including rungs built by nested pattern generators.
 */
public class LadderBuilder {

	private final String name;
	private final List<LadderRung> rungs;
	private final Set<String> patternTags;
	private DeviceMap deviceMap;
	private int rungCounter;

	public LadderBuilder() {
		this("MAIN");
	}

	public LadderBuilder(String name) {
		this.name = name;
		this.rungs = new ArrayList<>();
		this.patternTags = new LinkedHashSet<>();
		this.deviceMap = new DeviceMap();
		this.rungCounter = 0;
	}

	public LadderBuilder setDeviceMap(DeviceMap deviceMap) {
		this.deviceMap = deviceMap;
		return this;
	}

	public LadderBuilder addPatternTag(String tag) {
		patternTags.add(tag);
		return this;
	}

	/**
	 * @return the index the next rung will receive
	 */
	public int getRungCounter() {
		return rungCounter;
	}

	public int nextRungIndex() {
		return rungCounter++;
	}

	public List<LadderRung> getRungs() {
		return Collections.unmodifiableList(rungs);
	}

	/**
	 * The index is only consumed when the rung is appended on close, so a dropped rung
	 * leaves no gap. Close one rung builder before opening the next.
	 */
	public RungBuilder rung(String comment) {
		return new RungBuilder(rungCounter, comment, this::addRung);
	}

	public LadderBuilder addRung(LadderRung rung) {
		rungs.add(rung);
		rungCounter = Math.max(rungCounter, rung.getIndex() + 1);
		return this;
	}

	private LadderBuilder addSingleOutputRung(String comment, LadderInputSection input, LadderOutput output) {
		return addRung(new LadderRung(nextRungIndex(), comment, input, Collections.singletonList(output)));
	}

	private static String orDefault(String comment, String fallback) {
		return comment == null || comment.isEmpty() ? fallback : comment;
	}

	/**
	 * (start OR relay) AND NOT stop -> relay
	 */
	public LadderBuilder addSelfHoldRung(DeviceAddress start, DeviceAddress stop, DeviceAddress relay, String comment) {
		LadderParallelBranch hold = LadderParallelBranch.of(
				LadderSeriesConnection.of(LadderContact.normallyOpen(start)),
				LadderSeriesConnection.of(LadderContact.normallyOpen(relay)));
		return addSingleOutputRung(
				orDefault(comment, "self-hold (" + relay.render() + ")"),
				LadderSeriesConnection.of(hold, LadderContact.normallyClosed(stop)),
				new LadderCoil(relay));
	}

	public LadderBuilder addOutputRung(DeviceAddress contact, DeviceAddress output, String comment) {
		return addSingleOutputRung(
				orDefault(comment, contact.render() + " -> " + output.render()),
				LadderSeriesConnection.of(LadderContact.normallyOpen(contact)),
				new LadderCoil(output));
	}

	public LadderBuilder addTimerRung(DeviceAddress contact, DeviceAddress timer, int kValue, String comment) {
		return addSingleOutputRung(
				orDefault(comment, "timer " + timer.render() + " (K" + kValue + ")"),
				LadderSeriesConnection.of(LadderContact.normallyOpen(contact)),
				new LadderTimer(timer, kValue));
	}

	/**
	 * enable AND NOT gate -> output
	 */
	public LadderBuilder addStageGatedRung(DeviceAddress enable, DeviceAddress gate, DeviceAddress output, String comment) {
		return addSingleOutputRung(
				orDefault(comment, enable.render() + " AND NOT " + gate.render() + " -> " + output.render()),
				LadderSeriesConnection.of(LadderContact.normallyOpen(enable), LadderContact.normallyClosed(gate)),
				new LadderCoil(output));
	}

	public LadderBuilder addCounterRung(DeviceAddress contact, DeviceAddress counter, int kValue, String comment) {
		return addSingleOutputRung(
				orDefault(comment, "counter " + counter.render() + " (K" + kValue + ")"),
				LadderSeriesConnection.of(LadderContact.normallyOpen(contact)),
				new LadderCounter(counter, kValue));
	}

	public LadderBuilder addCounterResetRung(DeviceAddress contact, DeviceAddress counter, String comment) {
		return addSingleOutputRung(
				orDefault(comment, "counter reset " + counter.render()),
				LadderSeriesConnection.of(LadderContact.normallyOpen(contact)),
				new LadderSetReset(counter, LadderSetReset.Operation.RESET));
	}

	public LadderBuilder addApplicationRung(DeviceAddress contact, String mnemonic, List<String> operands, String comment) {
		return addSingleOutputRung(
				orDefault(comment, mnemonic + " " + String.join(" ", operands)),
				LadderSeriesConnection.of(LadderContact.normallyOpen(contact)),
				new LadderApplication(mnemonic, operands));
	}

	public LadderProgram build() {
		return new LadderProgram(name, deviceMap, rungs, patternTags);
	}
}

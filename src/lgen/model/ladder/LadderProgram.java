package lgen.model.ladder;

import lgen.model.device.DeviceMap;

import java.util.*;

public class LadderProgram extends LadderNode {
	private final String name;
	private final DeviceMap deviceMap;
	private final List<LadderRung> rungs;
	private final Set<String> patternTags;

	public LadderProgram(String name, DeviceMap deviceMap, List<LadderRung> rungs, Collection<String> patternTags) {
		this.name = Objects.requireNonNull(name);
		this.deviceMap = Objects.requireNonNull(deviceMap);
		this.rungs = Collections.unmodifiableList(new ArrayList<>(rungs));
		this.patternTags = Collections.unmodifiableSet(new LinkedHashSet<>(patternTags));
	}

	public String getName() {
		return name;
	}

	public DeviceMap getDeviceMap() {
		return deviceMap;
	}

	public List<LadderRung> getRungs() {
		return rungs;
	}

	/**
	 * @return the tags of the idioms used to build this program, in the order they were recorded
	 */
	public Set<String> getPatternTags() {
		return patternTags;
	}

	@Override
	public <T, E extends Throwable> T accept(LadderNodeVisitor<T, E> v) throws E {
		return v.visit(this);
	}

	@Override
	public boolean equals(Object o) {
		if (this == o) return true;
		if (o == null || getClass() != o.getClass()) return false;
		LadderProgram that = (LadderProgram) o;
		return name.equals(that.name) &&
				deviceMap.equals(that.deviceMap) &&
				rungs.equals(that.rungs) &&
				patternTags.equals(that.patternTags);
	}

	@Override
	public int hashCode() {
		return Objects.hash(name, deviceMap, rungs, patternTags);
	}
}

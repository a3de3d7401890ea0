package lgen.model.ladder;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collections;
import java.util.List;
import java.util.Objects;

/**
 * OR of its legs. Each leg is a series connection of its own.
 */
public class LadderParallelBranch extends LadderNode implements LadderSeriesMember, LadderInputSection {
	private final List<LadderSeriesConnection> legs;

	public LadderParallelBranch(List<LadderSeriesConnection> legs) {
		this.legs = Collections.unmodifiableList(new ArrayList<>(legs));
	}

	public static LadderParallelBranch of(LadderSeriesConnection... legs) {
		return new LadderParallelBranch(Arrays.asList(legs));
	}

	public List<LadderSeriesConnection> getLegs() {
		return legs;
	}

	/**
	 * @return true if every leg is exactly one bare contact, so the branch lowers to OR/ORI
	 */
	public boolean isContactsOnly() {
		for (LadderSeriesConnection leg : legs) {
			if (leg.getMembers().size() != 1 || !(leg.getMembers().get(0) instanceof LadderContact)) {
				return false;
			}
		}
		return true;
	}

	@Override
	public <T, E extends Throwable> T accept(LadderSeriesMemberVisitor<T, E> v) throws E {
		return v.visit(this);
	}

	@Override
	public <T, E extends Throwable> T accept(LadderInputSectionVisitor<T, E> v) throws E {
		return v.visit(this);
	}

	@Override
	public <T, E extends Throwable> T accept(LadderNodeVisitor<T, E> v) throws E {
		return v.visit(this);
	}

	@Override
	public boolean equals(Object o) {
		if (this == o) return true;
		if (o == null || getClass() != o.getClass()) return false;
		return legs.equals(((LadderParallelBranch) o).legs);
	}

	@Override
	public int hashCode() {
		return Objects.hash(legs);
	}
}

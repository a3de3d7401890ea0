package lgen.model.ladder;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collections;
import java.util.List;
import java.util.Objects;

/**
 * AND of its members, evaluated left to right.
 */
public class LadderSeriesConnection extends LadderNode implements LadderInputSection {
	private final List<LadderSeriesMember> members;

	public LadderSeriesConnection(List<LadderSeriesMember> members) {
		this.members = Collections.unmodifiableList(new ArrayList<>(members));
	}

	public static LadderSeriesConnection of(LadderSeriesMember... members) {
		return new LadderSeriesConnection(Arrays.asList(members));
	}

	public List<LadderSeriesMember> getMembers() {
		return members;
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
		return members.equals(((LadderSeriesConnection) o).members);
	}

	@Override
	public int hashCode() {
		return Objects.hash(members);
	}
}

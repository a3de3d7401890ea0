package lgen.model.ladder;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Objects;

/**
 * One row of a ladder program: an input network driving one or more outputs.
 */
public class LadderRung extends LadderNode {
	private final int index;
	private final String comment;
	private final LadderInputSection inputSection;
	private final List<LadderOutput> outputs;

	public LadderRung(int index, String comment, LadderInputSection inputSection, List<LadderOutput> outputs) {
		if (index < 0) {
			throw new IllegalArgumentException("rung index must be non-negative, got " + index);
		}
		this.index = index;
		this.comment = comment == null ? "" : comment;
		this.inputSection = Objects.requireNonNull(inputSection);
		this.outputs = Collections.unmodifiableList(new ArrayList<>(outputs));
	}

	public int getIndex() {
		return index;
	}

	public String getComment() {
		return comment;
	}

	public LadderInputSection getInputSection() {
		return inputSection;
	}

	public List<LadderOutput> getOutputs() {
		return outputs;
	}

	@Override
	public <T, E extends Throwable> T accept(LadderNodeVisitor<T, E> v) throws E {
		return v.visit(this);
	}

	@Override
	public boolean equals(Object o) {
		if (this == o) return true;
		if (o == null || getClass() != o.getClass()) return false;
		LadderRung that = (LadderRung) o;
		return index == that.index &&
				comment.equals(that.comment) &&
				inputSection.equals(that.inputSection) &&
				outputs.equals(that.outputs);
	}

	@Override
	public int hashCode() {
		return Objects.hash(index, comment, inputSection, outputs);
	}
}

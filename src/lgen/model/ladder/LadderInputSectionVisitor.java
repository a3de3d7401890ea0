package lgen.model.ladder;

public abstract class LadderInputSectionVisitor<T, E extends Throwable> {

	public abstract T visit(LadderSeriesConnection series) throws E;
	public abstract T visit(LadderParallelBranch parallel) throws E;

}

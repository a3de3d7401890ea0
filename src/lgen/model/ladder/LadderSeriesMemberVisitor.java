package lgen.model.ladder;

public abstract class LadderSeriesMemberVisitor<T, E extends Throwable> {

	public abstract T visit(LadderContact contact) throws E;
	public abstract T visit(LadderParallelBranch parallel) throws E;

}

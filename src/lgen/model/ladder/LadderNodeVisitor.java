package lgen.model.ladder;

public abstract class LadderNodeVisitor<T, E extends Throwable> {

	public abstract T visit(LadderContact contact) throws E;
	public abstract T visit(LadderSeriesConnection series) throws E;
	public abstract T visit(LadderParallelBranch parallel) throws E;
	public abstract T visit(LadderOutput output) throws E;
	public abstract T visit(LadderRung rung) throws E;
	public abstract T visit(LadderProgram program) throws E;

}

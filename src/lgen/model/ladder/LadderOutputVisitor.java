package lgen.model.ladder;

public abstract class LadderOutputVisitor<T, E extends Throwable> {

	public abstract T visit(LadderCoil coil) throws E;
	public abstract T visit(LadderTimer timer) throws E;
	public abstract T visit(LadderCounter counter) throws E;
	public abstract T visit(LadderSetReset setReset) throws E;
	public abstract T visit(LadderApplication application) throws E;

}

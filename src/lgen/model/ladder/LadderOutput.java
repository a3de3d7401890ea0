package lgen.model.ladder;

/**
 * Something a rung drives once its input network is satisfied.
 */
public abstract class LadderOutput extends LadderNode {

	public abstract <T, E extends Throwable> T accept(LadderOutputVisitor<T, E> v) throws E;

	@Override
	public <T, E extends Throwable> T accept(LadderNodeVisitor<T, E> v) throws E {
		return v.visit(this);
	}

}

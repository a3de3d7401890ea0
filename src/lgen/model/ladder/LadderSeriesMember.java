package lgen.model.ladder;

/**
 * Something that can sit inside a series connection: a contact or a nested parallel branch.
 */
public interface LadderSeriesMember {

	<T, E extends Throwable> T accept(LadderSeriesMemberVisitor<T, E> v) throws E;

}

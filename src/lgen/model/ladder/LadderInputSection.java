package lgen.model.ladder;

/**
 * The root of a rung's input network.
 */
public interface LadderInputSection {

	<T, E extends Throwable> T accept(LadderInputSectionVisitor<T, E> v) throws E;

}

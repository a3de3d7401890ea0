package lgen.errors;

/**
 * Sink for the problems a pass finds. Passes report into a context and keep going; the
 * caller decides afterwards whether the run can continue.
 */
public interface IssueContext {

	void error(Issue issue);

	boolean hasErrors();
}

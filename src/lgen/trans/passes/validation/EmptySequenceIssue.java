package lgen.trans.passes.validation;

import lgen.errors.Issue;
import lgen.errors.IssueVisitor;

public class EmptySequenceIssue extends Issue {
	@Override
	public <T, E extends Throwable> T accept(IssueVisitor<T, E> v) throws E {
		return v.visit(this);
	}
}

package lgen.trans.passes.validation;

import lgen.errors.Issue;
import lgen.errors.IssueVisitor;

public class BranchStackImbalanceIssue extends Issue {
	private final int unmatched;

	public BranchStackImbalanceIssue(int unmatched) {
		this.unmatched = unmatched;
	}

	public int getUnmatched() {
		return unmatched;
	}

	@Override
	public <T, E extends Throwable> T accept(IssueVisitor<T, E> v) throws E {
		return v.visit(this);
	}
}

package lgen.trans.passes.validation;

import lgen.errors.Issue;
import lgen.errors.IssueVisitor;

public class MisplacedEndIssue extends Issue {
	private final int position;

	public MisplacedEndIssue(int position) {
		this.position = position;
	}

	public int getPosition() {
		return position;
	}

	@Override
	public <T, E extends Throwable> T accept(IssueVisitor<T, E> v) throws E {
		return v.visit(this);
	}
}

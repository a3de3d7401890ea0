package lgen.trans.passes.parse.option;

import lgen.errors.Issue;
import lgen.errors.IssueVisitor;

public class OptionParserIssue extends Issue {
	private final String detail;

	public OptionParserIssue(String detail) {
		this.detail = detail;
	}

	public String getDetail() {
		return detail;
	}

	@Override
	public <T, E extends Throwable> T accept(IssueVisitor<T, E> v) throws E {
		return v.visit(this);
	}
}

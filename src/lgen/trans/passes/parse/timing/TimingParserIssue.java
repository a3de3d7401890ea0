package lgen.trans.passes.parse.timing;

import lgen.errors.Issue;
import lgen.errors.IssueVisitor;

/**
 * A problem with a timing description document. The location is a JSON path such as
 * "inputs[1].type", empty for problems with the document as a whole.
 */
public class TimingParserIssue extends Issue {
	private final String location;
	private final String detail;

	public TimingParserIssue(String location, String detail) {
		this.location = location;
		this.detail = detail;
	}

	public String getLocation() {
		return location;
	}

	public String getDetail() {
		return detail;
	}

	@Override
	public <T, E extends Throwable> T accept(IssueVisitor<T, E> v) throws E {
		return v.visit(this);
	}
}

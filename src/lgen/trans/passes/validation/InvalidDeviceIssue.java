package lgen.trans.passes.validation;

import lgen.errors.Issue;
import lgen.errors.IssueVisitor;

public class InvalidDeviceIssue extends Issue {
	private final int position;
	private final String device;
	private final String reason;

	public InvalidDeviceIssue(int position, String device, String reason) {
		this.position = position;
		this.device = device;
		this.reason = reason;
	}

	public int getPosition() {
		return position;
	}

	public String getDevice() {
		return device;
	}

	public String getReason() {
		return reason;
	}

	@Override
	public <T, E extends Throwable> T accept(IssueVisitor<T, E> v) throws E {
		return v.visit(this);
	}
}

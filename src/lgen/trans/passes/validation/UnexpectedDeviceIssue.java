package lgen.trans.passes.validation;

import lgen.errors.Issue;
import lgen.errors.IssueVisitor;

public class UnexpectedDeviceIssue extends Issue {
	private final String mnemonic;
	private final int position;

	public UnexpectedDeviceIssue(String mnemonic, int position) {
		this.mnemonic = mnemonic;
		this.position = position;
	}

	public String getMnemonic() {
		return mnemonic;
	}

	public int getPosition() {
		return position;
	}

	@Override
	public <T, E extends Throwable> T accept(IssueVisitor<T, E> v) throws E {
		return v.visit(this);
	}
}

package lgen.trans.passes.validation;

import lgen.errors.Issue;
import lgen.errors.IssueVisitor;

public class MissingConstantIssue extends Issue {
	private final String mnemonic;
	private final String device;
	private final int position;

	public MissingConstantIssue(String mnemonic, String device, int position) {
		this.mnemonic = mnemonic;
		this.device = device;
		this.position = position;
	}

	public String getMnemonic() {
		return mnemonic;
	}

	public String getDevice() {
		return device;
	}

	public int getPosition() {
		return position;
	}

	@Override
	public <T, E extends Throwable> T accept(IssueVisitor<T, E> v) throws E {
		return v.visit(this);
	}
}

package lgen.trans.passes.validation;

import lgen.errors.Issue;
import lgen.errors.IssueVisitor;

public class DeviceClassIssue extends Issue {
	private final String mnemonic;
	private final int position;
	private final String device;

	public DeviceClassIssue(String mnemonic, int position, String device) {
		this.mnemonic = mnemonic;
		this.position = position;
		this.device = device;
	}

	public String getMnemonic() {
		return mnemonic;
	}

	public int getPosition() {
		return position;
	}

	public String getDevice() {
		return device;
	}

	@Override
	public <T, E extends Throwable> T accept(IssueVisitor<T, E> v) throws E {
		return v.visit(this);
	}
}

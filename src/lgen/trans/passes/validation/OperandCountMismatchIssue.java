package lgen.trans.passes.validation;

import lgen.errors.Issue;
import lgen.errors.IssueVisitor;

public class OperandCountMismatchIssue extends Issue {
	private final String mnemonic;
	private final int position;
	private final int expected;
	private final int actual;

	public OperandCountMismatchIssue(String mnemonic, int position, int expected, int actual) {
		this.mnemonic = mnemonic;
		this.position = position;
		this.expected = expected;
		this.actual = actual;
	}

	public String getMnemonic() {
		return mnemonic;
	}

	public int getPosition() {
		return position;
	}

	public int getExpected() {
		return expected;
	}

	public int getActual() {
		return actual;
	}

	@Override
	public <T, E extends Throwable> T accept(IssueVisitor<T, E> v) throws E {
		return v.visit(this);
	}
}

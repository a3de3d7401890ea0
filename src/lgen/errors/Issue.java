package lgen.errors;

import lgen.formatters.IssueFormattingVisitor;
import lgen.trans.LGenTransException;

/**
 * One problem found in a timing description, in the options or in a generated instruction
 * list. The message is produced by {@link IssueFormattingVisitor}, so every issue kind reads
 * the same whether it is thrown, logged or collected.
 */
public abstract class Issue extends LGenTransException {
	private static final long serialVersionUID = 5263097130925517419L;

	protected Issue() {
		super("");
	}

	@Override
	public String getMessage() {
		return IssueFormattingVisitor.render(this);
	}

	@Override
	public String toString() {
		return getClass().getSimpleName() + ": " + getMessage();
	}

	public abstract <T, E extends Throwable> T accept(IssueVisitor<T, E> v) throws E;
}

package lgen.trans;

import lgen.LGenException;
import lgen.errors.TopLevelIssueContext;

/**
 * Raised when a pass leaves issues behind and the pipeline cannot go on.
 */
public class LGenTransException extends LGenException {
	private static final long serialVersionUID = -3418825119346706913L;
	private static final String prefix = "Translation Error";

	private final int issueCount;

	public LGenTransException(String msg) {
		super(prefix, msg);
		this.issueCount = 0;
	}

	public LGenTransException(TopLevelIssueContext ctx) {
		super(prefix, ctx.format());
		this.issueCount = ctx.getIssues().size();
	}

	/**
	 * @return how many issues had been reported when the pipeline stopped
	 */
	public int getIssueCount() {
		return issueCount;
	}
}

package lgen;

/**
 * Root of the generator's failures. The prefix names the stage that failed ("Device Error",
 * "Compile Error", ...) and is printed ahead of the detail.
 */
public abstract class LGenException extends RuntimeException {
	private static final long serialVersionUID = 7300128471690318457L;

	private final String prefix;
	private final String detail;

	protected LGenException(String prefix, String detail) {
		super(prefix + ": " + detail);
		this.prefix = prefix;
		this.detail = detail;
	}

	public String getPrefix() {
		return prefix;
	}

	public String getDetail() {
		return detail;
	}
}

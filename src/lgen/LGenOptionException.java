package lgen;

public class LGenOptionException extends Exception {
	private static final long serialVersionUID = 4406735431271036592L;

	public LGenOptionException(String msg) {
		super(msg);
	}
}

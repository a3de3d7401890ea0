package lgen.trans.patterns;

import lgen.LGenException;

public class PatternNotFoundException extends LGenException {
	private static final long serialVersionUID = 4410836212250975524L;
	private static final String prefix = "Pattern Error";

	public PatternNotFoundException(String msg) {
		super(prefix, msg);
	}
}

package lgen.trans.passes.codegen;

import lgen.LGenException;

/**
 * A rung that cannot be lowered to an instruction list.
 */
public class LadderCompileException extends LGenException {
	private static final long serialVersionUID = -2279154612835570384L;
	private static final String prefix = "Compile Error";

	public LadderCompileException(String msg) {
		super(prefix, msg);
	}
}

package lgen;

/**
 * A broken invariant inside the generator itself, never a problem with the user's input.
 */
public class InternalCompilerError extends RuntimeException {
	private static final long serialVersionUID = 2812466218071338121L;

	public InternalCompilerError(String detail) {
		super("internal error: " + detail);
	}

	public InternalCompilerError(String detail, Throwable cause) {
		super("internal error: " + detail, cause);
	}
}

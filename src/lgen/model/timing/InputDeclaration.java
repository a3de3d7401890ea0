package lgen.model.timing;

import java.util.Objects;

public final class InputDeclaration {
	private final String name;
	private final InputKind kind;
	private final ActuationMode mode;
	private final String comment;

	public InputDeclaration(String name, InputKind kind, ActuationMode mode, String comment) {
		this.name = Objects.requireNonNull(name);
		this.kind = Objects.requireNonNull(kind);
		this.mode = Objects.requireNonNull(mode);
		this.comment = comment == null ? "" : comment;
	}

	public InputDeclaration(String name, String comment) {
		this(name, InputKind.PUSH_BUTTON, ActuationMode.MOMENTARY, comment);
	}

	public String getName() {
		return name;
	}

	public InputKind getKind() {
		return kind;
	}

	public ActuationMode getMode() {
		return mode;
	}

	public String getComment() {
		return comment;
	}

	/**
	 * @return the declared comment, or the given fallback when none was declared
	 */
	public String getCommentOr(String fallback) {
		return comment.isEmpty() ? fallback : comment;
	}

	@Override
	public boolean equals(Object o) {
		if (this == o) return true;
		if (o == null || getClass() != o.getClass()) return false;
		InputDeclaration that = (InputDeclaration) o;
		return name.equals(that.name) && kind == that.kind && mode == that.mode && comment.equals(that.comment);
	}

	@Override
	public int hashCode() {
		return Objects.hash(name, kind, mode, comment);
	}

	@Override
	public String toString() {
		return name + " (" + kind.getExternalName() + ", " + mode.getExternalName() + ")";
	}
}

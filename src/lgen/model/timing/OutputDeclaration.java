package lgen.model.timing;

import java.util.Objects;

public final class OutputDeclaration {
	private final String name;
	private final OutputKind kind;
	private final String comment;

	public OutputDeclaration(String name, OutputKind kind, String comment) {
		this.name = Objects.requireNonNull(name);
		this.kind = Objects.requireNonNull(kind);
		this.comment = comment == null ? "" : comment;
	}

	public OutputDeclaration(String name, String comment) {
		this(name, OutputKind.LAMP, comment);
	}

	public String getName() {
		return name;
	}

	public OutputKind getKind() {
		return kind;
	}

	public String getComment() {
		return comment;
	}

	public String getCommentOr(String fallback) {
		return comment.isEmpty() ? fallback : comment;
	}

	@Override
	public boolean equals(Object o) {
		if (this == o) return true;
		if (o == null || getClass() != o.getClass()) return false;
		OutputDeclaration that = (OutputDeclaration) o;
		return name.equals(that.name) && kind == that.kind && comment.equals(that.comment);
	}

	@Override
	public int hashCode() {
		return Objects.hash(name, kind, comment);
	}

	@Override
	public String toString() {
		return name + " (" + kind.getExternalName() + ")";
	}
}

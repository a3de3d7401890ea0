package lgen.model.ladder;

import lgen.formatters.IndentingWriter;
import lgen.formatters.LadderNodeFormattingVisitor;

import java.io.IOException;
import java.io.StringWriter;

/**
 * Base of the ladder intermediate representation. Nodes are values: they own their
 * children and are never shared between rungs.
 */
public abstract class LadderNode {

	public abstract <T, E extends Throwable> T accept(LadderNodeVisitor<T, E> v) throws E;

	@Override
	public abstract boolean equals(Object other);

	@Override
	public abstract int hashCode();

	@Override
	public String toString() {
		StringWriter w = new StringWriter();
		IndentingWriter out = new IndentingWriter(w);
		try {
			accept(new LadderNodeFormattingVisitor(out));
		} catch (IOException e) {
			throw new RuntimeException("StringWriter should not throw IOException", e);
		}
		return w.toString();
	}

}

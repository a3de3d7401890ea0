package lgen.formatters;

import java.io.IOException;
import java.io.Writer;

/**
 * A writer that prefixes every line after a {@link #newLine()} with the current
 * indentation. Indentation is scoped with try-with-resources via {@link Indent}.
 */
public class IndentingWriter extends Writer {

	private final Writer out;
	private final int defaultIndent;
	private int indent = 0;
	private boolean atLineStart = false;

	public static class Indent implements AutoCloseable {

		private final IndentingWriter writer;
		private final int spaces;

		Indent(IndentingWriter writer, int spaces) {
			this.writer = writer;
			this.spaces = spaces;
		}

		@Override
		public void close() {
			writer.unindent(spaces);
		}

	}

	public IndentingWriter(Writer out) {
		this(out, 4);
	}

	public IndentingWriter(Writer out, int defaultIndent) {
		this.out = out;
		this.defaultIndent = defaultIndent;
	}

	public Indent indent(int spaces) {
		indent += spaces;
		return new Indent(this, spaces);
	}

	public Indent indent() {
		return indent(defaultIndent);
	}

	private void unindent(int spaces) {
		if (spaces > indent) {
			throw new IllegalStateException("can't unindent below 0");
		}
		indent -= spaces;
	}

	public void newLine() throws IOException {
		out.write(System.lineSeparator());
		atLineStart = true;
	}

	@Override
	public void write(char[] chars, int offset, int len) throws IOException {
		if (len == 0) {
			return;
		}
		if (atLineStart) {
			for (int i = 0; i < indent; ++i) {
				out.write(' ');
			}
			atLineStart = false;
		}
		out.write(chars, offset, len);
	}

	@Override
	public void flush() throws IOException {
		out.flush();
	}

	@Override
	public void close() throws IOException {
		out.close();
	}

}

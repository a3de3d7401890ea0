package lgen.errors;

import lgen.formatters.IndentingWriter;
import lgen.formatters.IssueFormattingVisitor;

import java.io.IOException;
import java.io.StringWriter;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * Collects the issues of a whole run in the order they were reported.
 */
public class TopLevelIssueContext implements IssueContext {
	private final List<Issue> issues = new ArrayList<>();

	@Override
	public void error(Issue issue) {
		issues.add(issue);
	}

	@Override
	public boolean hasErrors() {
		return !issues.isEmpty();
	}

	public List<Issue> getIssues() {
		return Collections.unmodifiableList(issues);
	}

	/**
	 * @return the messages of all collected issues, one per issue
	 */
	public List<String> getMessages() {
		List<String> messages = new ArrayList<>(issues.size());
		for (Issue issue : issues) {
			messages.add(IssueFormattingVisitor.render(issue));
		}
		return messages;
	}

	/**
	 * Writes a summary line followed by every issue, indented one level.
	 */
	public void format(IndentingWriter out) throws IOException {
		out.write(issues.size() == 1 ? "Detected 1 issue:" : "Detected " + issues.size() + " issues:");
		try (IndentingWriter.Indent ignored = out.indent()) {
			for (Issue issue : issues) {
				out.newLine();
				issue.accept(new IssueFormattingVisitor(out));
			}
		}
	}

	public String format() {
		StringWriter w = new StringWriter();
		try {
			format(new IndentingWriter(w));
		} catch (IOException e) {
			throw new IllegalStateException("StringWriter threw an IOException", e);
		}
		return w.toString();
	}
}

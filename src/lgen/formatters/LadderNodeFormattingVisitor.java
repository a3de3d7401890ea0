package lgen.formatters;

import lgen.model.ladder.*;

import java.io.IOException;
import java.util.List;

/**
 * Renders ladder IR as text: "-| |-" for normally open contacts, "-|/|-" for normally
 * closed ones, parallel legs separated by " | " inside braces.
 */
public class LadderNodeFormattingVisitor extends LadderNodeVisitor<Void, IOException> {

	private IndentingWriter out;

	public LadderNodeFormattingVisitor(IndentingWriter out) {
		this.out = out;
	}

	@Override
	public Void visit(LadderContact contact) throws IOException {
		out.write(contact.getMode() == ContactMode.NO ? "-| |-" : "-|/|-");
		out.write(contact.getDevice().render());
		return null;
	}

	@Override
	public Void visit(LadderSeriesConnection series) throws IOException {
		List<LadderSeriesMember> members = series.getMembers();
		for (int i = 0; i < members.size(); i++) {
			if (i != 0) {
				out.write(" ");
			}
			members.get(i).accept(new LadderSeriesMemberVisitor<Void, IOException>() {
				@Override
				public Void visit(LadderContact contact) throws IOException {
					return contact.accept(LadderNodeFormattingVisitor.this);
				}

				@Override
				public Void visit(LadderParallelBranch parallel) throws IOException {
					return parallel.accept(LadderNodeFormattingVisitor.this);
				}
			});
		}
		return null;
	}

	@Override
	public Void visit(LadderParallelBranch parallel) throws IOException {
		out.write("{");
		List<LadderSeriesConnection> legs = parallel.getLegs();
		for (int i = 0; i < legs.size(); i++) {
			if (i != 0) {
				out.write(" | ");
			}
			legs.get(i).accept(this);
		}
		out.write("}");
		return null;
	}

	@Override
	public Void visit(LadderOutput output) throws IOException {
		return output.accept(new LadderOutputFormattingVisitor(out));
	}

	@Override
	public Void visit(LadderRung rung) throws IOException {
		out.write(Integer.toString(rung.getIndex()));
		out.write(": ");
		rung.getInputSection().accept(new LadderInputSectionVisitor<Void, IOException>() {
			@Override
			public Void visit(LadderSeriesConnection series) throws IOException {
				return series.accept(LadderNodeFormattingVisitor.this);
			}

			@Override
			public Void visit(LadderParallelBranch parallel) throws IOException {
				return parallel.accept(LadderNodeFormattingVisitor.this);
			}
		});
		out.write(" --");
		for (LadderOutput output : rung.getOutputs()) {
			out.write(" ");
			output.accept(this);
		}
		if (!rung.getComment().isEmpty()) {
			out.write("  ; ");
			out.write(rung.getComment());
		}
		return null;
	}

	@Override
	public Void visit(LadderProgram program) throws IOException {
		out.write("program ");
		out.write(program.getName());
		if (!program.getPatternTags().isEmpty()) {
			out.write(" [");
			out.write(String.join(", ", program.getPatternTags()));
			out.write("]");
		}
		try (IndentingWriter.Indent ignored = out.indent()) {
			for (LadderRung rung : program.getRungs()) {
				out.newLine();
				rung.accept(this);
			}
		}
		return null;
	}
}

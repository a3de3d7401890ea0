package lgen.formatters;

import lgen.model.ladder.*;

import java.io.IOException;

public class LadderOutputFormattingVisitor extends LadderOutputVisitor<Void, IOException> {

	private IndentingWriter out;

	public LadderOutputFormattingVisitor(IndentingWriter out) {
		this.out = out;
	}

	@Override
	public Void visit(LadderCoil coil) throws IOException {
		out.write("(");
		out.write(coil.getDevice().render());
		out.write(")");
		return null;
	}

	@Override
	public Void visit(LadderTimer timer) throws IOException {
		out.write("(");
		out.write(timer.getDevice().render());
		out.write(" K");
		out.write(Integer.toString(timer.getKValue()));
		out.write(")");
		return null;
	}

	@Override
	public Void visit(LadderCounter counter) throws IOException {
		out.write("(");
		out.write(counter.getDevice().render());
		out.write(" K");
		out.write(Integer.toString(counter.getKValue()));
		out.write(")");
		return null;
	}

	@Override
	public Void visit(LadderSetReset setReset) throws IOException {
		out.write("[");
		out.write(setReset.getOperation() == LadderSetReset.Operation.SET ? "SET " : "RST ");
		out.write(setReset.getDevice().render());
		out.write("]");
		return null;
	}

	@Override
	public Void visit(LadderApplication application) throws IOException {
		out.write("[");
		out.write(application.getMnemonic());
		for (String operand : application.getOperands()) {
			out.write(" ");
			out.write(operand);
		}
		out.write("]");
		return null;
	}
}

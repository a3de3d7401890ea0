package lgen.formatters;

import lgen.InternalCompilerError;
import lgen.errors.Issue;
import lgen.errors.IssueVisitor;
import lgen.trans.passes.parse.IOErrorIssue;
import lgen.trans.passes.parse.option.OptionParserIssue;
import lgen.trans.passes.parse.timing.TimingParserIssue;
import lgen.trans.passes.validation.*;

import java.io.IOException;
import java.io.StringWriter;

public class IssueFormattingVisitor extends IssueVisitor<Void, IOException> {
	private IndentingWriter out;

	public IssueFormattingVisitor(IndentingWriter out) {
		this.out = out;
	}

	/**
	 * @return the issue's message on a single line
	 */
	public static String render(Issue issue) {
		StringWriter w = new StringWriter();
		try {
			issue.accept(new IssueFormattingVisitor(new IndentingWriter(w)));
		} catch (IOException e) {
			throw new InternalCompilerError("writing to a string failed", e);
		}
		return w.toString();
	}

	private void atPosition(String mnemonic, int position) throws IOException {
		out.write(mnemonic);
		out.write(" at position ");
		out.write(Integer.toString(position));
	}

	@Override
	public Void visit(OptionParserIssue optionParserIssue) throws IOException {
		out.write("unable to parse options: ");
		out.write(optionParserIssue.getDetail());
		return null;
	}

	@Override
	public Void visit(IOErrorIssue ioErrorIssue) throws IOException {
		out.write("IO Error: cannot read ");
		out.write(ioErrorIssue.getPath().toString());
		out.write(": ");
		out.write(ioErrorIssue.getError().toString());
		return null;
	}

	@Override
	public Void visit(TimingParserIssue timingParserIssue) throws IOException {
		out.write("unable to parse timing description");
		if (!timingParserIssue.getLocation().isEmpty()) {
			out.write(" at ");
			out.write(timingParserIssue.getLocation());
		}
		out.write(": ");
		out.write(timingParserIssue.getDetail());
		return null;
	}

	@Override
	public Void visit(EmptySequenceIssue emptySequenceIssue) throws IOException {
		out.write("Empty instruction sequence");
		return null;
	}

	@Override
	public Void visit(MissingEndIssue missingEndIssue) throws IOException {
		out.write("Program must end with END instruction");
		return null;
	}

	@Override
	public Void visit(MisplacedEndIssue misplacedEndIssue) throws IOException {
		out.write("END instruction found at position ");
		out.write(Integer.toString(misplacedEndIssue.getPosition()));
		out.write(" (not at end)");
		return null;
	}

	@Override
	public Void visit(UnmatchedStackPopIssue unmatchedStackPopIssue) throws IOException {
		atPosition("MPP", unmatchedStackPopIssue.getPosition());
		out.write(" without matching MPS");
		return null;
	}

	@Override
	public Void visit(BranchStackImbalanceIssue branchStackImbalanceIssue) throws IOException {
		out.write("MPS/MPP stack imbalance: ");
		out.write(Integer.toString(branchStackImbalanceIssue.getUnmatched()));
		out.write(" unmatched MPS");
		return null;
	}

	@Override
	public Void visit(MissingDeviceIssue missingDeviceIssue) throws IOException {
		atPosition(missingDeviceIssue.getMnemonic(), missingDeviceIssue.getPosition());
		out.write(" requires a device");
		return null;
	}

	@Override
	public Void visit(InvalidDeviceIssue invalidDeviceIssue) throws IOException {
		out.write("Invalid device at position ");
		out.write(Integer.toString(invalidDeviceIssue.getPosition()));
		out.write(": ");
		out.write(invalidDeviceIssue.getReason());
		return null;
	}

	@Override
	public Void visit(DeviceClassIssue deviceClassIssue) throws IOException {
		atPosition(deviceClassIssue.getMnemonic(), deviceClassIssue.getPosition());
		out.write(" cannot address ");
		out.write(deviceClassIssue.getDevice());
		return null;
	}

	@Override
	public Void visit(MissingConstantIssue missingConstantIssue) throws IOException {
		atPosition(missingConstantIssue.getMnemonic() + " " + missingConstantIssue.getDevice(),
				missingConstantIssue.getPosition());
		out.write(" requires K value");
		return null;
	}

	@Override
	public Void visit(MissingOperandsIssue missingOperandsIssue) throws IOException {
		atPosition(missingOperandsIssue.getMnemonic(), missingOperandsIssue.getPosition());
		out.write(" requires operands");
		return null;
	}

	@Override
	public Void visit(OperandCountMismatchIssue operandCountMismatchIssue) throws IOException {
		atPosition(operandCountMismatchIssue.getMnemonic(), operandCountMismatchIssue.getPosition());
		out.write(" requires ");
		out.write(Integer.toString(operandCountMismatchIssue.getExpected()));
		out.write(" operands, got ");
		out.write(Integer.toString(operandCountMismatchIssue.getActual()));
		return null;
	}

	@Override
	public Void visit(UnexpectedDeviceIssue unexpectedDeviceIssue) throws IOException {
		atPosition(unexpectedDeviceIssue.getMnemonic(), unexpectedDeviceIssue.getPosition());
		out.write(" should not have a device");
		return null;
	}
}

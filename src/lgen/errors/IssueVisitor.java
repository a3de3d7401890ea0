package lgen.errors;

import lgen.trans.passes.parse.IOErrorIssue;
import lgen.trans.passes.parse.option.OptionParserIssue;
import lgen.trans.passes.parse.timing.TimingParserIssue;
import lgen.trans.passes.validation.*;

public abstract class IssueVisitor<T, E extends Throwable> {
	public abstract T visit(OptionParserIssue optionParserIssue) throws E;
	public abstract T visit(IOErrorIssue ioErrorIssue) throws E;
	public abstract T visit(TimingParserIssue timingParserIssue) throws E;
	public abstract T visit(EmptySequenceIssue emptySequenceIssue) throws E;
	public abstract T visit(MissingEndIssue missingEndIssue) throws E;
	public abstract T visit(MisplacedEndIssue misplacedEndIssue) throws E;
	public abstract T visit(UnmatchedStackPopIssue unmatchedStackPopIssue) throws E;
	public abstract T visit(BranchStackImbalanceIssue branchStackImbalanceIssue) throws E;
	public abstract T visit(MissingDeviceIssue missingDeviceIssue) throws E;
	public abstract T visit(InvalidDeviceIssue invalidDeviceIssue) throws E;
	public abstract T visit(DeviceClassIssue deviceClassIssue) throws E;
	public abstract T visit(MissingConstantIssue missingConstantIssue) throws E;
	public abstract T visit(MissingOperandsIssue missingOperandsIssue) throws E;
	public abstract T visit(OperandCountMismatchIssue operandCountMismatchIssue) throws E;
	public abstract T visit(UnexpectedDeviceIssue unexpectedDeviceIssue) throws E;
}

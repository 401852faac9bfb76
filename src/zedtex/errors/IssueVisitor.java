package zedtex.errors;

import zedtex.trans.passes.codegen.latex.LineTooLongIssue;
import zedtex.trans.passes.codegen.latex.UnknownProofLabelIssue;

public abstract class IssueVisitor<T, E extends Throwable> {
	public abstract T visit(LineTooLongIssue lineTooLongIssue) throws E;
	public abstract T visit(UnknownProofLabelIssue unknownProofLabelIssue) throws E;
}

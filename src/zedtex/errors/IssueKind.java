package zedtex.errors;

import zedtex.trans.passes.codegen.latex.LineTooLongIssue;
import zedtex.trans.passes.codegen.latex.UnknownProofLabelIssue;

class IssueKind extends IssueVisitor<IssueKind.Kind, RuntimeException> {

	enum Kind {
		LINE_TOO_LONG,
		UNKNOWN_PROOF_LABEL,
	}

	static final IssueKind INSTANCE = new IssueKind();

	private IssueKind() {}

	@Override
	public Kind visit(LineTooLongIssue lineTooLongIssue) {
		return Kind.LINE_TOO_LONG;
	}

	@Override
	public Kind visit(UnknownProofLabelIssue unknownProofLabelIssue) {
		return Kind.UNKNOWN_PROOF_LABEL;
	}
}

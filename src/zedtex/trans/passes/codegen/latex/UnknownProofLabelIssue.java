package zedtex.trans.passes.codegen.latex;

import zedtex.errors.Issue;
import zedtex.errors.IssueVisitor;
import zedtex.util.SourceLocation;

public class UnknownProofLabelIssue extends Issue {
	private final int label;
	private final SourceLocation location;

	public UnknownProofLabelIssue(int label, SourceLocation location) {
		this.label = label;
		this.location = location;
	}

	public int getLabel() {
		return label;
	}

	public SourceLocation getLocation() {
		return location;
	}

	@Override
	public <T, E extends Throwable> T accept(IssueVisitor<T, E> v) throws E {
		return v.visit(this);
	}
}

package zedtex.formatters;

import zedtex.errors.IssueVisitor;
import zedtex.trans.passes.codegen.latex.LineTooLongIssue;
import zedtex.trans.passes.codegen.latex.UnknownProofLabelIssue;

import java.io.IOException;

public class IssueFormattingVisitor extends IssueVisitor<Void, IOException> {
	private IndentingWriter out;

	public IssueFormattingVisitor(IndentingWriter out) {
		this.out = out;
	}

	@Override
	public Void visit(LineTooLongIssue lineTooLongIssue) throws IOException {
		out.write("line in ");
		out.write(lineTooLongIssue.getEnvironment());
		out.write(" exceeds ");
		out.write(Integer.toString(lineTooLongIssue.getLimit()));
		out.write(" characters (");
		out.write(Integer.toString(lineTooLongIssue.getLine().length()));
		out.write("):");
		try (IndentingWriter.Indent ignored = out.indent()) {
			out.newLine();
			out.write(lineTooLongIssue.getLine());
		}
		return null;
	}

	@Override
	public Void visit(UnknownProofLabelIssue unknownProofLabelIssue) throws IOException {
		out.write("proof step discharges assumption [");
		out.write(Integer.toString(unknownProofLabelIssue.getLabel()));
		out.write("] which the proof never introduces");
		if(!unknownProofLabelIssue.getLocation().isUnknown()) {
			out.write(" (line ");
			out.write(Integer.toString(unknownProofLabelIssue.getLocation().getStartLine()));
			out.write(")");
		}
		return null;
	}
}

package zedtex.trans.passes.codegen.latex;

import zedtex.Unreachable;
import zedtex.errors.IssueContext;
import zedtex.formatters.FormattingTools;
import zedtex.formatters.IndentingWriter;
import zedtex.model.z.*;

import java.io.IOException;
import java.io.StringWriter;
import java.util.ArrayList;
import java.util.List;

/**
 * Writes one document item as a LaTeX paragraph.
 */
public class LatexDocumentVisitor extends ZDocumentItemVisitor<Void, IOException> {

	private interface Content {
		void write(IndentingWriter out) throws IOException;
	}

	private final IndentingWriter out;
	private final DialectSymbols symbols;
	private final IssueContext ctx;
	private final int maxLineLength;
	private final JustificationFormatter justifications;

	public LatexDocumentVisitor(IndentingWriter out, DialectSymbols symbols, IssueContext ctx, int maxLineLength) {
		this.out = out;
		this.symbols = symbols;
		this.ctx = ctx;
		this.maxLineLength = maxLineLength;
		this.justifications = new JustificationFormatter(symbols);
	}

	private void expression(IndentingWriter w, ZExpression expression, boolean lineBreaks) throws IOException {
		expression.accept(new LatexExpressionVisitor(w, symbols, DialectSymbols.Context.PREDICATE, lineBreaks));
	}

	private String expression(ZExpression expression, DialectSymbols.Context context) {
		return LatexExpressionVisitor.render(expression, symbols, context);
	}

	/**
	 * Writes a boxed environment, reporting the lines of its body that are too long to fit the box.
	 */
	private void environment(String name, String header, Content body) throws IOException {
		StringWriter sw = new StringWriter();
		body.write(new IndentingWriter(sw));
		String text = sw.toString();
		for(String line : text.split("\n")) {
			if(line.length() > maxLineLength) {
				ctx.warn(new LineTooLongIssue(name, line, maxLineLength));
			}
		}
		out.write("\\begin{" + name + "}" + header);
		out.newLine();
		out.write(text);
		out.newLine();
		out.write("\\end{" + name + "}");
		out.newLine();
	}

	private void predicates(IndentingWriter w, List<ZExpression> predicates) throws IOException {
		FormattingTools.writeSeparated(w, " \\\\\n", predicates, p -> expression(w, p, true));
	}

	private String genericParameters(List<String> parameters) {
		if(parameters.isEmpty()) {
			return "";
		}
		List<String> names = new ArrayList<>();
		for(String parameter : parameters) {
			names.add(symbols.identifier(parameter));
		}
		return "[" + String.join(", ", names) + "]";
	}

	@Override
	public Void visit(ZSection zSection) throws IOException {
		out.write("\\section*{" + LatexText.escape(zSection.getTitle()) + "}");
		out.newLine();
		return null;
	}

	@Override
	public Void visit(ZSolution zSolution) throws IOException {
		out.write("\\subsection*{" + LatexText.escape(zSolution.getLabel()) + "}");
		out.newLine();
		return null;
	}

	@Override
	public Void visit(ZPart zPart) throws IOException {
		out.write("\\medskip\\noindent (" + LatexText.escape(zPart.getLabel()) + ")");
		out.newLine();
		return null;
	}

	@Override
	public Void visit(ZTruthTable zTruthTable) throws IOException {
		List<ZExpression> header = zTruthTable.getHeader();
		StringBuilder columns = new StringBuilder("|");
		for(int i = 0; i < header.size(); i++) {
			columns.append("c|");
		}
		out.write("\\begin{center}");
		out.newLine();
		out.write("\\begin{tabular}{" + columns + "}");
		out.newLine();
		out.write("\\hline");
		out.newLine();
		FormattingTools.writeSeparated(out, " & ", header, e -> {
			out.write("$");
			out.write(expression(e, DialectSymbols.Context.PREDICATE));
			out.write("$");
		});
		out.write(" \\\\");
		out.newLine();
		out.write("\\hline");
		out.newLine();
		for(List<String> row : zTruthTable.getRows()) {
			FormattingTools.writeSeparated(out, " & ", row, cell -> out.write(LatexText.escape(cell)));
			out.write(" \\\\");
			out.newLine();
		}
		out.write("\\hline");
		out.newLine();
		out.write("\\end{tabular}");
		out.newLine();
		out.write("\\end{center}");
		out.newLine();
		return null;
	}

	@Override
	public Void visit(ZEquivChain zEquivChain) throws IOException {
		out.write("\\begin{argue}");
		out.newLine();
		List<ZEquivStep> steps = zEquivChain.getSteps();
		for(int i = 0; i < steps.size(); i++) {
			ZEquivStep step = steps.get(i);
			if(step.getConnective() != null) {
				out.write(symbols.operator(step.getConnective(), DialectSymbols.Context.CHAIN));
				out.write(" ");
			}
			expression(out, step.getExpression(), true);
			if(step.getJustification() != null) {
				out.write(" & [");
				out.write(justifications.format(step.getJustification()));
				out.write("]");
			}
			if(i < steps.size() - 1) {
				out.write(" \\\\");
			}
			out.newLine();
		}
		out.write("\\end{argue}");
		out.newLine();
		return null;
	}

	@Override
	public Void visit(ZProofTree zProofTree) throws IOException {
		out.write("\\[");
		out.newLine();
		out.write(new ProofTreeRenderer(symbols, ctx).render(zProofTree.getRoot()));
		out.newLine();
		out.write("\\]");
		out.newLine();
		return null;
	}

	@Override
	public Void visit(ZGivenType zGivenType) throws IOException {
		return zed(zGivenType);
	}

	@Override
	public Void visit(ZFreeType zFreeType) throws IOException {
		return zed(zFreeType);
	}

	@Override
	public Void visit(ZAbbreviation zAbbreviation) throws IOException {
		return zed(zAbbreviation);
	}

	/**
	 * A one-line definition in a zed environment of its own.
	 */
	private Void zed(ZDocumentItem definition) throws IOException {
		out.write("\\begin{zed}");
		out.write(definition.accept(new ZedParagraphVisitor()));
		out.write("\\end{zed}");
		out.newLine();
		return null;
	}

	@Override
	public Void visit(ZBoxedBlock zBoxedBlock) throws IOException {
		String name;
		String header;
		switch(zBoxedBlock.getKind()) {
			case SCHEMA:
				name = "schema";
				header = "{" + symbols.identifier(zBoxedBlock.getName()) + "}";
				break;
			case GENDEF:
				name = "gendef";
				header = "";
				break;
			case AXDEF:
				name = "axdef";
				header = "";
				break;
			default:
				throw new Unreachable();
		}
		header += genericParameters(zBoxedBlock.getGenericParameters());
		environment(name, header, w -> {
			FormattingTools.writeSeparated(w, " \\\\\n", zBoxedBlock.getDeclarations(), d -> declaration(w, d));
			List<List<ZExpression>> groups = zBoxedBlock.getPredicateGroups();
			if(groups.isEmpty()) {
				return;
			}
			if(!zBoxedBlock.getDeclarations().isEmpty()) {
				w.newLine();
			}
			w.write("\\where");
			w.newLine();
			FormattingTools.writeSeparated(w, "\n\\also\n", groups, group -> predicates(w, group));
		});
		return null;
	}

	private void declaration(IndentingWriter w, ZDeclaration declaration) throws IOException {
		FormattingTools.writeCommaSeparated(w, declaration.getNames(),
				name -> w.write(symbols.identifier(name.getName())));
		if(declaration.getType() != null) {
			w.write(" " + symbols.bindingColon() + " ");
			expression(w, declaration.getType(), true);
		}
	}

	@Override
	public Void visit(ZZedBlock zZedBlock) throws IOException {
		environment("zed", "", w -> FormattingTools.writeSeparated(w, " \\\\\n", zZedBlock.getItems(),
				item -> w.write(item.accept(new ZedParagraphVisitor(true)))));
		return null;
	}

	@Override
	public Void visit(ZTextBlock zTextBlock) throws IOException {
		if(zTextBlock.getSegments().isEmpty()) {
			return null;
		}
		for(ZTextSegment segment : zTextBlock.getSegments()) {
			switch(segment.getKind()) {
				case PROSE:
					out.write(LatexText.escape(segment.getText()));
					break;
				case MATH:
					out.write("$");
					out.write(expression(segment.getMath(), DialectSymbols.Context.PREDICATE));
					out.write("$");
					break;
				case RAW_MATH:
					out.write("$");
					out.write(segment.getText());
					out.write("$");
					break;
				case CITATION:
					out.write("\\citep");
					if(segment.getLocator() != null) {
						out.write("[" + LatexText.escape(segment.getLocator()) + "]");
					}
					out.write("{" + segment.getText() + "}");
					break;
				default:
					throw new Unreachable();
			}
		}
		out.newLine();
		return null;
	}

	@Override
	public Void visit(ZPureText zPureText) throws IOException {
		out.write(LatexText.escape(zPureText.getText()));
		out.newLine();
		return null;
	}

	@Override
	public Void visit(ZLatexBlock zLatexBlock) throws IOException {
		out.write(zLatexBlock.getLatex());
		out.newLine();
		return null;
	}

	@Override
	public Void visit(ZPageBreak zPageBreak) throws IOException {
		out.write("\\newpage");
		out.newLine();
		return null;
	}

	@Override
	public Void visit(ZInferenceRule zInferenceRule) throws IOException {
		out.write("\\[");
		out.newLine();
		out.write("\\infer");
		if(zInferenceRule.getLabel() != null) {
			out.write("[" + justifications.format(zInferenceRule.getLabel()) + "]");
		}
		out.write("{" + expression(zInferenceRule.getConclusion(), DialectSymbols.Context.CHAIN) + "}{");
		FormattingTools.writeSeparated(out, " & ", zInferenceRule.getPremises(),
				p -> out.write(expression(p, DialectSymbols.Context.CHAIN)));
		out.write("}");
		out.newLine();
		out.write("\\]");
		out.newLine();
		return null;
	}

	@Override
	public Void visit(ZDisplayExpression zDisplayExpression) throws IOException {
		out.write("\\noindent");
		out.newLine();
		out.write("$");
		expression(out, zDisplayExpression.getExpression(), false);
		out.write("$");
		out.newLine();
		return null;
	}

	/**
	 * The text of a paragraph that can stand inside a zed environment. Anything else has no rendering there.
	 */
	private class ZedParagraphVisitor extends ZDocumentItemVisitor<String, RuntimeException> {
		private final boolean lineBreaks;

		ZedParagraphVisitor() {
			this(false);
		}

		ZedParagraphVisitor(boolean lineBreaks) {
			this.lineBreaks = lineBreaks;
		}

		private String unsupported(ZDocumentItem item) {
			throw new GenerationException("cannot appear in a zed paragraph", item);
		}

		private String math(ZExpression expression) {
			StringWriter sw = new StringWriter();
			try {
				expression(new IndentingWriter(sw), expression, lineBreaks);
			} catch (IOException e) {
				throw new Unreachable(e);
			}
			return sw.toString();
		}

		@Override
		public String visit(ZGivenType zGivenType) {
			return genericParameters(zGivenType.getNames());
		}

		@Override
		public String visit(ZFreeType zFreeType) {
			List<String> branches = new ArrayList<>();
			for(ZFreeTypeBranch branch : zFreeType.getBranches()) {
				String constructor = symbols.identifier(branch.getConstructor());
				if(branch.getParameter() != null) {
					constructor += " \\ldata " + math(branch.getParameter()) + " \\rdata";
				}
				branches.add(constructor);
			}
			return symbols.identifier(zFreeType.getName()) + " ::= " + String.join(" | ", branches);
		}

		@Override
		public String visit(ZAbbreviation zAbbreviation) {
			return symbols.identifier(zAbbreviation.getName()) + genericParameters(zAbbreviation.getGenericParameters())
					+ " == " + math(zAbbreviation.getBody());
		}

		@Override
		public String visit(ZDisplayExpression zDisplayExpression) {
			return math(zDisplayExpression.getExpression());
		}

		@Override
		public String visit(ZSection zSection) {
			return unsupported(zSection);
		}

		@Override
		public String visit(ZSolution zSolution) {
			return unsupported(zSolution);
		}

		@Override
		public String visit(ZPart zPart) {
			return unsupported(zPart);
		}

		@Override
		public String visit(ZTruthTable zTruthTable) {
			return unsupported(zTruthTable);
		}

		@Override
		public String visit(ZEquivChain zEquivChain) {
			return unsupported(zEquivChain);
		}

		@Override
		public String visit(ZProofTree zProofTree) {
			return unsupported(zProofTree);
		}

		@Override
		public String visit(ZBoxedBlock zBoxedBlock) {
			return unsupported(zBoxedBlock);
		}

		@Override
		public String visit(ZZedBlock zZedBlock) {
			return unsupported(zZedBlock);
		}

		@Override
		public String visit(ZTextBlock zTextBlock) {
			return unsupported(zTextBlock);
		}

		@Override
		public String visit(ZPureText zPureText) {
			return unsupported(zPureText);
		}

		@Override
		public String visit(ZLatexBlock zLatexBlock) {
			return unsupported(zLatexBlock);
		}

		@Override
		public String visit(ZPageBreak zPageBreak) {
			return unsupported(zPageBreak);
		}

		@Override
		public String visit(ZInferenceRule zInferenceRule) {
			return unsupported(zInferenceRule);
		}
	}
}

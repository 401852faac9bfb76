package zedtex.trans.passes.codegen.latex;

import zedtex.ZedTexOptions;
import zedtex.errors.IssueContext;
import zedtex.formatters.IndentingWriter;
import zedtex.model.z.ZDocument;
import zedtex.model.z.ZDocumentItem;
import zedtex.model.z.ZTextBlock;
import zedtex.model.z.ZTextSegment;

import java.io.IOException;
import java.io.StringWriter;
import java.util.List;

public class LatexCodeGenPass {
	private LatexCodeGenPass() {}

	/**
	 * Generates the markup of a whole document. Overlong lines and unknown proof labels are reported to ctx and
	 * never change the markup.
	 *
	 * @throws GenerationException when the document holds an item that has no rendering
	 */
	public static String perform(IssueContext ctx, ZDocument document, Dialect dialect, ZedTexOptions options) {
		DialectSymbols symbols = new DialectSymbols(dialect);
		StringWriter writer = new StringWriter();
		try (IndentingWriter out = new IndentingWriter(writer)) {
			if(options.preamble) {
				preamble(out, document, symbols);
			}
			LatexDocumentVisitor visitor = new LatexDocumentVisitor(out, symbols, ctx, options.maxLineLength);
			List<ZDocumentItem> items = document.getItems();
			for(int i = 0; i < items.size(); i++) {
				if(i > 0) {
					out.newLine();
				}
				items.get(i).accept(visitor);
			}
			if(options.preamble) {
				out.newLine();
				out.write("\\end{document}");
				out.newLine();
			}
		} catch (IOException e) {
			throw new GenerationException("could not write the generated markup: " + e.getMessage());
		}
		return writer.toString();
	}

	private static void preamble(IndentingWriter out, ZDocument document, DialectSymbols symbols)
			throws IOException {
		out.write("\\documentclass[a4paper,10pt,fleqn]{article}");
		out.newLine();
		for(String pkg : symbols.packages()) {
			out.write("\\usepackage{" + pkg + "}");
			out.newLine();
		}
		out.write("\\usepackage{amsmath}");
		out.newLine();
		out.write("\\usepackage{proof}");
		out.newLine();
		if(cites(document)) {
			out.write("\\usepackage{natbib}");
			out.newLine();
		}
		if(document.getTitle() != null) {
			out.write("\\title{" + LatexText.escape(document.getTitle()) + "}");
			out.newLine();
		}
		if(document.getAuthor() != null) {
			out.write("\\author{" + LatexText.escape(document.getAuthor()) + "}");
			out.newLine();
		}
		if(document.getDate() != null) {
			out.write("\\date{" + LatexText.escape(document.getDate()) + "}");
			out.newLine();
		}
		out.newLine();
		out.write("\\begin{document}");
		out.newLine();
		if(document.getTitle() != null) {
			out.write("\\maketitle");
			out.newLine();
		}
		out.newLine();
	}

	private static boolean cites(ZDocument document) {
		for(ZDocumentItem item : document.getItems()) {
			if(item instanceof ZTextBlock) {
				for(ZTextSegment segment : ((ZTextBlock) item).getSegments()) {
					if(segment.getKind() == ZTextSegment.Kind.CITATION) {
						return true;
					}
				}
			}
		}
		return false;
	}
}

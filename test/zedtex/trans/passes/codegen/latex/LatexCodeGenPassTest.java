package zedtex.trans.passes.codegen.latex;

import org.junit.Test;
import zedtex.ZedTexOptions;
import zedtex.errors.TopLevelIssueContext;
import zedtex.model.z.*;
import zedtex.util.SourceLocation;

import java.util.Arrays;
import java.util.Collections;

import static org.hamcrest.CoreMatchers.instanceOf;
import static org.hamcrest.CoreMatchers.is;
import static org.junit.Assert.assertThat;
import static zedtex.model.z.ZBuilder.*;

public class LatexCodeGenPassTest {

	private static final ZedTexOptions FRAGMENT = ZedTexOptions.fromJSON("{\"preamble\": false}");

	private static final ZBoxedBlock STATE = schema("State",
			decls(decl(id("N"), "count"), decl(unary(ZOperator.SEQ, id("ITEM")), "items")),
			groups(exprs(binop(ZOperator.EQUALS, id("count"), unary(ZOperator.CARD, id("items"))))));

	private static String generate(ZDocument document, Dialect dialect) {
		return LatexCodeGenPass.perform(new TopLevelIssueContext(), document, dialect, FRAGMENT);
	}

	@Test
	public void displayedPredicate() {
		ZDocument document = document(display(implies(and(id("p"), id("q")), id("r"))));
		assertThat(generate(document, Dialect.FUZZ), is("\\noindent\n$p \\land q \\implies r$\n"));
		assertThat(generate(document, Dialect.ZED_CM), is("\\noindent\n$p \\land q \\Rightarrow r$\n"));
	}

	@Test
	public void itemsAreSeparatedByBlankLines() {
		ZDocument document = document(new ZSection(SourceLocation.unknown(), "Sets & Logic"), display(id("p")));
		assertThat(generate(document, Dialect.FUZZ), is("\\section*{Sets \\& Logic}\n\n\\noindent\n$p$\n"));
	}

	@Test
	public void schemaInBothDialects() {
		assertThat(generate(document(STATE), Dialect.FUZZ), is("\\begin{schema}{State}\n" +
				"count : \\nat \\\\\n" +
				"items : \\seq ITEM\n" +
				"\\where\n" +
				"count = \\# items\n" +
				"\\end{schema}\n"));
		assertThat(generate(document(STATE), Dialect.ZED_CM), is("\\begin{schema}{State}\n" +
				"count \\colon \\mathbb{N} \\\\\n" +
				"items \\colon \\seq~ITEM\n" +
				"\\where\n" +
				"count = \\# items\n" +
				"\\end{schema}\n"));
	}

	@Test
	public void predicateGroupsAndLineBreaks() {
		ZBoxedBlock block = axdef(decls(decl(id("N"), "limit")),
				groups(exprs(binopBreak(ZOperator.AND, binop(ZOperator.GREATER, id("limit"), num(0)),
						binop(ZOperator.LESS, id("limit"), num(100)))),
						exprs(binop(ZOperator.NOT_EQUALS, id("limit"), num(50)))));
		assertThat(generate(document(block), Dialect.FUZZ), is("\\begin{axdef}\n" +
				"limit : \\nat\n" +
				"\\where\n" +
				"limit > 0 \\land \\\\\n" +
				"\\t1 limit < 100\n" +
				"\\also\n" +
				"limit \\neq 50\n" +
				"\\end{axdef}\n"));
	}

	@Test
	public void lineBreaksOnlyInsideBoxes() {
		ZDocument document = document(display(binopBreak(ZOperator.AND, id("p"), id("q"))));
		assertThat(generate(document, Dialect.ZED_CM), is("\\noindent\n$p \\land q$\n"));
	}

	@Test
	public void oneLineDefinitions() {
		ZDocument document = document(
				given("A", "B"),
				freeType("Tree", branch("leaf", null),
						branch("node", binop(ZOperator.CROSS, binop(ZOperator.CROSS, id("N"), id("Tree")), id("Tree")))),
				abbreviation("Pair", Collections.singletonList("X"), binop(ZOperator.CROSS, id("X"), id("X"))));
		assertThat(generate(document, Dialect.FUZZ), is(
				"\\begin{zed}[A, B]\\end{zed}\n" +
						"\n" +
						"\\begin{zed}Tree ::= leaf | node \\ldata \\nat \\cross Tree \\cross Tree \\rdata\\end{zed}\n" +
						"\n" +
						"\\begin{zed}Pair[X] == X \\cross X\\end{zed}\n"));
	}

	@Test
	public void zedBlockJoinsItsLines() {
		ZDocument document = document(new ZZedBlock(SourceLocation.unknown(), Arrays.asList(
				given("PERSON"),
				display(binop(ZOperator.EQUALS, id("x"), num(1))))));
		assertThat(generate(document, Dialect.FUZZ), is("\\begin{zed}\n[PERSON] \\\\\nx = 1\n\\end{zed}\n"));
	}

	@Test(expected = GenerationException.class)
	public void zedBlockRejectsStructure() {
		generate(document(new ZZedBlock(SourceLocation.unknown(), Collections.singletonList(
				new ZSection(SourceLocation.unknown(), "Sets")))), Dialect.FUZZ);
	}

	@Test
	public void equivalenceChain() {
		ZDocument document = document(new ZEquivChain(SourceLocation.unknown(), false, Arrays.asList(
				step(null, and(id("p"), id("q")), null),
				step(ZOperator.IFF, and(id("q"), id("p")), "commutativity"))));
		assertThat(generate(document, Dialect.FUZZ), is("\\begin{argue}\n" +
				"p \\land q \\\\\n" +
				"\\Leftrightarrow q \\land p & [\\mbox{commutativity}]\n" +
				"\\end{argue}\n"));
	}

	@Test
	public void truthTable() {
		ZDocument document = document(new ZTruthTable(SourceLocation.unknown(),
				exprs(id("p"), id("q"), and(id("p"), id("q"))),
				Arrays.asList(Arrays.asList("T", "T", "T"), Arrays.asList("T", "F", "F"))));
		assertThat(generate(document, Dialect.FUZZ), is("\\begin{center}\n" +
				"\\begin{tabular}{|c|c|c|}\n" +
				"\\hline\n" +
				"$p$ & $q$ & $p \\land q$ \\\\\n" +
				"\\hline\n" +
				"T & T & T \\\\\n" +
				"T & F & F \\\\\n" +
				"\\hline\n" +
				"\\end{tabular}\n" +
				"\\end{center}\n"));
	}

	@Test
	public void inferenceRule() {
		ZDocument document = document(new ZInferenceRule(SourceLocation.unknown(),
				exprs(id("p"), implies(id("p"), id("q"))), id("q"), "=> elim"));
		assertThat(generate(document, Dialect.FUZZ),
				is("\\[\n\\infer[\\mbox{$\\Rightarrow$ elim}]{q}{p & p \\Rightarrow q}\n\\]\n"));
	}

	@Test
	public void textWithFormula() {
		ZDocument document = document(new ZTextBlock(SourceLocation.unknown(), Arrays.asList(
				ZTextSegment.prose(SourceLocation.unknown(), "The formula "),
				ZTextSegment.math(SourceLocation.unknown(), "p => q", implies(id("p"), id("q"))),
				ZTextSegment.prose(SourceLocation.unknown(), " costs 5$"))));
		assertThat(generate(document, Dialect.FUZZ), is("The formula $p \\implies q$ costs 5\\$\n"));
	}

	@Test
	public void citations() {
		ZDocument document = document(new ZTextBlock(SourceLocation.unknown(), Arrays.asList(
				ZTextSegment.prose(SourceLocation.unknown(), "See "),
				ZTextSegment.citation(SourceLocation.unknown(), "simpson25a", null),
				ZTextSegment.prose(SourceLocation.unknown(), " and "),
				ZTextSegment.citation(SourceLocation.unknown(), "woodcock96", "pp. 10-15"),
				ZTextSegment.prose(SourceLocation.unknown(), "."))));
		assertThat(generate(document, Dialect.FUZZ),
				is("See \\citep{simpson25a} and \\citep[pp. 10-15]{woodcock96}.\n"));
	}

	@Test
	public void citationsLoadNatbib() {
		ZDocument document = document(new ZTextBlock(SourceLocation.unknown(), Collections.singletonList(
				ZTextSegment.citation(SourceLocation.unknown(), "spivey92", "p. 42"))));
		assertThat(LatexCodeGenPass.perform(new TopLevelIssueContext(), document, Dialect.FUZZ,
				ZedTexOptions.defaults()), is("\\documentclass[a4paper,10pt,fleqn]{article}\n" +
				"\\usepackage{fuzz}\n" +
				"\\usepackage{amsmath}\n" +
				"\\usepackage{proof}\n" +
				"\\usepackage{natbib}\n" +
				"\n" +
				"\\begin{document}\n" +
				"\n" +
				"\\citep[p. 42]{spivey92}\n" +
				"\n" +
				"\\end{document}\n"));
	}

	@Test
	public void latexAndPageBreakArePassedThrough() {
		ZDocument document = document(new ZLatexBlock(SourceLocation.unknown(), "\\vspace{1em}"),
				new ZPageBreak(SourceLocation.unknown()));
		assertThat(generate(document, Dialect.FUZZ), is("\\vspace{1em}\n\n\\newpage\n"));
	}

	@Test
	public void longLinesAreReportedWithoutChangingTheOutput() {
		ZDocument document = document(axdef(
				decls(decl(binop(ZOperator.FUN, id("N"), binop(ZOperator.FUN, id("N"), id("N"))), "f")),
				Collections.emptyList()));
		TopLevelIssueContext ctx = new TopLevelIssueContext();
		String narrow = LatexCodeGenPass.perform(ctx, document, Dialect.FUZZ,
				ZedTexOptions.fromJSON("{\"preamble\": false, \"maxLineLength\": 20}"));
		assertThat(narrow, is("\\begin{axdef}\nf : \\nat \\fun \\nat \\fun \\nat\n\\end{axdef}\n"));
		assertThat(narrow, is(generate(document, Dialect.FUZZ)));
		assertThat(ctx.getIssues().size(), is(1));
		assertThat(ctx.getIssues().get(0), instanceOf(LineTooLongIssue.class));
		LineTooLongIssue issue = (LineTooLongIssue) ctx.getIssues().get(0);
		assertThat(issue.getEnvironment(), is("axdef"));
		assertThat(issue.getLimit(), is(20));
	}

	@Test
	public void preamble() {
		ZDocument document = new ZDocument(SourceLocation.unknown(), Collections.singletonList(display(id("p"))),
				"Exercises", null, null);
		String output = LatexCodeGenPass.perform(new TopLevelIssueContext(), document, Dialect.ZED_CM,
				ZedTexOptions.defaults());
		assertThat(output, is("\\documentclass[a4paper,10pt,fleqn]{article}\n" +
				"\\usepackage{zed-cm}\n" +
				"\\usepackage{zed-maths}\n" +
				"\\usepackage{amsmath}\n" +
				"\\usepackage{proof}\n" +
				"\\title{Exercises}\n" +
				"\n" +
				"\\begin{document}\n" +
				"\\maketitle\n" +
				"\n" +
				"\\noindent\n" +
				"$p$\n" +
				"\n" +
				"\\end{document}\n"));
	}
}

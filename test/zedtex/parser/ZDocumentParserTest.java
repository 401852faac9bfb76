package zedtex.parser;

import org.junit.Test;
import zedtex.lexer.ZLexer;
import zedtex.model.z.*;
import zedtex.util.SourceLocation;

import java.util.Arrays;
import java.util.Collections;
import java.util.List;

import static org.hamcrest.CoreMatchers.instanceOf;
import static org.hamcrest.CoreMatchers.is;
import static org.hamcrest.CoreMatchers.nullValue;
import static org.junit.Assert.assertThat;
import static zedtex.model.z.ZBuilder.*;

public class ZDocumentParserTest {

	private static List<ZDocumentItem> items(String source) {
		return ZDocumentParser.parse(new ZLexer(source).tokenize()).getItems();
	}

	private static ZDocumentItem single(String source) {
		List<ZDocumentItem> items = items(source);
		assertThat(items.size(), is(1));
		return items.get(0);
	}

	@Test
	public void displayedPredicate() {
		assertThat(single("p and q => r"), is(display(implies(and(id("p"), id("q")), id("r")))));
	}

	@Test
	public void freeTypeWithRecursiveConstructor() {
		assertThat(single("Tree ::= leaf | node<N x Tree x Tree>"), is(freeType("Tree",
				branch("leaf", null),
				branch("node", binop(ZOperator.CROSS, binop(ZOperator.CROSS, id("N"), id("Tree")), id("Tree"))))));
	}

	@Test
	public void givenTypes() {
		assertThat(single("given A, B"), is(given("A", "B")));
		assertThat(single("[PERSON, ROOM]"), is(given("PERSON", "ROOM")));
	}

	@Test
	public void abbreviations() {
		assertThat(single("Pairs == N x N"),
				is(abbreviation("Pairs", Collections.emptyList(), binop(ZOperator.CROSS, id("N"), id("N")))));
		assertThat(single("[X] Pair == X x X"),
				is(abbreviation("Pair", Collections.singletonList("X"), binop(ZOperator.CROSS, id("X"), id("X")))));
	}

	@Test
	public void schemaWithDeclarationsAndPredicates() {
		String source = "schema State\n" +
				"  count : N\n" +
				"  items : seq ITEM\n" +
				"where\n" +
				"  count = #items\n" +
				"end";
		assertThat(single(source), is(schema("State",
				decls(decl(id("N"), "count"), decl(unary(ZOperator.SEQ, id("ITEM")), "items")),
				groups(exprs(binop(ZOperator.EQUALS, id("count"), unary(ZOperator.CARD, id("items"))))))));
	}

	@Test
	public void axiomaticDefinitionWithPredicateGroups() {
		String source = "axdef\n" +
				"  limit : N\n" +
				"  f : N x N -> N\n" +
				"where\n" +
				"  limit > 0\n" +
				"\n" +
				"  limit < 100\n" +
				"end";
		assertThat(single(source), is(axdef(
				decls(decl(id("N"), "limit"),
						decl(binop(ZOperator.FUN, binop(ZOperator.CROSS, id("N"), id("N")), id("N")), "f")),
				groups(exprs(binop(ZOperator.GREATER, id("limit"), num(0))),
						exprs(binop(ZOperator.LESS, id("limit"), num(100)))))));
	}

	@Test
	public void axiomaticDefinitionWithoutPredicates() {
		ZBoxedBlock block = (ZBoxedBlock) single("axdef\n  x, y : N\nend");
		assertThat(block.getDeclarations(), is(decls(decl(id("N"), "x", "y"))));
		assertThat(block.getPredicateGroups().isEmpty(), is(true));
	}

	@Test
	public void proofTreeFromIndentation() {
		String source = "PROOF:\n" +
				"p => q and r [=> intro from 1]\n" +
				"  [1] p [assumption]\n" +
				"    :: q [rule1]\n" +
				"    :: r [rule2]\n" +
				"    q and r [and intro]";
		ZExpression qAndR = and(id("q"), id("r"));
		assertThat(single(source), is(proof(proofNode(implies(id("p"), qAndR), "=> intro from 1",
				assumption(1, id("p"), "assumption",
						proofNode(qAndR, "and intro", sibling(id("q"), "rule1"), sibling(id("r"), "rule2")))))));
	}

	@Test
	public void equivalenceChain() {
		String source = "EQUIV:\n" +
				"p and q\n" +
				"<=> q and p [commutativity]";
		assertThat(single(source), is(new ZEquivChain(SourceLocation.unknown(), false, Arrays.asList(
				step(null, and(id("p"), id("q")), null),
				step(ZOperator.IFF, and(id("q"), id("p")), "commutativity")))));
	}

	@Test
	public void truthTable() {
		String source = "TRUTH TABLE:\n" +
				"p | q | p and q\n" +
				"T | T | T\n" +
				"T | F | F";
		ZTruthTable table = (ZTruthTable) single(source);
		assertThat(table.getHeader(), is(exprs(id("p"), id("q"), and(id("p"), id("q")))));
		assertThat(table.getRows(), is(Arrays.asList(
				Arrays.asList("T", "T", "T"),
				Arrays.asList("T", "F", "F"))));
	}

	@Test
	public void inferenceRule() {
		String source = "INFRULE: [and intro]\n" +
				"p, q\n" +
				"---\n" +
				"p and q";
		assertThat(single(source), is(new ZInferenceRule(SourceLocation.unknown(),
				exprs(id("p"), id("q")), and(id("p"), id("q")), "and intro")));
	}

	@Test
	public void zedBlock() {
		String source = "zed\n" +
				"  [PERSON]\n" +
				"  Count == N\n" +
				"end";
		assertThat(single(source), is(new ZZedBlock(SourceLocation.unknown(), Arrays.asList(
				given("PERSON"),
				abbreviation("Count", Collections.emptyList(), id("N"))))));
	}

	@Test
	public void structureAndMetadata() {
		String source = "TITLE: Exercises\n" +
				"=== Logic ===\n" +
				"** Solution 1 **\n" +
				"(a) p or not p\n" +
				"PAGEBREAK";
		ZDocument document = ZDocumentParser.parse(new ZLexer(source).tokenize());
		assertThat(document.getTitle(), is("Exercises"));
		assertThat(document.getAuthor(), nullValue());
		assertThat(document.getItems(), is(Arrays.asList(
				new ZSection(SourceLocation.unknown(), "Logic"),
				new ZSolution(SourceLocation.unknown(), "Solution 1"),
				new ZPart(SourceLocation.unknown(), "a"),
				display(or(id("p"), not(id("p")))),
				new ZPageBreak(SourceLocation.unknown()))));
	}

	@Test
	public void textWithInlineFormula() {
		ZTextBlock block = (ZTextBlock) single("TEXT: The formula p => q is simple");
		assertThat(block.getSegments(), is(Arrays.asList(
				ZTextSegment.prose(SourceLocation.unknown(), "The formula "),
				ZTextSegment.math(SourceLocation.unknown(), "p => q", implies(id("p"), id("q"))),
				ZTextSegment.prose(SourceLocation.unknown(), " is simple"))));
	}

	@Test
	public void textWithDollarMath() {
		ZTextBlock block = (ZTextBlock) single("TEXT: take $\\alpha$ here");
		assertThat(block.getSegments(), is(Arrays.asList(
				ZTextSegment.prose(SourceLocation.unknown(), "take "),
				ZTextSegment.rawMath(SourceLocation.unknown(), "\\alpha"),
				ZTextSegment.prose(SourceLocation.unknown(), " here"))));
	}

	@Test
	public void textWithCitations() {
		ZTextBlock block = (ZTextBlock) single("TEXT: See [cite simpson25a] and [cite spivey92 p. 42].");
		assertThat(block.getSegments(), is(Arrays.asList(
				ZTextSegment.prose(SourceLocation.unknown(), "See "),
				ZTextSegment.citation(SourceLocation.unknown(), "simpson25a", null),
				ZTextSegment.prose(SourceLocation.unknown(), " and "),
				ZTextSegment.citation(SourceLocation.unknown(), "spivey92", "p. 42"),
				ZTextSegment.prose(SourceLocation.unknown(), "."))));
	}

	@Test
	public void pureTextKeepsCitationsLiteral() {
		assertThat(single("PURETEXT: [cite simpson25a] stays"),
				is(new ZPureText(SourceLocation.unknown(), "[cite simpson25a] stays")));
	}

	@Test
	public void detectedProseIsText() {
		ZDocumentItem item = single("The value is 5.");
		assertThat(item, instanceOf(ZTextBlock.class));
		assertThat(((ZTextBlock) item).getSegments(), is(Collections.singletonList(
				ZTextSegment.prose(SourceLocation.unknown(), "The value is 5."))));
	}
}

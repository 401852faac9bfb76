package zedtex.trans.passes.codegen.latex;

import org.junit.Test;
import org.junit.runner.RunWith;
import org.junit.runners.Parameterized;
import zedtex.lexer.ProseDetector;
import zedtex.lexer.ZLexer;
import zedtex.model.z.ZExpression;
import zedtex.parser.TokenCursor;
import zedtex.parser.ZExpressionParser;

import java.util.Arrays;
import java.util.List;

import static org.hamcrest.CoreMatchers.is;
import static org.junit.Assert.assertThat;

@RunWith(Parameterized.class)
public class LatexExpressionVisitorTest {

	@Parameterized.Parameters(name = "{0}")
	public static List<Object[]> data() {
		return Arrays.asList(new Object[][]{
				{"p and q => r", "p \\land q \\implies r", "p \\land q \\Rightarrow r"},
				{"p or q and r", "p \\lor q \\land r", "p \\lor q \\land r"},
				{"(p or q) and r", "(p \\lor q) \\land r", "(p \\lor q) \\land r"},
				{"not (p and q)", "\\lnot (p \\land q)", "\\lnot (p \\land q)"},
				{"p <=> q", "p \\iff q", "p \\Leftrightarrow q"},
				{"forall x : N | x > 0", "\\forall x : \\nat @ x > 0", "\\forall x \\colon \\mathbb{N} \\bullet x > 0"},
				{"p and forall x : N | x > 0",
						"p \\land (\\forall x : \\nat @ x > 0)",
						"p \\land \\forall x \\colon \\mathbb{N} \\bullet x > 0"},
				{"lambda x : N . x + 1", "\\lambda x : \\nat @ x + 1", "\\lambda x \\colon \\mathbb{N} \\bullet x + 1"},
				{"{x : N | x > 0 . x * x}",
						"\\{ x : \\nat | x > 0 @ x * x \\}",
						"\\{ x \\colon \\mathbb{N} \\mid x > 0 \\bullet x * x \\}"},
				{"if x > 0 then x else 0 - x",
						"\\IF x > 0 \\THEN x \\ELSE 0 - x",
						"\\mathbf{if} x > 0 \\mathbf{then} x \\mathbf{else} 0 - x"},
				{"a <= b < c", "a \\leq b < c", "a \\leq b < c"},
				{"x' = x + 1", "x' = x + 1", "x' = x + 1"},
				{"#s(i)", "\\# (s(i))", "\\# s(i)"},
				{"dom R", "\\dom R", "\\dom~R"},
				{"seq N", "\\seq \\nat", "\\seq~\\mathbb{N}"},
				{"P Z", "\\power \\num", "\\power \\mathbb{Z}"},
				{"x^2", "x^{2}", "x^{2}"},
				{"s ^ t", "s \\cat t", "s \\cat t"},
				{"<a, b>", "\\langle a, b \\rangle", "\\langle a, b \\rangle"},
				{"{}", "\\{\\}", "\\{\\}"},
				{"R(|{1}|)", "R \\limg \\{ 1 \\} \\rimg", "R \\limg \\{ 1 \\} \\rimg"},
				{"1 .. n", "1 \\upto n", "1 \\upto n"},
				{"N -> P N", "\\nat \\fun \\power \\nat", "\\mathbb{N} \\fun \\power \\mathbb{N}"},
		});
	}

	private final String source;
	private final String fuzz;
	private final String zedCm;

	public LatexExpressionVisitorTest(String source, String fuzz, String zedCm) {
		this.source = source;
		this.fuzz = fuzz;
		this.zedCm = zedCm;
	}

	static ZExpression parse(String source) {
		TokenCursor cursor = new TokenCursor(new ZLexer(source, new ProseDetector(), false).tokenize());
		ZExpression expression = new ZExpressionParser(cursor).parseExpression();
		cursor.skipNewLines();
		assertThat("trailing input after " + source, cursor.atEnd(), is(true));
		return expression;
	}

	private static String render(ZExpression expression, Dialect dialect) {
		return LatexExpressionVisitor.render(expression, new DialectSymbols(dialect),
				DialectSymbols.Context.PREDICATE);
	}

	@Test
	public void fuzz() {
		assertThat(render(parse(source), Dialect.FUZZ), is(fuzz));
	}

	@Test
	public void zedCm() {
		assertThat(render(parse(source), Dialect.ZED_CM), is(zedCm));
	}
}

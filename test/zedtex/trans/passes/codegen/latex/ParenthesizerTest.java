package zedtex.trans.passes.codegen.latex;

import org.junit.Test;
import zedtex.model.z.ZExpression;
import zedtex.model.z.ZOperator;

import static org.hamcrest.CoreMatchers.is;
import static org.junit.Assert.assertThat;
import static zedtex.model.z.ZBuilder.*;

public class ParenthesizerTest {

	private static final ZExpression FORALL = forall(bindings(bind(id("N"), "x")),
			binop(ZOperator.GREATER, id("x"), num(0)));

	private static String fuzz(ZExpression expression) {
		return LatexExpressionVisitor.render(expression, new DialectSymbols(Dialect.FUZZ),
				DialectSymbols.Context.PREDICATE);
	}

	private static String zedCm(ZExpression expression) {
		return LatexExpressionVisitor.render(expression, new DialectSymbols(Dialect.ZED_CM),
				DialectSymbols.Context.PREDICATE);
	}

	@Test
	public void looserOperandIsEnclosed() {
		assertThat(fuzz(and(or(id("p"), id("q")), id("r"))), is("(p \\lor q) \\land r"));
		assertThat(fuzz(or(id("p"), and(id("q"), id("r")))), is("p \\lor q \\land r"));
		assertThat(fuzz(binop(ZOperator.TIMES, binop(ZOperator.PLUS, id("a"), id("b")), id("c"))),
				is("(a + b) * c"));
	}

	@Test
	public void associativitySide() {
		assertThat(fuzz(binop(ZOperator.MINUS, binop(ZOperator.MINUS, id("a"), id("b")), id("c"))),
				is("a - b - c"));
		assertThat(fuzz(binop(ZOperator.MINUS, id("a"), binop(ZOperator.MINUS, id("b"), id("c")))),
				is("a - (b - c)"));
		assertThat(fuzz(implies(id("p"), implies(id("q"), id("r")))), is("p \\implies q \\implies r"));
		assertThat(fuzz(implies(implies(id("p"), id("q")), id("r"))), is("(p \\implies q) \\implies r"));
	}

	@Test
	public void comparisonsDoNotAssociate() {
		assertThat(fuzz(binop(ZOperator.EQUALS, binop(ZOperator.EQUALS, id("a"), id("b")), id("c"))),
				is("(a = b) = c"));
	}

	@Test
	public void nestedBinderInFuzz() {
		assertThat(fuzz(FORALL), is("\\forall x : \\nat @ x > 0"));
		assertThat(fuzz(and(id("p"), FORALL)), is("p \\land (\\forall x : \\nat @ x > 0)"));
		assertThat(fuzz(and(FORALL, id("p"))), is("(\\forall x : \\nat @ x > 0) \\land p"));
	}

	@Test
	public void binderInZedCmOnlyWhenFollowed() {
		assertThat(zedCm(and(id("p"), FORALL)), is("p \\land \\forall x \\colon \\mathbb{N} \\bullet x > 0"));
		assertThat(zedCm(and(FORALL, id("p"))), is("(\\forall x \\colon \\mathbb{N} \\bullet x > 0) \\land p"));
		assertThat(zedCm(or(and(id("p"), FORALL), id("q"))),
				is("p \\land (\\forall x \\colon \\mathbb{N} \\bullet x > 0) \\lor q"));
		// a closing parenthesis ends the binder as well
		assertThat(zedCm(and(or(id("p"), FORALL), id("q"))),
				is("(p \\lor \\forall x \\colon \\mathbb{N} \\bullet x > 0) \\land q"));
	}

	@Test
	public void binderBodyIsNeverEnclosed() {
		ZExpression nested = forall(bindings(bind(id("N"), "y")), FORALL);
		assertThat(fuzz(nested), is("\\forall y : \\nat @ \\forall x : \\nat @ x > 0"));
	}

	@Test
	public void explicitParenthesesAreKept() {
		assertThat(fuzz(and(parens(or(id("p"), id("q"))), id("r"))), is("(p \\lor q) \\land r"));
		assertThat(fuzz(parens(id("p"))), is("(p)"));
	}

	@Test
	public void applicationUnderPrefixOperator() {
		ZExpression card = unary(ZOperator.CARD, call(id("s"), id("i")));
		assertThat(fuzz(card), is("\\# (s(i))"));
		assertThat(zedCm(card), is("\\# s(i)"));
	}

	@Test
	public void doubleSuperscriptIsEnclosed() {
		assertThat(fuzz(sup(sup(id("x"), num(2)), num(3))), is("(x^{2})^{3}"));
	}
}

package zedtex.formatters;

import org.junit.Test;
import org.junit.runner.RunWith;
import org.junit.runners.Parameterized;
import zedtex.model.z.ZExpression;
import zedtex.model.z.ZOperator;
import zedtex.model.z.ZQuantifier;

import java.util.Arrays;
import java.util.List;

import static org.hamcrest.CoreMatchers.is;
import static org.junit.Assert.assertThat;
import static zedtex.model.z.ZBuilder.*;

@RunWith(Parameterized.class)
public class ZExpressionFormattingVisitorTest {

	@Parameterized.Parameters(name = "{1}")
	public static List<Object[]> data() {
		return Arrays.asList(new Object[][]{
				{implies(and(id("p"), id("q")), id("r")), "((p and q) => r)"},
				{not(id("p")), "(not p)"},
				{unary(ZOperator.CARD, id("s")), "(# s)"},
				{unary(ZOperator.INVERSE, id("R")), "(R~)"},
				{chain(id("a"), ZOperator.LESS, id("b"), ZOperator.LESS_EQ, id("c")), "(a < b <= c)"},
				{forall(bindings(bind(id("N"), "x", "y")), binop(ZOperator.GREATER, id("x"), id("y"))),
						"(forall x, y : N | (x > y))"},
				{quantifier(ZQuantifier.Kind.MU, bindings(bind(id("N"), "x")), id("p"), id("x")),
						"(mu x : N | p . x)"},
				{seq(id("a"), id("b")), "<a, b>"},
				{bag(), "[[]]"},
				{range(num(1), id("n")), "(1 .. n)"},
				{conditional(id("p"), num(1), num(0)), "(if p then 1 else 0)"},
				{call(id("f"), id("x"), id("y")), "f(x, y)"},
				{apply(id("f"), id("x")), "(f x)"},
				{image(id("R"), set(num(1))), "R(| {1} |)"},
				{parens(or(id("p"), id("q"))), "(p or q)"},
		});
	}

	private final ZExpression expression;
	private final String expected;

	public ZExpressionFormattingVisitorTest(ZExpression expression, String expected) {
		this.expression = expression;
		this.expected = expected;
	}

	@Test
	public void test() {
		assertThat(expression.toString(), is(expected));
	}
}

package zedtex.parser;

import static org.hamcrest.CoreMatchers.is;
import static org.junit.Assert.assertThat;
import static zedtex.model.z.ZBuilder.*;

import java.util.Arrays;
import java.util.List;

import org.junit.Test;
import org.junit.runner.RunWith;
import org.junit.runners.Parameterized;
import org.junit.runners.Parameterized.Parameters;

import zedtex.lexer.ProseDetector;
import zedtex.lexer.ZLexer;
import zedtex.model.z.ZExpression;
import zedtex.model.z.ZOperator;

@RunWith(Parameterized.class)
public class ZExpressionParserTest {

	@Parameters
	public static List<Object[]> data() {
		return Arrays.asList(new Object[][] {
				// connectives
				{"p and q => r", implies(and(id("p"), id("q")), id("r"))},
				{"p => q => r", implies(id("p"), implies(id("q"), id("r")))},
				{"p or q or r", or(or(id("p"), id("q")), id("r"))},
				{"p <=> q or r", iff(id("p"), or(id("q"), id("r")))},
				{"not p and q", and(not(id("p")), id("q"))},
				{"not x = y", not(binop(ZOperator.EQUALS, id("x"), id("y")))},
				{"(p or q) and r", and(parens(or(id("p"), id("q"))), id("r"))},

				// arithmetic, sets and relations
				{"a + b * c", binop(ZOperator.PLUS, id("a"), binop(ZOperator.TIMES, id("b"), id("c")))},
				{"a - b - c", binop(ZOperator.MINUS, binop(ZOperator.MINUS, id("a"), id("b")), id("c"))},
				{"x in S union T", binop(ZOperator.IN, id("x"), binop(ZOperator.UNION, id("S"), id("T")))},
				{"N -> P N", binop(ZOperator.FUN, id("N"), unary(ZOperator.POWER, id("N")))},
				{"a |-> b", binop(ZOperator.MAPLET, id("a"), id("b"))},
				{"S <| R |> T", binop(ZOperator.RRES, binop(ZOperator.DRES, id("S"), id("R")), id("T"))},
				{"1 .. n", range(num(1), id("n"))},
				{"<> ^ <a>", binop(ZOperator.CAT, seq(), seq(id("a")))},

				// comparisons
				{"x = y", binop(ZOperator.EQUALS, id("x"), id("y"))},
				{"a < b <= c", chain(id("a"), ZOperator.LESS, id("b"), ZOperator.LESS_EQ, id("c"))},

				// binders
				{"forall x : N | x > 0", forall(bindings(bind(id("N"), "x")),
						binop(ZOperator.GREATER, id("x"), num(0)))},
				{"exists x, y : N; s : seq N | x < y", exists(
						bindings(bind(id("N"), "x", "y"), bind(unary(ZOperator.SEQ, id("N")), "s")),
						binop(ZOperator.LESS, id("x"), id("y")))},
				{"forall x : N | exists y : N | y > x", forall(bindings(bind(id("N"), "x")),
						exists(bindings(bind(id("N"), "y")), binop(ZOperator.GREATER, id("y"), id("x"))))},
				{"mu x : N | x > 0 . x * 2", mu(bindings(bind(id("N"), "x")),
						binop(ZOperator.GREATER, id("x"), num(0)), binop(ZOperator.TIMES, id("x"), num(2)))},
				{"lambda x : N . x + 1", lambda(bindings(bind(id("N"), "x")),
						binop(ZOperator.PLUS, id("x"), num(1)))},
				{"p and forall x : N | x > 0", and(id("p"), forall(bindings(bind(id("N"), "x")),
						binop(ZOperator.GREATER, id("x"), num(0))))},
				{"if x > 0 then x else 0 - x", conditional(binop(ZOperator.GREATER, id("x"), num(0)), id("x"),
						binop(ZOperator.MINUS, num(0), id("x")))},

				// constructors
				{"{1, 2, 3}", set(num(1), num(2), num(3))},
				{"{}", set()},
				{"{x : N | x > 0 . x * x}", comprehension(bindings(bind(id("N"), "x")),
						binop(ZOperator.GREATER, id("x"), num(0)), binop(ZOperator.TIMES, id("x"), id("x")))},
				{"<a, b>", seq(id("a"), id("b"))},
				{"[[a, a]]", bag(id("a"), id("a"))},
				{"(a, b)", tuple(id("a"), id("b"))},

				// postfix forms and prefix operators
				{"f(x, y)", call(id("f"), id("x"), id("y"))},
				{"f x", apply(id("f"), id("x"))},
				{"f x + 1", binop(ZOperator.PLUS, apply(id("f"), id("x")), num(1))},
				{"#s", unary(ZOperator.CARD, id("s"))},
				{"dom R", unary(ZOperator.DOM, id("R"))},
				{"R~", unary(ZOperator.INVERSE, id("R"))},
				{"R+", unary(ZOperator.TRANSITIVE_CLOSURE, id("R"))},
				{"R(|{1}|)", image(id("R"), set(num(1)))},
				{"seq[N]", instantiate(id("seq"), id("N"))},
				{"x^2", sup(id("x"), num(2))},
				{"x^{n+1}", sup(id("x"), binop(ZOperator.PLUS, id("n"), num(1)))},
				{"x_1", sub(id("x"), num(1))},
				{"p.name", project(id("p"), "name")},
				{"s.1", project(id("s"), "1")},
		});
	}

	private final String source;
	private final ZExpression expected;

	public ZExpressionParserTest(String source, ZExpression expected) {
		this.source = source;
		this.expected = expected;
	}

	static ZExpression parse(String source) {
		TokenCursor cursor = new TokenCursor(new ZLexer(source, new ProseDetector(), false).tokenize());
		ZExpression expression = new ZExpressionParser(cursor).parseExpression();
		cursor.skipNewLines();
		assertThat("trailing input after " + source, cursor.atEnd(), is(true));
		return expression;
	}

	@Test
	public void test() {
		assertThat(parse(source), is(expected));
	}
}

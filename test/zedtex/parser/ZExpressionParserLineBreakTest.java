package zedtex.parser;

import org.junit.Test;
import zedtex.model.z.ZBinOp;
import zedtex.model.z.ZConditional;
import zedtex.model.z.ZOperator;
import zedtex.model.z.ZRelationChain;

import static org.hamcrest.CoreMatchers.instanceOf;
import static org.hamcrest.CoreMatchers.is;
import static org.junit.Assert.assertThat;
import static zedtex.model.z.ZBuilder.*;
import static zedtex.parser.ZExpressionParserTest.parse;

public class ZExpressionParserLineBreakTest {

	private static ZConditional conditionalOf(String source) {
		ZConditional conditional = (ZConditional) parse(source);
		assertThat(conditional.getCondition(), is(binop(ZOperator.GREATER, id("x"), num(0))));
		assertThat(conditional.getThen(), is(num(1)));
		assertThat(conditional.getElse(), is(num(0)));
		return conditional;
	}

	@Test
	public void conditionalBreakBeforeThen() {
		ZConditional conditional = conditionalOf("if x > 0 \\\\\n  then 1 else 0");
		assertThat(conditional.isLineBreakBeforeThen(), is(true));
		assertThat(conditional.isLineBreakBeforeElse(), is(false));
	}

	@Test
	public void conditionalBreakBeforeElse() {
		ZConditional conditional = conditionalOf("if x > 0 then 1 \\\\\n  else 0");
		assertThat(conditional.isLineBreakBeforeThen(), is(false));
		assertThat(conditional.isLineBreakBeforeElse(), is(true));
	}

	@Test
	public void conditionalBreaksOnBothBranches() {
		ZConditional conditional = conditionalOf("if x > 0 \\\\\n  then 1 \\\\\n  else 0");
		assertThat(conditional.isLineBreakBeforeThen(), is(true));
		assertThat(conditional.isLineBreakBeforeElse(), is(true));
	}

	@Test
	public void conditionalOnOneLine() {
		ZConditional conditional = conditionalOf("if x > 0 then 1 else 0");
		assertThat(conditional.isLineBreakBeforeThen(), is(false));
		assertThat(conditional.isLineBreakBeforeElse(), is(false));
		assertThat(conditional, is(conditional(binop(ZOperator.GREATER, id("x"), num(0)), num(1), num(0))));
	}

	@Test
	public void chainKeepsItsBreaks() {
		ZRelationChain chain = (ZRelationChain) parse("a < b <= \\\\\n  c");
		assertThat(chain.getOperators().size(), is(2));
		assertThat(chain.isLineBreakAfter(0), is(false));
		assertThat(chain.isLineBreakAfter(1), is(true));
	}

	@Test
	public void chainBreakBeforeAnOperator() {
		ZRelationChain chain = (ZRelationChain) parse("a < b \\\\\n  <= c");
		assertThat(chain.getOperands().size(), is(3));
		assertThat(chain.isLineBreakAfter(0), is(false));
		assertThat(chain.isLineBreakAfter(1), is(true));
	}

	@Test
	public void singleComparisonIsABinOp() {
		ZBinOp comparison = (ZBinOp) parse("a < \\\\\n  b");
		assertThat(comparison, instanceOf(ZBinOp.class));
		assertThat(comparison.isLineBreakAfter(), is(true));
	}
}

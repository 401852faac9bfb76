package zedtex.trans;

import org.junit.Test;
import zedtex.ZedTexOptions;
import zedtex.trans.passes.codegen.latex.Dialect;

import static org.hamcrest.CoreMatchers.is;
import static org.junit.Assert.assertThat;

public class ZedTexTranslatorLineBreakTest {

	private final ZedTexTranslator fragments = new ZedTexTranslator(ZedTexOptions.fromJSON("{\"preamble\": false}"));

	@Test
	public void conditionalBranchesInABox() {
		String source = "axdef\n  sign : N\nwhere\n  if x > 0 \\\\\n    then sign = 1 \\\\\n    else sign = 0\nend\n";
		assertThat(fragments.translate(source).getOutput(), is("\\begin{axdef}\n" +
				"sign : \\nat\n" +
				"\\where\n" +
				"\\IF x > 0 \\\\\n" +
				"\\t1 \\THEN sign = 1 \\\\\n" +
				"\\t1 \\ELSE sign = 0\n" +
				"\\end{axdef}\n"));
		assertThat(fragments.translate(source, Dialect.ZED_CM).getOutput(), is("\\begin{axdef}\n" +
				"sign \\colon \\mathbb{N}\n" +
				"\\where\n" +
				"\\mathbf{if} x > 0 \\\\\n" +
				"\\quad \\mathbf{then} sign = 1 \\\\\n" +
				"\\quad \\mathbf{else} sign = 0\n" +
				"\\end{axdef}\n"));
	}

	@Test
	public void relationChainInABox() {
		String source = "axdef\n  a, b, c : N\nwhere\n  a < b <= \\\\\n    c\nend\n";
		assertThat(fragments.translate(source).getOutput(), is("\\begin{axdef}\n" +
				"a, b, c : \\nat\n" +
				"\\where\n" +
				"a < b \\leq \\\\\n" +
				"\\t1 c\n" +
				"\\end{axdef}\n"));
	}

	@Test
	public void equivalenceStepAcrossLines() {
		String source = "EQUIV:\nforall x : N | x > 0 and \\\\\n  x < 100\n";
		assertThat(fragments.translate(source).getOutput(), is("\\begin{argue}\n" +
				"\\forall x : \\nat @ x > 0 \\land \\\\\n" +
				"\\t1 x < 100\n" +
				"\\end{argue}\n"));
	}
}

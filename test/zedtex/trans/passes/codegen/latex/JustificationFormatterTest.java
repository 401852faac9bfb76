package zedtex.trans.passes.codegen.latex;

import org.junit.Test;

import java.util.Arrays;
import java.util.Collections;

import static org.hamcrest.CoreMatchers.is;
import static org.junit.Assert.assertThat;

public class JustificationFormatterTest {

	private final JustificationFormatter fuzz = new JustificationFormatter(new DialectSymbols(Dialect.FUZZ));
	private final JustificationFormatter zedCm = new JustificationFormatter(new DialectSymbols(Dialect.ZED_CM));

	@Test
	public void plainText() {
		assertThat(fuzz.format("rule1"), is("\\mbox{rule1}"));
		assertThat(fuzz.format("  modus ponens "), is("\\mbox{modus ponens}"));
	}

	@Test
	public void connectivesBecomeArrows() {
		assertThat(fuzz.format("=> intro"), is("\\mbox{$\\Rightarrow$ intro}"));
		assertThat(zedCm.format("<=> elim"), is("\\mbox{$\\Leftrightarrow$ elim}"));
		assertThat(zedCm.format("and intro"), is("\\mbox{$\\land$ intro}"));
		assertThat(fuzz.format("forall elim"), is("\\mbox{$\\forall$ elim}"));
	}

	@Test
	public void dischargedLabels() {
		assertThat(fuzz.format("=> intro from 1"), is("\\mbox{$\\Rightarrow$ intro}^{1}"));
		assertThat(fuzz.format("or elim from 2, 3"), is("\\mbox{$\\lor$ elim}^{2,3}"));
		assertThat(fuzz.format("from 4"), is("^{4}"));
		assertThat(JustificationFormatter.dischargedLabels("or elim from 2,3"), is(Arrays.asList(2, 3)));
		assertThat(JustificationFormatter.dischargedLabels("taken from the book"),
				is(Collections.<Integer>emptyList()));
	}

	@Test
	public void textIsEscaped() {
		assertThat(fuzz.format("50% rule"), is("\\mbox{50\\% rule}"));
	}
}

package zedtex.errors;

import org.junit.Test;
import zedtex.trans.passes.codegen.latex.LineTooLongIssue;
import zedtex.trans.passes.codegen.latex.UnknownProofLabelIssue;
import zedtex.util.SourceLocation;

import java.util.Arrays;

import static org.hamcrest.CoreMatchers.is;
import static org.junit.Assert.assertThat;

public class TopLevelIssueContextTest {

	@Test
	public void empty() {
		TopLevelIssueContext ctx = new TopLevelIssueContext();
		assertThat(ctx.hasIssues(), is(false));
		assertThat(ctx.getWarnings().isEmpty(), is(true));
		assertThat(ctx.summary(), is("0 warnings"));
	}

	@Test
	public void warningsKeepTheirOrder() {
		TopLevelIssueContext ctx = new TopLevelIssueContext();
		ctx.warn(new UnknownProofLabelIssue(2, new SourceLocation(0, 1, 4, 4, 3, 4)));
		ctx.warn(new LineTooLongIssue("schema", "x : N", 4));
		assertThat(ctx.hasIssues(), is(true));
		assertThat(ctx.getWarnings(), is(Arrays.asList(
				"proof step discharges assumption [2] which the proof never introduces (line 4)",
				"line in schema exceeds 4 characters (5):\n    x : N")));
		assertThat(ctx.summary(), is("2 warnings: 1 line too long, 1 unknown proof label"));
	}

	@Test
	public void summaryCountsEachKind() {
		TopLevelIssueContext ctx = new TopLevelIssueContext();
		ctx.warn(new LineTooLongIssue("axdef", "abcdef", 5));
		ctx.warn(new LineTooLongIssue("axdef", "ghijkl", 5));
		assertThat(ctx.summary(), is("2 warnings: 2 lines too long"));
		ctx.warn(new UnknownProofLabelIssue(1, SourceLocation.unknown()));
		ctx.warn(new UnknownProofLabelIssue(3, SourceLocation.unknown()));
		assertThat(ctx.summary(), is("4 warnings: 2 lines too long, 2 unknown proof labels"));
	}
}

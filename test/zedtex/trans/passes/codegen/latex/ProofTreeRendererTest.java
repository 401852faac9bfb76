package zedtex.trans.passes.codegen.latex;

import org.junit.Test;
import zedtex.errors.Issue;
import zedtex.errors.TopLevelIssueContext;
import zedtex.model.z.ZExpression;
import zedtex.model.z.ZProofNode;

import static org.hamcrest.CoreMatchers.instanceOf;
import static org.hamcrest.CoreMatchers.is;
import static org.junit.Assert.assertThat;
import static zedtex.model.z.ZBuilder.*;

public class ProofTreeRendererTest {

	private static String render(ZProofNode root, Dialect dialect, TopLevelIssueContext ctx) {
		return new ProofTreeRenderer(new DialectSymbols(dialect), ctx).render(root);
	}

	@Test
	public void assumptionIsDischargedBySiblingPremises() {
		ZExpression qAndR = and(id("q"), id("r"));
		ZProofNode root = proofNode(implies(id("p"), qAndR), "=> intro from 1",
				assumption(1, id("p"), "assumption",
						proofNode(qAndR, "and intro", sibling(id("q"), "rule1"), sibling(id("r"), "rule2"))));
		String expected = "\\infer[\\mbox{$\\Rightarrow$ intro}^{1}]{p \\Rightarrow q \\land r}" +
				"{\\infer[\\mbox{$\\land$ intro}]{q \\land r}" +
				"{\\infer[\\mbox{rule1}]{q}{[p]^{1}} & \\infer[\\mbox{rule2}]{r}{[p]^{1}}}}";
		for(Dialect dialect : Dialect.values()) {
			TopLevelIssueContext ctx = new TopLevelIssueContext();
			assertThat(render(root, dialect, ctx), is(expected));
			assertThat(ctx.hasIssues(), is(false));
		}
	}

	@Test
	public void stepsInScopeFollowEachOther() {
		ZProofNode root = proofNode(implies(id("p"), id("r")), "=> intro from 1",
				assumption(1, id("p"), null,
						proofNode(id("q"), "rule1"),
						proofNode(id("r"), "rule2")));
		TopLevelIssueContext ctx = new TopLevelIssueContext();
		assertThat(render(root, Dialect.FUZZ, ctx), is("\\infer[\\mbox{$\\Rightarrow$ intro}^{1}]{p \\Rightarrow r}" +
				"{\\infer[\\mbox{rule2}]{r}{\\infer[\\mbox{rule1}]{q}{[p]^{1}}}}"));
	}

	@Test
	public void leafWithoutJustificationIsPlain() {
		ZProofNode root = proofNode(and(id("p"), id("q")), "and intro",
				proofNode(id("p"), null), proofNode(id("q"), null));
		assertThat(render(root, Dialect.ZED_CM, new TopLevelIssueContext()),
				is("\\infer[\\mbox{$\\land$ intro}]{p \\land q}{p & q}"));
	}

	@Test
	public void caseAnalysis() {
		ZProofNode root = proofNode(id("r"), "or elim",
				proofCase(id("p"), proofNode(id("r"), "rule")),
				proofCase(id("q"), proofNode(id("r"), "rule")));
		assertThat(render(root, Dialect.FUZZ, new TopLevelIssueContext()),
				is("\\infer[\\mbox{$\\lor$ elim}]{r}" +
						"{\\infer[\\mbox{rule}]{r}{[p]} & \\hskip 6em \\infer[\\mbox{rule}]{r}{[q]}}"));
	}

	@Test
	public void caseSpacingGrowsWithDepth() {
		assertThat(ProofTreeRenderer.caseSpacing(0), is(6));
		assertThat(ProofTreeRenderer.caseSpacing(1), is(8));
		assertThat(ProofTreeRenderer.caseSpacing(2), is(10));
	}

	@Test
	public void unknownDischargedLabelIsReported() {
		ZProofNode root = proofNode(implies(id("p"), id("q")), "=> intro from 2", proofNode(id("q"), null));
		TopLevelIssueContext ctx = new TopLevelIssueContext();
		String output = render(root, Dialect.FUZZ, ctx);
		assertThat(output, is("\\infer[\\mbox{$\\Rightarrow$ intro}^{2}]{p \\Rightarrow q}{q}"));
		assertThat(ctx.getIssues().size(), is(1));
		Issue issue = ctx.getIssues().get(0);
		assertThat(issue, instanceOf(UnknownProofLabelIssue.class));
		assertThat(((UnknownProofLabelIssue) issue).getLabel(), is(2));
	}
}

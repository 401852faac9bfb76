package zedtex.trans.passes.codegen.latex;

import zedtex.errors.IssueContext;
import zedtex.model.z.*;

import java.util.ArrayList;
import java.util.HashSet;
import java.util.List;
import java.util.Set;

/**
 * Renders a proof tree with the \infer macro of the proof package.
 *
 * A step becomes \infer[justification]{expression}{premises}, its children being the premises. An assumption
 * [n] p opens a scope: the steps under it are derived one after the other, starting from [p]^{n}, and each
 * takes the previous one as its premise unless it has premises of its own. A case of a case analysis is a
 * scope that starts from its case expression; the cases are set side by side with more space between them the
 * deeper they are nested.
 */
public class ProofTreeRenderer {

	private final DialectSymbols symbols;
	private final JustificationFormatter justifications;
	private final IssueContext ctx;

	public ProofTreeRenderer(DialectSymbols symbols, IssueContext ctx) {
		this.symbols = symbols;
		this.justifications = new JustificationFormatter(symbols);
		this.ctx = ctx;
	}

	public String render(ZProofNode root) {
		Set<Integer> labels = new HashSet<>();
		collectLabels(root, labels);
		checkDischarges(root, labels);
		return step(root, 0);
	}

	private void collectLabels(ZProofStep step, Set<Integer> labels) {
		step.accept(new ZProofStepVisitor<Void, RuntimeException>() {
			@Override
			public Void visit(ZProofNode zProofNode) {
				if(zProofNode.getLabel() != null) {
					labels.add(zProofNode.getLabel());
				}
				return null;
			}

			@Override
			public Void visit(ZProofCase zProofCase) {
				return null;
			}
		});
		for(ZProofStep child : step.getChildren()) {
			collectLabels(child, labels);
		}
	}

	private void checkDischarges(ZProofStep step, Set<Integer> labels) {
		step.accept(new ZProofStepVisitor<Void, RuntimeException>() {
			@Override
			public Void visit(ZProofNode zProofNode) {
				if(zProofNode.getJustification() != null) {
					for(int label : JustificationFormatter.dischargedLabels(zProofNode.getJustification())) {
						if(!labels.contains(label)) {
							ctx.warn(new UnknownProofLabelIssue(label, zProofNode.getLocation()));
						}
					}
				}
				return null;
			}

			@Override
			public Void visit(ZProofCase zProofCase) {
				return null;
			}
		});
		for(ZProofStep child : step.getChildren()) {
			checkDischarges(child, labels);
		}
	}

	private String expression(ZExpression expression) {
		return LatexExpressionVisitor.render(expression, symbols, DialectSymbols.Context.CHAIN);
	}

	private String infer(ZProofNode node, List<String> premises) {
		StringBuilder result = new StringBuilder("\\infer");
		if(node.getJustification() != null) {
			result.append('[').append(justifications.format(node.getJustification())).append(']');
		}
		result.append('{').append(expression(node.getExpression())).append("}{");
		result.append(String.join(" & ", premises));
		return result.append('}').toString();
	}

	private String step(ZProofStep step, int caseDepth) {
		return step.accept(new ZProofStepVisitor<String, RuntimeException>() {
			@Override
			public String visit(ZProofNode zProofNode) {
				if(zProofNode.isAssumption()) {
					return scope(assumption(zProofNode), zProofNode.getChildren(), caseDepth);
				}
				return node(zProofNode, caseDepth);
			}

			@Override
			public String visit(ZProofCase zProofCase) {
				return scope("[" + expression(zProofCase.getName()) + "]", zProofCase.getChildren(), caseDepth);
			}
		});
	}

	private String assumption(ZProofNode node) {
		String result = "[" + expression(node.getExpression()) + "]";
		if(node.getLabel() != null) {
			result += "^{" + node.getLabel() + "}";
		}
		return result;
	}

	private String node(ZProofNode node, int caseDepth) {
		List<String> premises = new ArrayList<>();
		List<String> cases = new ArrayList<>();
		for(ZProofStep child : node.getChildren()) {
			child.accept(new ZProofStepVisitor<Void, RuntimeException>() {
				@Override
				public Void visit(ZProofNode zProofNode) {
					premises.add(step(zProofNode, caseDepth));
					return null;
				}

				@Override
				public Void visit(ZProofCase zProofCase) {
					cases.add(step(zProofCase, caseDepth + 1));
					return null;
				}
			});
		}
		if(premises.isEmpty() && cases.isEmpty() && node.getJustification() == null) {
			return expression(node.getExpression());
		}
		if(!cases.isEmpty()) {
			StringBuilder analysis = new StringBuilder(cases.get(0));
			for(String c : cases.subList(1, cases.size())) {
				analysis.append(" & \\hskip ").append(caseSpacing(caseDepth)).append("em ").append(c);
			}
			premises.add(analysis.toString());
		}
		return infer(node, premises);
	}

	/**
	 * Space between the cases of an analysis nested caseDepth cases deep, in em.
	 */
	static int caseSpacing(int caseDepth) {
		return 6 + 2 * caseDepth;
	}

	/**
	 * Derives the steps of a scope in order, each from the one before.
	 */
	private String scope(String start, List<ZProofStep> steps, int caseDepth) {
		String derived = start;
		for(ZProofStep s : steps) {
			String previous = derived;
			derived = s.accept(new ZProofStepVisitor<String, RuntimeException>() {
				@Override
				public String visit(ZProofNode zProofNode) {
					if(zProofNode.isAssumption()) {
						return step(zProofNode, caseDepth);
					}
					List<String> premises = new ArrayList<>();
					if(zProofNode.getChildren().isEmpty()) {
						premises.add(previous);
					}
					for(ZProofStep child : zProofNode.getChildren()) {
						premises.add(premiseInScope(child, previous, caseDepth));
					}
					return infer(zProofNode, premises);
				}

				@Override
				public String visit(ZProofCase zProofCase) {
					return step(zProofCase, caseDepth + 1);
				}
			});
		}
		return derived;
	}

	/**
	 * A premise written without premises of its own inside a scope follows from what the scope has derived
	 * so far.
	 */
	private String premiseInScope(ZProofStep premise, String derived, int caseDepth) {
		return premise.accept(new ZProofStepVisitor<String, RuntimeException>() {
			@Override
			public String visit(ZProofNode zProofNode) {
				if(!zProofNode.isAssumption() && zProofNode.getChildren().isEmpty()) {
					List<String> premises = new ArrayList<>();
					premises.add(derived);
					return infer(zProofNode, premises);
				}
				return step(zProofNode, caseDepth);
			}

			@Override
			public String visit(ZProofCase zProofCase) {
				return step(zProofCase, caseDepth + 1);
			}
		});
	}
}

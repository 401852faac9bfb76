package zedtex.parser;

import zedtex.lexer.ZToken;
import zedtex.model.z.ZExpression;
import zedtex.model.z.ZProofCase;
import zedtex.model.z.ZProofNode;
import zedtex.model.z.ZProofStep;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.List;

/**
 * Builds a proof tree from the lines of a PROOF: block, using their indentation.
 *
 * The first line is the conclusion. Every later line belongs to the nearest line above it that is indented
 * less. Lines marked with :: are siblings: they are held back and become the premises of the next ordinary
 * line at the same indentation, or of their parent if no such line follows. Case lines (case p:) open a
 * derivation that assumes p.
 */
public class ProofTreeReducer {

	public enum LineKind {
		NODE,
		SIBLING,
		ASSUMPTION,
		CASE,
	}

	/**
	 * One line of a proof, already parsed.
	 */
	public static class ProofLine {
		private final LineKind kind;
		private final int depth;
		private final ZExpression expression;
		private final String justification;
		private final Integer label;
		private final ZToken start;

		public ProofLine(LineKind kind, int depth, ZExpression expression, String justification, Integer label,
		                 ZToken start) {
			this.kind = kind;
			this.depth = depth;
			this.expression = expression;
			this.justification = justification;
			this.label = label;
			this.start = start;
		}

		public LineKind getKind() {
			return kind;
		}

		public int getDepth() {
			return depth;
		}

		public ZToken getStart() {
			return start;
		}
	}

	private static class OpenStep {
		final ProofLine line;
		final List<OpenStep> children = new ArrayList<>();
		final List<OpenStep> pendingSiblings = new ArrayList<>();

		OpenStep(ProofLine line) {
			this.line = line;
		}

		ZProofStep build() {
			List<ZProofStep> built = new ArrayList<>();
			for(OpenStep child : children) {
				built.add(child.build());
			}
			for(OpenStep sibling : pendingSiblings) {
				built.add(sibling.build());
			}
			if(line.kind == LineKind.CASE) {
				return new ZProofCase(line.start.getLocation(), line.expression, built);
			}
			return new ZProofNode(line.start.getLocation(), line.expression, line.justification, line.label,
					line.kind == LineKind.ASSUMPTION, line.kind == LineKind.SIBLING, built);
		}
	}

	private final TokenCursor cursor;

	public ProofTreeReducer(TokenCursor cursor) {
		this.cursor = cursor;
	}

	public ZProofNode reduce(List<ProofLine> lines) {
		if(lines.isEmpty()) {
			throw cursor.error("proof line");
		}
		ProofLine first = lines.get(0);
		if(first.kind == LineKind.SIBLING || first.kind == LineKind.CASE) {
			throw cursor.errorAt(first.start, "a proof must start with its conclusion", "conclusion");
		}
		OpenStep root = new OpenStep(first);
		Deque<OpenStep> open = new ArrayDeque<>();
		open.push(root);
		for(ProofLine line : lines.subList(1, lines.size())) {
			while(!open.isEmpty() && open.peek().line.depth >= line.depth) {
				open.pop();
			}
			if(open.isEmpty()) {
				throw cursor.errorAt(line.start, "a proof has a single conclusion; indent the steps supporting it",
						"indented proof line");
			}
			OpenStep parent = open.peek();
			OpenStep step = new OpenStep(line);
			switch(line.kind) {
				case SIBLING:
					parent.pendingSiblings.add(step);
					break;
				case CASE:
					parent.children.add(step);
					break;
				default:
					step.children.addAll(parent.pendingSiblings);
					parent.pendingSiblings.clear();
					parent.children.add(step);
			}
			open.push(step);
		}
		return (ZProofNode) root.build();
	}
}

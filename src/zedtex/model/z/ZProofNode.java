package zedtex.model.z;

import zedtex.util.SourceLocation;

import java.util.List;
import java.util.Objects;

/**
 * A formula in a proof tree with its justification.
 *
 * An assumption carries the label it was introduced with ([1] p [assumption]); its children are the steps
 * derived while the assumption is open. Any other node's children are the derivations of its premises. A
 * sibling node was written with a leading :: and is a co-premise of the next non-sibling step.
 */
public class ZProofNode extends ZProofStep {
	private final ZExpression expression;
	private final String justification;
	private final Integer label;
	private final boolean assumption;
	private final boolean sibling;

	public ZProofNode(SourceLocation location, ZExpression expression, String justification, Integer label,
	                  boolean assumption, boolean sibling, List<ZProofStep> children) {
		super(location, children);
		this.expression = expression;
		this.justification = justification;
		this.label = label;
		this.assumption = assumption;
		this.sibling = sibling;
	}

	public ZExpression getExpression() {
		return expression;
	}

	public String getJustification() {
		return justification;
	}

	/**
	 * @return the assumption label, or null
	 */
	public Integer getLabel() {
		return label;
	}

	public boolean isAssumption() {
		return assumption;
	}

	public boolean isSibling() {
		return sibling;
	}

	@Override
	public <T, E extends Throwable> T accept(ZProofStepVisitor<T, E> v) throws E {
		return v.visit(this);
	}

	@Override
	public int hashCode() {
		return Objects.hash(expression, justification, label, assumption, sibling, getChildren());
	}

	@Override
	public boolean equals(Object obj) {
		if (this == obj) {
			return true;
		}
		if (obj == null || obj.getClass() != getClass()) {
			return false;
		}
		ZProofNode that = (ZProofNode) obj;
		return expression.equals(that.expression) && Objects.equals(justification, that.justification) &&
				Objects.equals(label, that.label) && assumption == that.assumption && sibling == that.sibling &&
				getChildren().equals(that.getChildren());
	}
}

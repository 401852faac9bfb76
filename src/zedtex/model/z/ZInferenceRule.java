package zedtex.model.z;

import zedtex.util.SourceLocation;

import java.util.List;
import java.util.Objects;

/**
 * An INFRULE: block: premises above a line, a conclusion below it, and an optional rule name.
 */
public class ZInferenceRule extends ZDocumentItem {
	private final List<ZExpression> premises;
	private final ZExpression conclusion;
	private final String label;

	public ZInferenceRule(SourceLocation location, List<ZExpression> premises, ZExpression conclusion, String label) {
		super(location);
		this.premises = premises;
		this.conclusion = conclusion;
		this.label = label;
	}

	public List<ZExpression> getPremises() {
		return premises;
	}

	public ZExpression getConclusion() {
		return conclusion;
	}

	public String getLabel() {
		return label;
	}

	@Override
	public <T, E extends Throwable> T accept(ZDocumentItemVisitor<T, E> v) throws E {
		return v.visit(this);
	}

	@Override
	public int hashCode() {
		return Objects.hash(premises, conclusion, label);
	}

	@Override
	public boolean equals(Object obj) {
		if (this == obj) {
			return true;
		}
		if (obj == null || obj.getClass() != getClass()) {
			return false;
		}
		ZInferenceRule that = (ZInferenceRule) obj;
		return premises.equals(that.premises) && conclusion.equals(that.conclusion) && Objects.equals(label, that.label);
	}
}

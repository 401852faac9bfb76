package zedtex.model.z;

import zedtex.util.SourceLocation;

import java.util.List;
import java.util.Objects;

/**
 * A sequence display, &lt;a, b&gt; or ⟨a, b⟩. The element list may be empty.
 */
public class ZSequenceLiteral extends ZExpression {
	private final List<ZExpression> elements;

	public ZSequenceLiteral(SourceLocation location, List<ZExpression> elements) {
		super(location);
		this.elements = elements;
	}

	public List<ZExpression> getElements() {
		return elements;
	}

	@Override
	public <T, E extends Throwable> T accept(ZExpressionVisitor<T, E> v) throws E {
		return v.visit(this);
	}

	@Override
	public int hashCode() {
		return Objects.hash(elements);
	}

	@Override
	public boolean equals(Object obj) {
		if (this == obj) {
			return true;
		}
		if (obj == null || obj.getClass() != getClass()) {
			return false;
		}
		ZSequenceLiteral that = (ZSequenceLiteral) obj;
		return elements.equals(that.elements);
	}
}

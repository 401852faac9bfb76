package zedtex.model.z;

import zedtex.util.SourceLocation;

import java.util.List;
import java.util.Objects;

/**
 * A parenthesised tuple of two or more elements.
 */
public class ZTuple extends ZExpression {
	private final List<ZExpression> elements;

	public ZTuple(SourceLocation location, List<ZExpression> elements) {
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
		ZTuple that = (ZTuple) obj;
		return elements.equals(that.elements);
	}
}

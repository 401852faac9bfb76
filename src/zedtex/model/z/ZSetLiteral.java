package zedtex.model.z;

import zedtex.util.SourceLocation;

import java.util.List;
import java.util.Objects;

/**
 * An enumerated set, { a, b, c }. The element list may be empty.
 */
public class ZSetLiteral extends ZExpression {
	private final List<ZExpression> elements;

	public ZSetLiteral(SourceLocation location, List<ZExpression> elements) {
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
		ZSetLiteral that = (ZSetLiteral) obj;
		return elements.equals(that.elements);
	}
}

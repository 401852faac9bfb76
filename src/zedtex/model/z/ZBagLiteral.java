package zedtex.model.z;

import zedtex.util.SourceLocation;

import java.util.List;
import java.util.Objects;

/**
 * A bag display, [[a, b]].
 */
public class ZBagLiteral extends ZExpression {
	private final List<ZExpression> elements;

	public ZBagLiteral(SourceLocation location, List<ZExpression> elements) {
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
		ZBagLiteral that = (ZBagLiteral) obj;
		return elements.equals(that.elements);
	}
}

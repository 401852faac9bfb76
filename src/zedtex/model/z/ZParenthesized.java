package zedtex.model.z;

import zedtex.util.SourceLocation;

import java.util.Objects;

/**
 * A compound expression that the source wrapped in parentheses. Kept so the output shows the same grouping.
 */
public class ZParenthesized extends ZExpression {
	private final ZExpression inner;

	public ZParenthesized(SourceLocation location, ZExpression inner) {
		super(location);
		this.inner = inner;
	}

	public ZExpression getInner() {
		return inner;
	}

	@Override
	public <T, E extends Throwable> T accept(ZExpressionVisitor<T, E> v) throws E {
		return v.visit(this);
	}

	@Override
	public int hashCode() {
		return Objects.hash(inner);
	}

	@Override
	public boolean equals(Object obj) {
		if (this == obj) {
			return true;
		}
		if (obj == null || obj.getClass() != getClass()) {
			return false;
		}
		ZParenthesized that = (ZParenthesized) obj;
		return inner.equals(that.inner);
	}
}

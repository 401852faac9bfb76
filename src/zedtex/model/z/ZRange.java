package zedtex.model.z;

import zedtex.util.SourceLocation;

import java.util.Objects;

/**
 * A number range, m .. n.
 */
public class ZRange extends ZExpression {
	private final ZExpression from;
	private final ZExpression to;

	public ZRange(SourceLocation location, ZExpression from, ZExpression to) {
		super(location);
		this.from = from;
		this.to = to;
	}

	public ZExpression getFrom() {
		return from;
	}

	public ZExpression getTo() {
		return to;
	}

	@Override
	public <T, E extends Throwable> T accept(ZExpressionVisitor<T, E> v) throws E {
		return v.visit(this);
	}

	@Override
	public int hashCode() {
		return Objects.hash(from, to);
	}

	@Override
	public boolean equals(Object obj) {
		if (this == obj) {
			return true;
		}
		if (obj == null || obj.getClass() != getClass()) {
			return false;
		}
		ZRange that = (ZRange) obj;
		return from.equals(that.from) && to.equals(that.to);
	}
}

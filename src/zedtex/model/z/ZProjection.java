package zedtex.model.z;

import zedtex.util.SourceLocation;

import java.util.Objects;

/**
 * Selection of a named or numbered component: e.name or p.1.
 */
public class ZProjection extends ZExpression {
	private final ZExpression target;
	private final String field;

	public ZProjection(SourceLocation location, ZExpression target, String field) {
		super(location);
		this.target = target;
		this.field = field;
	}

	public ZExpression getTarget() {
		return target;
	}

	public String getField() {
		return field;
	}

	@Override
	public <T, E extends Throwable> T accept(ZExpressionVisitor<T, E> v) throws E {
		return v.visit(this);
	}

	@Override
	public int hashCode() {
		return Objects.hash(target, field);
	}

	@Override
	public boolean equals(Object obj) {
		if (this == obj) {
			return true;
		}
		if (obj == null || obj.getClass() != getClass()) {
			return false;
		}
		ZProjection that = (ZProjection) obj;
		return target.equals(that.target) && field.equals(that.field);
	}
}

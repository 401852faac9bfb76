package zedtex.model.z;

import zedtex.util.SourceLocation;

import java.util.Objects;

/**
 * A subscripted name, a_1.
 */
public class ZSubscript extends ZExpression {
	private final ZExpression base;
	private final ZExpression index;

	public ZSubscript(SourceLocation location, ZExpression base, ZExpression index) {
		super(location);
		this.base = base;
		this.index = index;
	}

	public ZExpression getBase() {
		return base;
	}

	public ZExpression getIndex() {
		return index;
	}

	@Override
	public <T, E extends Throwable> T accept(ZExpressionVisitor<T, E> v) throws E {
		return v.visit(this);
	}

	@Override
	public int hashCode() {
		return Objects.hash(base, index);
	}

	@Override
	public boolean equals(Object obj) {
		if (this == obj) {
			return true;
		}
		if (obj == null || obj.getClass() != getClass()) {
			return false;
		}
		ZSubscript that = (ZSubscript) obj;
		return base.equals(that.base) && index.equals(that.index);
	}
}

package zedtex.model.z;

import zedtex.util.SourceLocation;

import java.util.List;
import java.util.Objects;

/**
 * A generic name instantiated with actual parameters, T[A, B].
 */
public class ZGenericInstantiation extends ZExpression {
	private final ZExpression base;
	private final List<ZExpression> parameters;

	public ZGenericInstantiation(SourceLocation location, ZExpression base, List<ZExpression> parameters) {
		super(location);
		this.base = base;
		this.parameters = parameters;
	}

	public ZExpression getBase() {
		return base;
	}

	public List<ZExpression> getParameters() {
		return parameters;
	}

	@Override
	public <T, E extends Throwable> T accept(ZExpressionVisitor<T, E> v) throws E {
		return v.visit(this);
	}

	@Override
	public int hashCode() {
		return Objects.hash(base, parameters);
	}

	@Override
	public boolean equals(Object obj) {
		if (this == obj) {
			return true;
		}
		if (obj == null || obj.getClass() != getClass()) {
			return false;
		}
		ZGenericInstantiation that = (ZGenericInstantiation) obj;
		return base.equals(that.base) && parameters.equals(that.parameters);
	}
}

package zedtex.model.z;

import zedtex.util.SourceLocation;

import java.util.Objects;

/**
 * A line holding a single formula, typeset as displayed mathematics.
 */
public class ZDisplayExpression extends ZDocumentItem {
	private final ZExpression expression;

	public ZDisplayExpression(SourceLocation location, ZExpression expression) {
		super(location);
		this.expression = expression;
	}

	public ZExpression getExpression() {
		return expression;
	}

	@Override
	public <T, E extends Throwable> T accept(ZDocumentItemVisitor<T, E> v) throws E {
		return v.visit(this);
	}

	@Override
	public int hashCode() {
		return Objects.hash(expression);
	}

	@Override
	public boolean equals(Object obj) {
		if (this == obj) {
			return true;
		}
		if (obj == null || obj.getClass() != getClass()) {
			return false;
		}
		ZDisplayExpression that = (ZDisplayExpression) obj;
		return expression.equals(that.expression);
	}
}

package zedtex.model.z;

import zedtex.util.SourceLocation;

import java.util.Objects;

/**
 * A tight superscript, x^2.
 */
public class ZSuperscript extends ZExpression {
	private final ZExpression base;
	private final ZExpression exponent;

	public ZSuperscript(SourceLocation location, ZExpression base, ZExpression exponent) {
		super(location);
		this.base = base;
		this.exponent = exponent;
	}

	public ZExpression getBase() {
		return base;
	}

	public ZExpression getExponent() {
		return exponent;
	}

	@Override
	public <T, E extends Throwable> T accept(ZExpressionVisitor<T, E> v) throws E {
		return v.visit(this);
	}

	@Override
	public int hashCode() {
		return Objects.hash(base, exponent);
	}

	@Override
	public boolean equals(Object obj) {
		if (this == obj) {
			return true;
		}
		if (obj == null || obj.getClass() != getClass()) {
			return false;
		}
		ZSuperscript that = (ZSuperscript) obj;
		return base.equals(that.base) && exponent.equals(that.exponent);
	}
}

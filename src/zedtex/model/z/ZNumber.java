package zedtex.model.z;

import zedtex.util.SourceLocation;

import java.util.Objects;

/**
 * A numeric literal, kept as written.
 */
public class ZNumber extends ZExpression {
	private final String value;

	public ZNumber(SourceLocation location, String value) {
		super(location);
		this.value = value;
	}

	public String getValue() {
		return value;
	}

	@Override
	public <T, E extends Throwable> T accept(ZExpressionVisitor<T, E> v) throws E {
		return v.visit(this);
	}

	@Override
	public int hashCode() {
		return Objects.hash(value);
	}

	@Override
	public boolean equals(Object obj) {
		if (this == obj) {
			return true;
		}
		if (obj == null || obj.getClass() != getClass()) {
			return false;
		}
		ZNumber that = (ZNumber) obj;
		return value.equals(that.value);
	}
}

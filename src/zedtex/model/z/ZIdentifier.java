package zedtex.model.z;

import zedtex.util.SourceLocation;

import java.util.Objects;

public class ZIdentifier extends ZExpression {
	private final String name;

	public ZIdentifier(SourceLocation location, String name) {
		super(location);
		this.name = name;
	}

	public String getName() {
		return name;
	}

	@Override
	public <T, E extends Throwable> T accept(ZExpressionVisitor<T, E> v) throws E {
		return v.visit(this);
	}

	@Override
	public int hashCode() {
		return Objects.hash(name);
	}

	@Override
	public boolean equals(Object obj) {
		if (this == obj) {
			return true;
		}
		if (obj == null || obj.getClass() != getClass()) {
			return false;
		}
		ZIdentifier that = (ZIdentifier) obj;
		return name.equals(that.name);
	}
}

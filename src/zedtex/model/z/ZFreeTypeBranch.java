package zedtex.model.z;

import zedtex.util.SourceLocation;

import java.util.Objects;

/**
 * One constructor of a free type. The parameter is null for constants.
 */
public class ZFreeTypeBranch extends ZNode {
	private final String constructor;
	private final ZExpression parameter;

	public ZFreeTypeBranch(SourceLocation location, String constructor, ZExpression parameter) {
		super(location);
		this.constructor = constructor;
		this.parameter = parameter;
	}

	public String getConstructor() {
		return constructor;
	}

	public ZExpression getParameter() {
		return parameter;
	}

	@Override
	public int hashCode() {
		return Objects.hash(constructor, parameter);
	}

	@Override
	public boolean equals(Object obj) {
		if (this == obj) {
			return true;
		}
		if (obj == null || obj.getClass() != getClass()) {
			return false;
		}
		ZFreeTypeBranch that = (ZFreeTypeBranch) obj;
		return constructor.equals(that.constructor) && Objects.equals(parameter, that.parameter);
	}
}

package zedtex.model.z;

import zedtex.util.SourceLocation;

import java.util.List;
import java.util.Objects;

/**
 * Application with a parenthesised argument list, f(a, b).
 */
public class ZFunctionCall extends ZExpression {
	private final ZExpression target;
	private final List<ZExpression> arguments;

	public ZFunctionCall(SourceLocation location, ZExpression target, List<ZExpression> arguments) {
		super(location);
		this.target = target;
		this.arguments = arguments;
	}

	public ZExpression getTarget() {
		return target;
	}

	public List<ZExpression> getArguments() {
		return arguments;
	}

	@Override
	public <T, E extends Throwable> T accept(ZExpressionVisitor<T, E> v) throws E {
		return v.visit(this);
	}

	@Override
	public int hashCode() {
		return Objects.hash(target, arguments);
	}

	@Override
	public boolean equals(Object obj) {
		if (this == obj) {
			return true;
		}
		if (obj == null || obj.getClass() != getClass()) {
			return false;
		}
		ZFunctionCall that = (ZFunctionCall) obj;
		return target.equals(that.target) && arguments.equals(that.arguments);
	}
}

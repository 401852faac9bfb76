package zedtex.model.z;

import zedtex.util.SourceLocation;

import java.util.Objects;

/**
 * Application written by juxtaposition, f x.
 */
public class ZApplication extends ZExpression {
	private final ZExpression function;
	private final ZExpression argument;

	public ZApplication(SourceLocation location, ZExpression function, ZExpression argument) {
		super(location);
		this.function = function;
		this.argument = argument;
	}

	public ZExpression getFunction() {
		return function;
	}

	public ZExpression getArgument() {
		return argument;
	}

	@Override
	public <T, E extends Throwable> T accept(ZExpressionVisitor<T, E> v) throws E {
		return v.visit(this);
	}

	@Override
	public int hashCode() {
		return Objects.hash(function, argument);
	}

	@Override
	public boolean equals(Object obj) {
		if (this == obj) {
			return true;
		}
		if (obj == null || obj.getClass() != getClass()) {
			return false;
		}
		ZApplication that = (ZApplication) obj;
		return function.equals(that.function) && argument.equals(that.argument);
	}
}

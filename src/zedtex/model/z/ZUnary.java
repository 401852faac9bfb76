package zedtex.model.z;

import zedtex.util.SourceLocation;

import java.util.Objects;

/**
 * 
 * AST node:
 * 
 * <op> operand, or operand <op> for postfix operators
 * 
 */
public class ZUnary extends ZExpression {
	private final String surface;
	private final ZOperator operator;
	private final ZExpression operand;

	public ZUnary(SourceLocation location, String surface, ZOperator operator, ZExpression operand) {
		super(location);
		this.surface = surface;
		this.operator = operator;
		this.operand = operand;
	}

	/**
	 * @return the operator exactly as it was written
	 */
	public String getSurface() {
		return surface;
	}

	public ZOperator getOperator() {
		return operator;
	}

	public ZExpression getOperand() {
		return operand;
	}

	public boolean isPostfix() {
		return operator.getFixity() == ZOperator.Fixity.POSTFIX;
	}

	@Override
	public <T, E extends Throwable> T accept(ZExpressionVisitor<T, E> v) throws E {
		return v.visit(this);
	}

	@Override
	public int hashCode() {
		return Objects.hash(operator, operand);
	}

	@Override
	public boolean equals(Object obj) {
		if (this == obj) {
			return true;
		}
		if (obj == null || obj.getClass() != getClass()) {
			return false;
		}
		ZUnary that = (ZUnary) obj;
		return operator == that.operator && operand.equals(that.operand);
	}
}

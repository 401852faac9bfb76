package zedtex.model.z;

import zedtex.util.SourceLocation;

import java.util.Objects;

/**
 * 
 * AST node:
 * 
 * lhs <op> rhs
 * 
 * The surface spelling of the operator is kept so the generator can tell, for example, "o9" from "comp".
 * If the source broke the line after the operator with \\, lineBreakAfter is set.
 * 
 */
public class ZBinOp extends ZExpression {
	private final String surface;
	private final ZOperator operator;
	private final ZExpression lhs;
	private final ZExpression rhs;
	private final boolean lineBreakAfter;

	public ZBinOp(SourceLocation location, String surface, ZOperator operator, ZExpression lhs, ZExpression rhs,
	              boolean lineBreakAfter) {
		super(location);
		this.surface = surface;
		this.operator = operator;
		this.lhs = lhs;
		this.rhs = rhs;
		this.lineBreakAfter = lineBreakAfter;
	}

	public String getSurface() {
		return surface;
	}

	public ZOperator getOperator() {
		return operator;
	}

	public ZExpression getLHS() {
		return lhs;
	}

	public ZExpression getRHS() {
		return rhs;
	}

	public boolean isLineBreakAfter() {
		return lineBreakAfter;
	}

	@Override
	public <T, E extends Throwable> T accept(ZExpressionVisitor<T, E> v) throws E {
		return v.visit(this);
	}

	@Override
	public int hashCode() {
		return Objects.hash(operator, lhs, rhs, lineBreakAfter);
	}

	@Override
	public boolean equals(Object obj) {
		if (this == obj) {
			return true;
		}
		if (obj == null || obj.getClass() != getClass()) {
			return false;
		}
		ZBinOp that = (ZBinOp) obj;
		return operator == that.operator && lineBreakAfter == that.lineBreakAfter && lhs.equals(that.lhs) &&
				rhs.equals(that.rhs);
	}
}

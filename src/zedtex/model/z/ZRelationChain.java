package zedtex.model.z;

import zedtex.util.SourceLocation;

import java.util.Collections;
import java.util.List;
import java.util.Objects;

/**
 * A chain of two or more comparisons sharing their middle operands, such as a < b <= c, meaning the
 * conjunction of the individual comparisons. Single comparisons are plain {@link ZBinOp}s.
 *
 * lineBreaks holds one flag per operator, set where the source broke the line with \\ at that operator.
 */
public class ZRelationChain extends ZExpression {
	private final List<ZExpression> operands;
	private final List<String> surfaces;
	private final List<ZOperator> operators;
	private final List<Boolean> lineBreaks;

	public ZRelationChain(SourceLocation location, List<ZExpression> operands, List<String> surfaces,
	                      List<ZOperator> operators) {
		this(location, operands, surfaces, operators, Collections.nCopies(operators.size(), false));
	}

	public ZRelationChain(SourceLocation location, List<ZExpression> operands, List<String> surfaces,
	                      List<ZOperator> operators, List<Boolean> lineBreaks) {
		super(location);
		if(operands.size() != operators.size() + 1 || surfaces.size() != operators.size()
				|| lineBreaks.size() != operators.size()) {
			throw new IllegalArgumentException("a relation chain needs exactly one more operand than operators");
		}
		this.operands = operands;
		this.surfaces = surfaces;
		this.operators = operators;
		this.lineBreaks = lineBreaks;
	}

	public List<ZExpression> getOperands() {
		return operands;
	}

	public List<String> getSurfaces() {
		return surfaces;
	}

	public List<ZOperator> getOperators() {
		return operators;
	}

	public boolean isLineBreakAfter(int operator) {
		return lineBreaks.get(operator);
	}

	@Override
	public <T, E extends Throwable> T accept(ZExpressionVisitor<T, E> v) throws E {
		return v.visit(this);
	}

	@Override
	public int hashCode() {
		return Objects.hash(operands, operators, lineBreaks);
	}

	@Override
	public boolean equals(Object obj) {
		if (this == obj) {
			return true;
		}
		if (obj == null || obj.getClass() != getClass()) {
			return false;
		}
		ZRelationChain that = (ZRelationChain) obj;
		return operands.equals(that.operands) && operators.equals(that.operators) && lineBreaks.equals(that.lineBreaks);
	}
}

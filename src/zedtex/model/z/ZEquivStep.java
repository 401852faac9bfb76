package zedtex.model.z;

import zedtex.util.SourceLocation;

import java.util.Objects;

/**
 * One step of an equivalence chain. The connective relates the step to the previous one: IFF unless the
 * line started with =>; it is null for the first step.
 */
public class ZEquivStep extends ZNode {
	private final ZOperator connective;
	private final ZExpression expression;
	private final String justification;

	public ZEquivStep(SourceLocation location, ZOperator connective, ZExpression expression, String justification) {
		super(location);
		this.connective = connective;
		this.expression = expression;
		this.justification = justification;
	}

	public ZOperator getConnective() {
		return connective;
	}

	public ZExpression getExpression() {
		return expression;
	}

	public String getJustification() {
		return justification;
	}

	@Override
	public int hashCode() {
		return Objects.hash(connective, expression, justification);
	}

	@Override
	public boolean equals(Object obj) {
		if (this == obj) {
			return true;
		}
		if (obj == null || obj.getClass() != getClass()) {
			return false;
		}
		ZEquivStep that = (ZEquivStep) obj;
		return connective == that.connective && expression.equals(that.expression) &&
				Objects.equals(justification, that.justification);
	}
}

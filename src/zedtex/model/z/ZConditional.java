package zedtex.model.z;

import zedtex.util.SourceLocation;

import java.util.Objects;

/**
 * if condition then a else b
 *
 * The source may break the line with \\ before then and before else; each break is recorded separately.
 */
public class ZConditional extends ZExpression {
	private final ZExpression condition;
	private final ZExpression thenBranch;
	private final ZExpression elseBranch;
	private final boolean lineBreakBeforeThen;
	private final boolean lineBreakBeforeElse;

	public ZConditional(SourceLocation location, ZExpression condition, ZExpression thenBranch, ZExpression elseBranch) {
		this(location, condition, thenBranch, elseBranch, false, false);
	}

	public ZConditional(SourceLocation location, ZExpression condition, ZExpression thenBranch, ZExpression elseBranch,
	                    boolean lineBreakBeforeThen, boolean lineBreakBeforeElse) {
		super(location);
		this.condition = condition;
		this.thenBranch = thenBranch;
		this.elseBranch = elseBranch;
		this.lineBreakBeforeThen = lineBreakBeforeThen;
		this.lineBreakBeforeElse = lineBreakBeforeElse;
	}

	public ZExpression getCondition() {
		return condition;
	}

	public ZExpression getThen() {
		return thenBranch;
	}

	public ZExpression getElse() {
		return elseBranch;
	}

	public boolean isLineBreakBeforeThen() {
		return lineBreakBeforeThen;
	}

	public boolean isLineBreakBeforeElse() {
		return lineBreakBeforeElse;
	}

	@Override
	public <T, E extends Throwable> T accept(ZExpressionVisitor<T, E> v) throws E {
		return v.visit(this);
	}

	@Override
	public int hashCode() {
		return Objects.hash(condition, thenBranch, elseBranch, lineBreakBeforeThen, lineBreakBeforeElse);
	}

	@Override
	public boolean equals(Object obj) {
		if (this == obj) {
			return true;
		}
		if (obj == null || obj.getClass() != getClass()) {
			return false;
		}
		ZConditional that = (ZConditional) obj;
		return lineBreakBeforeThen == that.lineBreakBeforeThen && lineBreakBeforeElse == that.lineBreakBeforeElse &&
				condition.equals(that.condition) && thenBranch.equals(that.thenBranch) &&
				elseBranch.equals(that.elseBranch);
	}
}

package zedtex.model.z;

import zedtex.util.SourceLocation;

import java.util.Objects;

/**
 * The image of a set through a relation, R(| S |).
 */
public class ZRelationalImage extends ZExpression {
	private final ZExpression relation;
	private final ZExpression set;

	public ZRelationalImage(SourceLocation location, ZExpression relation, ZExpression set) {
		super(location);
		this.relation = relation;
		this.set = set;
	}

	public ZExpression getRelation() {
		return relation;
	}

	public ZExpression getSet() {
		return set;
	}

	@Override
	public <T, E extends Throwable> T accept(ZExpressionVisitor<T, E> v) throws E {
		return v.visit(this);
	}

	@Override
	public int hashCode() {
		return Objects.hash(relation, set);
	}

	@Override
	public boolean equals(Object obj) {
		if (this == obj) {
			return true;
		}
		if (obj == null || obj.getClass() != getClass()) {
			return false;
		}
		ZRelationalImage that = (ZRelationalImage) obj;
		return relation.equals(that.relation) && set.equals(that.set);
	}
}

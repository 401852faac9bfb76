package zedtex.model.z;

import zedtex.util.SourceLocation;

import java.util.List;
import java.util.Objects;

/**
 * 
 * AST node:
 * 
 * { decls | predicate . result }
 * 
 * with either the predicate or the result optional.
 * 
 */
public class ZSetComprehension extends ZExpression {
	private final List<ZBindingGroup> bindings;
	private final ZExpression predicate;
	private final ZExpression result;

	public ZSetComprehension(SourceLocation location, List<ZBindingGroup> bindings, ZExpression predicate,
	                         ZExpression result) {
		super(location);
		this.bindings = bindings;
		this.predicate = predicate;
		this.result = result;
	}

	public List<ZBindingGroup> getBindings() {
		return bindings;
	}

	public ZExpression getPredicate() {
		return predicate;
	}

	public ZExpression getResult() {
		return result;
	}

	@Override
	public <T, E extends Throwable> T accept(ZExpressionVisitor<T, E> v) throws E {
		return v.visit(this);
	}

	@Override
	public int hashCode() {
		return Objects.hash(bindings, predicate, result);
	}

	@Override
	public boolean equals(Object obj) {
		if (this == obj) {
			return true;
		}
		if (obj == null || obj.getClass() != getClass()) {
			return false;
		}
		ZSetComprehension that = (ZSetComprehension) obj;
		return bindings.equals(that.bindings) && Objects.equals(predicate, that.predicate) &&
				Objects.equals(result, that.result);
	}
}

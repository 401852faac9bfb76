package zedtex.model.z;

import zedtex.util.SourceLocation;

import java.util.List;
import java.util.Objects;

/**
 * 
 * AST node for the binding constructs:
 * 
 * forall decls | predicate
 * forall decls | constraint . body
 * mu decls | predicate . result
 * lambda decls . body
 * 
 * The predicate is the part after '|', the result is the part after the bullet. At least one of them is
 * present. Groups were separated by groupSeparator (";" or ",") in the source.
 * 
 */
public class ZQuantifier extends ZExpression {

	public enum Kind {
		FORALL,
		EXISTS,
		EXISTS1,
		MU,
		LAMBDA,
	}

	private final Kind kind;
	private final List<ZBindingGroup> bindings;
	private final String groupSeparator;
	private final ZExpression predicate;
	private final ZExpression result;

	public ZQuantifier(SourceLocation location, Kind kind, List<ZBindingGroup> bindings, String groupSeparator,
	                   ZExpression predicate, ZExpression result) {
		super(location);
		if(predicate == null && result == null) {
			throw new IllegalArgumentException("a quantifier needs a predicate or a result");
		}
		this.kind = kind;
		this.bindings = bindings;
		this.groupSeparator = groupSeparator;
		this.predicate = predicate;
		this.result = result;
	}

	public Kind getKind() {
		return kind;
	}

	public List<ZBindingGroup> getBindings() {
		return bindings;
	}

	public String getGroupSeparator() {
		return groupSeparator;
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
		return Objects.hash(kind, bindings, predicate, result);
	}

	@Override
	public boolean equals(Object obj) {
		if (this == obj) {
			return true;
		}
		if (obj == null || obj.getClass() != getClass()) {
			return false;
		}
		ZQuantifier that = (ZQuantifier) obj;
		return kind == that.kind && bindings.equals(that.bindings) && Objects.equals(predicate, that.predicate) &&
				Objects.equals(result, that.result);
	}
}

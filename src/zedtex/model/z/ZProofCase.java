package zedtex.model.z;

import zedtex.util.SourceLocation;

import java.util.List;
import java.util.Objects;

/**
 * One case of a disjunction elimination, case p:, with the steps proved under that case.
 */
public class ZProofCase extends ZProofStep {
	private final ZExpression name;

	public ZProofCase(SourceLocation location, ZExpression name, List<ZProofStep> children) {
		super(location, children);
		this.name = name;
	}

	public ZExpression getName() {
		return name;
	}

	@Override
	public <T, E extends Throwable> T accept(ZProofStepVisitor<T, E> v) throws E {
		return v.visit(this);
	}

	@Override
	public int hashCode() {
		return Objects.hash(name, getChildren());
	}

	@Override
	public boolean equals(Object obj) {
		if (this == obj) {
			return true;
		}
		if (obj == null || obj.getClass() != getClass()) {
			return false;
		}
		ZProofCase that = (ZProofCase) obj;
		return name.equals(that.name) && getChildren().equals(that.getChildren());
	}
}

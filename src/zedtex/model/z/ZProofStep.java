package zedtex.model.z;

import zedtex.util.SourceLocation;

import java.util.List;

/**
 * An element of a proof tree: either a derived formula or a case of a case analysis.
 */
public abstract class ZProofStep extends ZNode {
	private final List<ZProofStep> children;

	public ZProofStep(SourceLocation location, List<ZProofStep> children) {
		super(location);
		this.children = children;
	}

	public List<ZProofStep> getChildren() {
		return children;
	}

	public abstract <T, E extends Throwable> T accept(ZProofStepVisitor<T, E> v) throws E;
}

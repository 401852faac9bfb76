package zedtex.model.z;

import zedtex.util.SourceLocation;

import java.util.Objects;

/**
 * A natural deduction proof written as an indented tree, conclusion first.
 */
public class ZProofTree extends ZDocumentItem {
	private final ZProofNode root;

	public ZProofTree(SourceLocation location, ZProofNode root) {
		super(location);
		this.root = root;
	}

	public ZProofNode getRoot() {
		return root;
	}

	@Override
	public <T, E extends Throwable> T accept(ZDocumentItemVisitor<T, E> v) throws E {
		return v.visit(this);
	}

	@Override
	public int hashCode() {
		return Objects.hash(root);
	}

	@Override
	public boolean equals(Object obj) {
		if (this == obj) {
			return true;
		}
		if (obj == null || obj.getClass() != getClass()) {
			return false;
		}
		ZProofTree that = (ZProofTree) obj;
		return root.equals(that.root);
	}
}

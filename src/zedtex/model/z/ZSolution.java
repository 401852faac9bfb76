package zedtex.model.z;

import zedtex.util.SourceLocation;

import java.util.Objects;

/**
 * A solution marker, ** Solution 3 **.
 */
public class ZSolution extends ZDocumentItem {
	private final String label;

	public ZSolution(SourceLocation location, String label) {
		super(location);
		this.label = label;
	}

	public String getLabel() {
		return label;
	}

	@Override
	public <T, E extends Throwable> T accept(ZDocumentItemVisitor<T, E> v) throws E {
		return v.visit(this);
	}

	@Override
	public int hashCode() {
		return Objects.hash(label);
	}

	@Override
	public boolean equals(Object obj) {
		if (this == obj) {
			return true;
		}
		if (obj == null || obj.getClass() != getClass()) {
			return false;
		}
		ZSolution that = (ZSolution) obj;
		return label.equals(that.label);
	}
}

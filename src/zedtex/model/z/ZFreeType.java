package zedtex.model.z;

import zedtex.util.SourceLocation;

import java.util.List;
import java.util.Objects;

/**
 * A free type, Name ::= a | b<T>.
 */
public class ZFreeType extends ZDocumentItem {
	private final String name;
	private final List<ZFreeTypeBranch> branches;

	public ZFreeType(SourceLocation location, String name, List<ZFreeTypeBranch> branches) {
		super(location);
		this.name = name;
		this.branches = branches;
	}

	public String getName() {
		return name;
	}

	public List<ZFreeTypeBranch> getBranches() {
		return branches;
	}

	@Override
	public <T, E extends Throwable> T accept(ZDocumentItemVisitor<T, E> v) throws E {
		return v.visit(this);
	}

	@Override
	public int hashCode() {
		return Objects.hash(name, branches);
	}

	@Override
	public boolean equals(Object obj) {
		if (this == obj) {
			return true;
		}
		if (obj == null || obj.getClass() != getClass()) {
			return false;
		}
		ZFreeType that = (ZFreeType) obj;
		return name.equals(that.name) && branches.equals(that.branches);
	}
}

package zedtex.model.z;

import zedtex.util.SourceLocation;

import java.util.List;
import java.util.Objects;

/**
 * A basic type declaration, given A, B.
 */
public class ZGivenType extends ZDocumentItem {
	private final List<String> names;

	public ZGivenType(SourceLocation location, List<String> names) {
		super(location);
		this.names = names;
	}

	public List<String> getNames() {
		return names;
	}

	@Override
	public <T, E extends Throwable> T accept(ZDocumentItemVisitor<T, E> v) throws E {
		return v.visit(this);
	}

	@Override
	public int hashCode() {
		return Objects.hash(names);
	}

	@Override
	public boolean equals(Object obj) {
		if (this == obj) {
			return true;
		}
		if (obj == null || obj.getClass() != getClass()) {
			return false;
		}
		ZGivenType that = (ZGivenType) obj;
		return names.equals(that.names);
	}
}

package zedtex.model.z;

import zedtex.util.SourceLocation;

import java.util.List;
import java.util.Objects;

/**
 * A zed ... end paragraph holding unboxed definitions and predicates.
 */
public class ZZedBlock extends ZDocumentItem {
	private final List<ZDocumentItem> items;

	public ZZedBlock(SourceLocation location, List<ZDocumentItem> items) {
		super(location);
		this.items = items;
	}

	public List<ZDocumentItem> getItems() {
		return items;
	}

	@Override
	public <T, E extends Throwable> T accept(ZDocumentItemVisitor<T, E> v) throws E {
		return v.visit(this);
	}

	@Override
	public int hashCode() {
		return Objects.hash(items);
	}

	@Override
	public boolean equals(Object obj) {
		if (this == obj) {
			return true;
		}
		if (obj == null || obj.getClass() != getClass()) {
			return false;
		}
		ZZedBlock that = (ZZedBlock) obj;
		return items.equals(that.items);
	}
}

package zedtex.model.z;

import zedtex.util.SourceLocation;

public class ZPageBreak extends ZDocumentItem {

	public ZPageBreak(SourceLocation location) {
		super(location);
	}

	@Override
	public <T, E extends Throwable> T accept(ZDocumentItemVisitor<T, E> v) throws E {
		return v.visit(this);
	}

	@Override
	public int hashCode() {
		return ZPageBreak.class.hashCode();
	}

	@Override
	public boolean equals(Object obj) {
		return obj != null && obj.getClass() == getClass();
	}
}

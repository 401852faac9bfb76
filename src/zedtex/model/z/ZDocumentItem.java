package zedtex.model.z;

import zedtex.util.SourceLocation;

/**
 * Base class of the document family: everything that can appear at the top level of an input document.
 */
public abstract class ZDocumentItem extends ZNode {

	public ZDocumentItem(SourceLocation location) {
		super(location);
	}

	@Override
	public String toString() {
		if(getLocation().isUnknown()) {
			return getClass().getSimpleName();
		}
		return getClass().getSimpleName() + " at line " + getLocation().getStartLine();
	}

	public abstract <T, E extends Throwable> T accept(ZDocumentItemVisitor<T, E> v) throws E;

}

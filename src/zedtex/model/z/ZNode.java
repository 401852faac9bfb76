package zedtex.model.z;

import zedtex.util.SourceLocatable;
import zedtex.util.SourceLocation;

/**
 * 
 * The base class for any node of the whiteboard AST. Nodes are immutable; equality is structural and ignores
 * source locations, so that parsed trees can be compared against trees built with {@link ZBuilder}.
 *
 */
public abstract class ZNode extends SourceLocatable {
	private final SourceLocation location;

	public ZNode(SourceLocation location) {
		this.location = location;
	}

	@Override
	public SourceLocation getLocation() {
		return location;
	}

	@Override
	public abstract int hashCode();

	@Override
	public abstract boolean equals(Object obj);

}

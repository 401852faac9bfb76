package zedtex.model.z;

import zedtex.util.SourceLocation;

import java.util.List;
import java.util.Objects;

/**
 * A TEXT: paragraph, split into prose and formulas.
 */
public class ZTextBlock extends ZDocumentItem {
	private final List<ZTextSegment> segments;

	public ZTextBlock(SourceLocation location, List<ZTextSegment> segments) {
		super(location);
		this.segments = segments;
	}

	public List<ZTextSegment> getSegments() {
		return segments;
	}

	@Override
	public <T, E extends Throwable> T accept(ZDocumentItemVisitor<T, E> v) throws E {
		return v.visit(this);
	}

	@Override
	public int hashCode() {
		return Objects.hash(segments);
	}

	@Override
	public boolean equals(Object obj) {
		if (this == obj) {
			return true;
		}
		if (obj == null || obj.getClass() != getClass()) {
			return false;
		}
		ZTextBlock that = (ZTextBlock) obj;
		return segments.equals(that.segments);
	}
}

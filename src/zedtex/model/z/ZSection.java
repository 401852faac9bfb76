package zedtex.model.z;

import zedtex.util.SourceLocation;

import java.util.Objects;

/**
 * A section header, === Title ===.
 */
public class ZSection extends ZDocumentItem {
	private final String title;

	public ZSection(SourceLocation location, String title) {
		super(location);
		this.title = title;
	}

	public String getTitle() {
		return title;
	}

	@Override
	public <T, E extends Throwable> T accept(ZDocumentItemVisitor<T, E> v) throws E {
		return v.visit(this);
	}

	@Override
	public int hashCode() {
		return Objects.hash(title);
	}

	@Override
	public boolean equals(Object obj) {
		if (this == obj) {
			return true;
		}
		if (obj == null || obj.getClass() != getClass()) {
			return false;
		}
		ZSection that = (ZSection) obj;
		return title.equals(that.title);
	}
}

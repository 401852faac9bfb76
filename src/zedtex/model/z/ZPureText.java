package zedtex.model.z;

import zedtex.util.SourceLocation;

import java.util.Objects;

/**
 * A PURETEXT: paragraph, copied with only LaTeX special characters escaped.
 */
public class ZPureText extends ZDocumentItem {
	private final String text;

	public ZPureText(SourceLocation location, String text) {
		super(location);
		this.text = text;
	}

	public String getText() {
		return text;
	}

	@Override
	public <T, E extends Throwable> T accept(ZDocumentItemVisitor<T, E> v) throws E {
		return v.visit(this);
	}

	@Override
	public int hashCode() {
		return Objects.hash(text);
	}

	@Override
	public boolean equals(Object obj) {
		if (this == obj) {
			return true;
		}
		if (obj == null || obj.getClass() != getClass()) {
			return false;
		}
		ZPureText that = (ZPureText) obj;
		return text.equals(that.text);
	}
}

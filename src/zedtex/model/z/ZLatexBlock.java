package zedtex.model.z;

import zedtex.util.SourceLocation;

import java.util.Objects;

/**
 * A LATEX: line, copied to the output unchanged.
 */
public class ZLatexBlock extends ZDocumentItem {
	private final String latex;

	public ZLatexBlock(SourceLocation location, String latex) {
		super(location);
		this.latex = latex;
	}

	public String getLatex() {
		return latex;
	}

	@Override
	public <T, E extends Throwable> T accept(ZDocumentItemVisitor<T, E> v) throws E {
		return v.visit(this);
	}

	@Override
	public int hashCode() {
		return Objects.hash(latex);
	}

	@Override
	public boolean equals(Object obj) {
		if (this == obj) {
			return true;
		}
		if (obj == null || obj.getClass() != getClass()) {
			return false;
		}
		ZLatexBlock that = (ZLatexBlock) obj;
		return latex.equals(that.latex);
	}
}

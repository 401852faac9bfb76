package zedtex.model.z;

import zedtex.util.SourceLocation;

import java.util.List;
import java.util.Objects;

/**
 * A truth table. The header cells are formulas; every data row has as many cells as the header.
 */
public class ZTruthTable extends ZDocumentItem {
	private final List<ZExpression> header;
	private final List<List<String>> rows;

	public ZTruthTable(SourceLocation location, List<ZExpression> header, List<List<String>> rows) {
		super(location);
		this.header = header;
		this.rows = rows;
	}

	public List<ZExpression> getHeader() {
		return header;
	}

	public List<List<String>> getRows() {
		return rows;
	}

	@Override
	public <T, E extends Throwable> T accept(ZDocumentItemVisitor<T, E> v) throws E {
		return v.visit(this);
	}

	@Override
	public int hashCode() {
		return Objects.hash(header, rows);
	}

	@Override
	public boolean equals(Object obj) {
		if (this == obj) {
			return true;
		}
		if (obj == null || obj.getClass() != getClass()) {
			return false;
		}
		ZTruthTable that = (ZTruthTable) obj;
		return header.equals(that.header) && rows.equals(that.rows);
	}
}

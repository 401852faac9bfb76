package zedtex.model.z;

import zedtex.util.SourceLocation;

import java.util.List;
import java.util.Objects;

/**
 * An EQUIV: or ARGUE: block: a chain of formulas, each step related to the previous one and optionally
 * justified.
 */
public class ZEquivChain extends ZDocumentItem {
	private final boolean argue;
	private final List<ZEquivStep> steps;

	public ZEquivChain(SourceLocation location, boolean argue, List<ZEquivStep> steps) {
		super(location);
		this.argue = argue;
		this.steps = steps;
	}

	/**
	 * @return true if the block was introduced with ARGUE: rather than EQUIV:
	 */
	public boolean isArgue() {
		return argue;
	}

	public List<ZEquivStep> getSteps() {
		return steps;
	}

	@Override
	public <T, E extends Throwable> T accept(ZDocumentItemVisitor<T, E> v) throws E {
		return v.visit(this);
	}

	@Override
	public int hashCode() {
		return Objects.hash(argue, steps);
	}

	@Override
	public boolean equals(Object obj) {
		if (this == obj) {
			return true;
		}
		if (obj == null || obj.getClass() != getClass()) {
			return false;
		}
		ZEquivChain that = (ZEquivChain) obj;
		return argue == that.argue && steps.equals(that.steps);
	}
}

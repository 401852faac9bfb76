package zedtex.model.z;

import zedtex.util.SourceLocation;

import java.util.Objects;

/**
 * A piece of a TEXT: paragraph: plain prose, a formula recognised in the prose, a $...$ span the author
 * delimited by hand, which is kept verbatim, or a [cite key locator] reference.
 */
public class ZTextSegment extends ZNode {

	public enum Kind {
		PROSE,
		MATH,
		RAW_MATH,
		CITATION,
	}

	private final Kind kind;
	private final String text;
	private final ZExpression math;
	private final String locator;

	private ZTextSegment(SourceLocation location, Kind kind, String text, ZExpression math, String locator) {
		super(location);
		this.kind = kind;
		this.text = text;
		this.math = math;
		this.locator = locator;
	}

	public static ZTextSegment prose(SourceLocation location, String text) {
		return new ZTextSegment(location, Kind.PROSE, text, null, null);
	}

	public static ZTextSegment math(SourceLocation location, String text, ZExpression math) {
		return new ZTextSegment(location, Kind.MATH, text, math, null);
	}

	public static ZTextSegment rawMath(SourceLocation location, String text) {
		return new ZTextSegment(location, Kind.RAW_MATH, text, null, null);
	}

	/**
	 * @param key the bibliography key
	 * @param locator where in the work, such as "p. 42" or "slide 20"; null if the whole work is cited
	 */
	public static ZTextSegment citation(SourceLocation location, String key, String locator) {
		return new ZTextSegment(location, Kind.CITATION, key, null, locator);
	}

	public Kind getKind() {
		return kind;
	}

	/**
	 * @return the source text of the segment, without the $ delimiters of raw math; the key of a citation
	 */
	public String getText() {
		return text;
	}

	/**
	 * @return the parsed formula of a MATH segment, null otherwise
	 */
	public ZExpression getMath() {
		return math;
	}

	public String getLocator() {
		return locator;
	}

	@Override
	public int hashCode() {
		return Objects.hash(kind, text, math, locator);
	}

	@Override
	public boolean equals(Object obj) {
		if (this == obj) {
			return true;
		}
		if (obj == null || obj.getClass() != getClass()) {
			return false;
		}
		ZTextSegment that = (ZTextSegment) obj;
		return kind == that.kind && text.equals(that.text) && Objects.equals(math, that.math) &&
				Objects.equals(locator, that.locator);
	}

	@Override
	public String toString() {
		return kind + "[" + text + "]";
	}
}

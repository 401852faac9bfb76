package zedtex.model.z;

import zedtex.util.SourceLocation;

import java.util.List;
import java.util.Objects;

/**
 * An abbreviation definition, [X] Name == expression.
 */
public class ZAbbreviation extends ZDocumentItem {
	private final String name;
	private final List<String> genericParameters;
	private final ZExpression body;

	public ZAbbreviation(SourceLocation location, String name, List<String> genericParameters, ZExpression body) {
		super(location);
		this.name = name;
		this.genericParameters = genericParameters;
		this.body = body;
	}

	public String getName() {
		return name;
	}

	public List<String> getGenericParameters() {
		return genericParameters;
	}

	public ZExpression getBody() {
		return body;
	}

	@Override
	public <T, E extends Throwable> T accept(ZDocumentItemVisitor<T, E> v) throws E {
		return v.visit(this);
	}

	@Override
	public int hashCode() {
		return Objects.hash(name, genericParameters, body);
	}

	@Override
	public boolean equals(Object obj) {
		if (this == obj) {
			return true;
		}
		if (obj == null || obj.getClass() != getClass()) {
			return false;
		}
		ZAbbreviation that = (ZAbbreviation) obj;
		return name.equals(that.name) && genericParameters.equals(that.genericParameters) && body.equals(that.body);
	}
}

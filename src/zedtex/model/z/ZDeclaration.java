package zedtex.model.z;

import zedtex.util.SourceLocation;

import java.util.List;
import java.util.Objects;

/**
 * A declaration in a boxed block, x, y : T. A declaration without a type includes a schema by name.
 */
public class ZDeclaration extends ZNode {
	private final List<ZIdentifier> names;
	private final ZExpression type;

	public ZDeclaration(SourceLocation location, List<ZIdentifier> names, ZExpression type) {
		super(location);
		this.names = names;
		this.type = type;
	}

	public List<ZIdentifier> getNames() {
		return names;
	}

	public ZExpression getType() {
		return type;
	}

	@Override
	public int hashCode() {
		return Objects.hash(names, type);
	}

	@Override
	public boolean equals(Object obj) {
		if (this == obj) {
			return true;
		}
		if (obj == null || obj.getClass() != getClass()) {
			return false;
		}
		ZDeclaration that = (ZDeclaration) obj;
		return names.equals(that.names) && Objects.equals(type, that.type);
	}
}

package zedtex.model.z;

import zedtex.util.SourceLocation;

import java.util.List;
import java.util.Objects;

/**
 * One group of variables bound together, as in "x, y : N". The domain is null when the group has no type.
 */
public class ZBindingGroup extends ZNode {
	private final List<ZIdentifier> names;
	private final ZExpression domain;

	public ZBindingGroup(SourceLocation location, List<ZIdentifier> names, ZExpression domain) {
		super(location);
		this.names = names;
		this.domain = domain;
	}

	public List<ZIdentifier> getNames() {
		return names;
	}

	public ZExpression getDomain() {
		return domain;
	}

	@Override
	public int hashCode() {
		return Objects.hash(names, domain);
	}

	@Override
	public boolean equals(Object obj) {
		if (this == obj) {
			return true;
		}
		if (obj == null || obj.getClass() != getClass()) {
			return false;
		}
		ZBindingGroup that = (ZBindingGroup) obj;
		return names.equals(that.names) && Objects.equals(domain, that.domain);
	}
}

package zedtex.model.z;

import zedtex.util.SourceLocation;

import java.util.List;
import java.util.Objects;

/**
 * 
 * AST node for the boxed paragraphs:
 * 
 * axdef [X]            schema Name[X]           gendef [X]
 *   declarations         declarations             declarations
 * where                where                    where
 *   predicates           predicates               predicates
 * end                  end                      end
 * 
 * Predicates are grouped: a blank line between two predicates starts a new group. The name is only present
 * for schemas.
 * 
 */
public class ZBoxedBlock extends ZDocumentItem {

	public enum Kind {
		AXDEF,
		SCHEMA,
		GENDEF,
	}

	private final Kind kind;
	private final String name;
	private final List<String> genericParameters;
	private final List<ZDeclaration> declarations;
	private final List<List<ZExpression>> predicateGroups;

	public ZBoxedBlock(SourceLocation location, Kind kind, String name, List<String> genericParameters,
	                   List<ZDeclaration> declarations, List<List<ZExpression>> predicateGroups) {
		super(location);
		this.kind = kind;
		this.name = name;
		this.genericParameters = genericParameters;
		this.declarations = declarations;
		this.predicateGroups = predicateGroups;
	}

	public Kind getKind() {
		return kind;
	}

	public String getName() {
		return name;
	}

	public List<String> getGenericParameters() {
		return genericParameters;
	}

	public List<ZDeclaration> getDeclarations() {
		return declarations;
	}

	public List<List<ZExpression>> getPredicateGroups() {
		return predicateGroups;
	}

	@Override
	public <T, E extends Throwable> T accept(ZDocumentItemVisitor<T, E> v) throws E {
		return v.visit(this);
	}

	@Override
	public int hashCode() {
		return Objects.hash(kind, name, genericParameters, declarations, predicateGroups);
	}

	@Override
	public boolean equals(Object obj) {
		if (this == obj) {
			return true;
		}
		if (obj == null || obj.getClass() != getClass()) {
			return false;
		}
		ZBoxedBlock that = (ZBoxedBlock) obj;
		return kind == that.kind && Objects.equals(name, that.name) &&
				genericParameters.equals(that.genericParameters) && declarations.equals(that.declarations) &&
				predicateGroups.equals(that.predicateGroups);
	}
}

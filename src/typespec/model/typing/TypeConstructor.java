package typespec.model.typing;

import java.util.Collections;
import java.util.List;

import typespec.util.SourceLocation;

/**
 * A base type such as `Int` (no arguments) or a generic application such as `Map<κ, List<τ>>`.
 */
public class TypeConstructor extends TypeExpr {
	private final String name;
	private final List<TypeExpr> arguments;

	public TypeConstructor(SourceLocation location, String name, List<TypeExpr> arguments) {
		super(location);
		this.name = name;
		this.arguments = Collections.unmodifiableList(arguments);
	}

	public String getName() {
		return name;
	}

	public List<TypeExpr> getArguments() {
		return arguments;
	}

	public boolean isGeneric() {
		return !arguments.isEmpty();
	}

	@Override
	public <T, E extends Throwable> T accept(TypeExprVisitor<T, E> v) throws E {
		return v.visit(this);
	}

	@Override
	public int hashCode() {
		return name.hashCode() * 17 + arguments.hashCode() * 19 + 3;
	}

	@Override
	public boolean equals(Object obj) {
		if (!(obj instanceof TypeConstructor)) {
			return false;
		}
		TypeConstructor other = (TypeConstructor) obj;
		return name.equals(other.name) && arguments.equals(other.arguments);
	}
}

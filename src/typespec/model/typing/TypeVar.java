package typespec.model.typing;

import typespec.util.SourceLocation;

/**
 * A type variable such as `τ₁`.
 */
public class TypeVar extends TypeExpr {
	private final SemanticVar variable;

	public TypeVar(SourceLocation location, SemanticVar variable) {
		super(location);
		this.variable = variable;
	}

	public SemanticVar getVariable() {
		return variable;
	}

	@Override
	public <T, E extends Throwable> T accept(TypeExprVisitor<T, E> v) throws E {
		return v.visit(this);
	}

	@Override
	public int hashCode() {
		return variable.hashCode() * 17 + 2;
	}

	@Override
	public boolean equals(Object obj) {
		if (!(obj instanceof TypeVar)) {
			return false;
		}
		return variable.equals(((TypeVar) obj).variable);
	}
}

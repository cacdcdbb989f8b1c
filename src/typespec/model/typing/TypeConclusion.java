package typespec.model.typing;

import typespec.util.SourceLocation;

/**
 * A conclusion that is just the resulting type, e.g. `τ₁ -> τ₂`.
 */
public class TypeConclusion extends Conclusion {
	private final TypeExpr type;

	public TypeConclusion(SourceLocation location, TypeExpr type) {
		super(location);
		this.type = type;
	}

	public TypeExpr getType() {
		return type;
	}

	@Override
	public <T, E extends Throwable> T accept(ConclusionVisitor<T, E> v) throws E {
		return v.visit(this);
	}

	@Override
	public int hashCode() {
		return type.hashCode() * 17 + 11;
	}

	@Override
	public boolean equals(Object obj) {
		if (!(obj instanceof TypeConclusion)) {
			return false;
		}
		return type.equals(((TypeConclusion) obj).type);
	}
}

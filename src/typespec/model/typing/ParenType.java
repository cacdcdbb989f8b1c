package typespec.model.typing;

import typespec.util.SourceLocation;

/**
 * Explicit parentheses around a type. Kept only so that printing reproduces the grouping the
 * author wrote; it carries no meaning of its own.
 */
public class ParenType extends TypeExpr {
	private final TypeExpr inner;

	public ParenType(SourceLocation location, TypeExpr inner) {
		super(location);
		this.inner = inner;
	}

	public TypeExpr getInner() {
		return inner;
	}

	@Override
	public <T, E extends Throwable> T accept(TypeExprVisitor<T, E> v) throws E {
		return v.visit(this);
	}

	@Override
	public int hashCode() {
		return inner.hashCode() * 17 + 7;
	}

	@Override
	public boolean equals(Object obj) {
		if (!(obj instanceof ParenType)) {
			return false;
		}
		return inner.equals(((ParenType) obj).inner);
	}
}

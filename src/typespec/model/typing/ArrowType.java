package typespec.model.typing;

import typespec.util.SourceLocation;

/**
 * Represents the function type `left -> right`. Arrows nest to the right.
 */
public class ArrowType extends TypeExpr {
	private final TypeExpr left;
	private final TypeExpr right;

	public ArrowType(SourceLocation location, TypeExpr left, TypeExpr right) {
		super(location);
		this.left = left;
		this.right = right;
	}

	public TypeExpr getLeft() {
		return left;
	}

	public TypeExpr getRight() {
		return right;
	}

	@Override
	public <T, E extends Throwable> T accept(TypeExprVisitor<T, E> v) throws E {
		return v.visit(this);
	}

	@Override
	public int hashCode() {
		return left.hashCode() * 17 + right.hashCode() * 19 + 5;
	}

	@Override
	public boolean equals(Object obj) {
		if (!(obj instanceof ArrowType)) {
			return false;
		}
		ArrowType other = (ArrowType) obj;
		return left.equals(other.left) && right.equals(other.right);
	}
}

package typespec.model.typing;

public abstract class TypeExprVisitor<T, E extends Throwable> {
	public abstract T visit(TypeVar typeVar) throws E;
	public abstract T visit(TypeConstructor typeConstructor) throws E;
	public abstract T visit(ArrowType arrowType) throws E;
	public abstract T visit(ParenType parenType) throws E;
}

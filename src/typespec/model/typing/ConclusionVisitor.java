package typespec.model.typing;

public abstract class ConclusionVisitor<T, E extends Throwable> {
	public abstract T visit(TypeConclusion typeConclusion) throws E;
	public abstract T visit(JudgmentConclusion judgmentConclusion) throws E;
	public abstract T visit(ContextLookupConclusion contextLookupConclusion) throws E;
}

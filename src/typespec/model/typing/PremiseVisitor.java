package typespec.model.typing;

public abstract class PremiseVisitor<T, E extends Throwable> {
	public abstract T visit(TypingJudgment typingJudgment) throws E;
	public abstract T visit(Membership membership) throws E;
	public abstract T visit(TypeRelation typeRelation) throws E;
	public abstract T visit(CustomPredicate customPredicate) throws E;
}

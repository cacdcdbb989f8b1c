package typespec.model.grammar;

public abstract class GrammarExprVisitor<T, E extends Throwable> {
	public abstract T visit(Terminal terminal) throws E;
	public abstract T visit(NonTerminal nonTerminal) throws E;
	public abstract T visit(Sequence sequence) throws E;
	public abstract T visit(Alternatives alternatives) throws E;
}

package typespec.parser;

public abstract class DeclarationBlockVisitor<T, E extends Throwable> {
	public abstract T visit(ProductionBlock productionBlock) throws E;
	public abstract T visit(TypingRuleBlock typingRuleBlock) throws E;
	public abstract T visit(CommentBlock commentBlock) throws E;
}

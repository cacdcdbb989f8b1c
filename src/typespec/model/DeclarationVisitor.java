package typespec.model;

import typespec.model.grammar.ProductionRule;
import typespec.model.typing.TypingRule;

public abstract class DeclarationVisitor<T, E extends Throwable> {
	public abstract T visit(ProductionRule productionRule) throws E;
	public abstract T visit(TypingRule typingRule) throws E;
	public abstract T visit(CommentDeclaration commentDeclaration) throws E;
}

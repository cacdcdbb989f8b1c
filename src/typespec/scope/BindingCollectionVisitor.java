package typespec.scope;

import java.util.Set;

import typespec.model.grammar.Alternatives;
import typespec.model.grammar.GrammarExprVisitor;
import typespec.model.grammar.NonTerminal;
import typespec.model.grammar.Sequence;
import typespec.model.grammar.Terminal;
import typespec.model.typing.SemanticVar;

public class BindingCollectionVisitor extends GrammarExprVisitor<Void, RuntimeException> {
	private final Set<SemanticVar> variables;

	public BindingCollectionVisitor(Set<SemanticVar> variables) {
		this.variables = variables;
	}

	@Override
	public Void visit(Terminal terminal) throws RuntimeException {
		terminal.getBinding().ifPresent(variables::add);
		return null;
	}

	@Override
	public Void visit(NonTerminal nonTerminal) throws RuntimeException {
		nonTerminal.getBinding().ifPresent(variables::add);
		return null;
	}

	@Override
	public Void visit(Sequence sequence) throws RuntimeException {
		sequence.getParts().forEach(p -> p.accept(this));
		return null;
	}

	@Override
	public Void visit(Alternatives alternatives) throws RuntimeException {
		alternatives.getAlternatives().forEach(a -> a.accept(this));
		return null;
	}
}

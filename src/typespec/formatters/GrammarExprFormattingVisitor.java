package typespec.formatters;

import java.io.IOException;
import java.util.Optional;

import typespec.model.grammar.Alternatives;
import typespec.model.grammar.GrammarExprVisitor;
import typespec.model.grammar.NonTerminal;
import typespec.model.grammar.Sequence;
import typespec.model.grammar.Terminal;
import typespec.model.typing.SemanticVar;

public class GrammarExprFormattingVisitor extends GrammarExprVisitor<Void, IOException> {
	private final IndentingWriter out;

	public GrammarExprFormattingVisitor(IndentingWriter out) {
		this.out = out;
	}

	private void writeBinding(Optional<SemanticVar> binding) throws IOException {
		if (binding.isPresent()) {
			out.write("[");
			out.write(binding.get().getName());
			out.write("]");
		}
	}

	@Override
	public Void visit(Terminal terminal) throws IOException {
		out.write(terminal.getText());
		writeBinding(terminal.getBinding());
		return null;
	}

	@Override
	public Void visit(NonTerminal nonTerminal) throws IOException {
		out.write(nonTerminal.getName());
		writeBinding(nonTerminal.getBinding());
		return null;
	}

	@Override
	public Void visit(Sequence sequence) throws IOException {
		FormattingTools.writeSeparated(out, sequence.getParts(), " ", p -> p.accept(this));
		return null;
	}

	@Override
	public Void visit(Alternatives alternatives) throws IOException {
		FormattingTools.writeSeparated(out, alternatives.getAlternatives(), " | ", a -> a.accept(this));
		return null;
	}
}

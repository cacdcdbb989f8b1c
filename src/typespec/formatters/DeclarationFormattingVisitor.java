package typespec.formatters;

import java.io.IOException;
import java.util.stream.Collectors;

import typespec.model.CommentDeclaration;
import typespec.model.DeclarationVisitor;
import typespec.model.grammar.ProductionRule;
import typespec.model.typing.Premise;
import typespec.model.typing.TypingRule;

/**
 * Prints declarations back in the spec language. Printing a parsed document and parsing the
 * result again gives an equal document.
 */
public class DeclarationFormattingVisitor extends DeclarationVisitor<Void, IOException> {
	private static final int MIN_BAR_LENGTH = 4;

	private final IndentingWriter out;

	public DeclarationFormattingVisitor(IndentingWriter out) {
		this.out = out;
	}

	@Override
	public Void visit(ProductionRule productionRule) throws IOException {
		out.write(productionRule.getName());
		if (productionRule.getTypingRuleName().isPresent()) {
			out.write("(");
			out.write(productionRule.getTypingRuleName().get());
			out.write(")");
		}
		out.write(" ::= ");
		productionRule.getRHS().accept(new GrammarExprFormattingVisitor(out));
		return null;
	}

	@Override
	public Void visit(TypingRule typingRule) throws IOException {
		String premises = typingRule.getPremises().stream()
				.map(Premise::toString)
				.collect(Collectors.joining(", "));
		String conclusion = typingRule.getConclusion().toString();
		int barLength = Math.max(MIN_BAR_LENGTH, Math.max(premises.length(), conclusion.length()));
		if (!premises.isEmpty()) {
			out.write(premises);
			out.newLine();
		}
		for (int i = 0; i < barLength; ++i) {
			out.write("-");
		}
		out.write(" (");
		out.write(typingRule.getRuleName());
		out.write(")");
		out.newLine();
		out.write(conclusion);
		return null;
	}

	@Override
	public Void visit(CommentDeclaration commentDeclaration) throws IOException {
		out.write(commentDeclaration.getText());
		return null;
	}
}

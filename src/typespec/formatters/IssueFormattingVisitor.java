package typespec.formatters;

import typespec.errors.IssueVisitor;
import typespec.errors.IssueWithContext;
import typespec.lexer.LexicalIssue;
import typespec.model.typing.SemanticVar;
import typespec.parser.*;
import typespec.trans.passes.parse.EmptyDocumentIssue;
import typespec.trans.passes.validation.*;
import typespec.util.SourceLocation;

import java.io.IOException;

public class IssueFormattingVisitor extends IssueVisitor<Void, IOException> {
	private IndentingWriter out;

	public IssueFormattingVisitor(IndentingWriter out) {
		this.out = out;
	}

	@Override
	public Void visit(IssueWithContext issueWithContext) throws IOException {
		issueWithContext.getContext().accept(new ContextFormattingVisitor(out));
		try (IndentingWriter.Indent ignored = out.indent()) {
			out.newLine();
			issueWithContext.getIssue().accept(this);
		}
		return null;
	}

	@Override
	public Void visit(LexicalIssue lexicalIssue) throws IOException {
		out.write(lexicalIssue.getKind().getDescription());
		out.write(" '");
		out.write(lexicalIssue.getText());
		out.write("'");
		return null;
	}

	private void writeSyntaxIssue(SyntaxIssue syntaxIssue) throws IOException {
		out.write(syntaxIssue.getKind().getDescription());
		if (syntaxIssue.getDetail().isPresent()) {
			out.write(": ");
			out.write(syntaxIssue.getDetail().get());
		}
		out.write(" in '");
		out.write(syntaxIssue.getFragment());
		out.write("'");
	}

	@Override
	public Void visit(TypeSyntaxIssue typeSyntaxIssue) throws IOException {
		writeSyntaxIssue(typeSyntaxIssue);
		return null;
	}

	@Override
	public Void visit(ContextSyntaxIssue contextSyntaxIssue) throws IOException {
		writeSyntaxIssue(contextSyntaxIssue);
		return null;
	}

	@Override
	public Void visit(PremiseSyntaxIssue premiseSyntaxIssue) throws IOException {
		writeSyntaxIssue(premiseSyntaxIssue);
		return null;
	}

	@Override
	public Void visit(ProductionSyntaxIssue productionSyntaxIssue) throws IOException {
		writeSyntaxIssue(productionSyntaxIssue);
		return null;
	}

	@Override
	public Void visit(RuleSyntaxIssue ruleSyntaxIssue) throws IOException {
		writeSyntaxIssue(ruleSyntaxIssue);
		return null;
	}

	@Override
	public Void visit(EmptyDocumentIssue emptyDocumentIssue) throws IOException {
		out.write("empty document: no production or typing rule found");
		return null;
	}

	@Override
	public Void visit(UnmatchedRuleNameIssue unmatchedRuleNameIssue) throws IOException {
		out.write("no production declares typing rule (");
		out.write(unmatchedRuleNameIssue.getTypingRule().getRuleName());
		out.write(")");
		return null;
	}

	@Override
	public Void visit(MissingTypingRuleIssue missingTypingRuleIssue) throws IOException {
		out.write("missing typing rule (");
		out.write(missingTypingRuleIssue.getProduction().getTypingRuleName().orElse(""));
		out.write(") for production ");
		out.write(missingTypingRuleIssue.getProduction().getName());
		return null;
	}

	@Override
	public Void visit(DuplicateTypingRuleIssue duplicateTypingRuleIssue) throws IOException {
		out.write("duplicate typing rule (");
		out.write(duplicateTypingRuleIssue.getDuplicate().getRuleName());
		out.write("), first declared at ");
		out.write(duplicateTypingRuleIssue.getFirst().getLocation().prettyString());
		return null;
	}

	@Override
	public Void visit(AmbiguousRuleNameIssue ambiguousRuleNameIssue) throws IOException {
		out.write("typing rule (");
		out.write(ambiguousRuleNameIssue.getProduction().getTypingRuleName().orElse(""));
		out.write(") claimed by more than one production: ");
		out.write(ambiguousRuleNameIssue.getProduction().getName());
		out.write(", first claimed by ");
		out.write(ambiguousRuleNameIssue.getFirst().getName());
		out.write(" at ");
		SourceLocation first = ambiguousRuleNameIssue.getFirst().getTypingRuleNameLocation();
		out.write(first.prettyString());
		return null;
	}

	private void writeVariableIssue(String description, SemanticVar variable, String ruleName) throws IOException {
		out.write(description);
		out.write(" ");
		out.write(variable.getName());
		if (ruleName != null) {
			out.write(" in typing rule (");
			out.write(ruleName);
			out.write(")");
		}
	}

	@Override
	public Void visit(UnboundVariableIssue unboundVariableIssue) throws IOException {
		writeVariableIssue("unbound variable", unboundVariableIssue.getVariable(),
				unboundVariableIssue.getRuleName().orElse(null));
		return null;
	}

	@Override
	public Void visit(InvalidVariableFormatIssue invalidVariableFormatIssue) throws IOException {
		writeVariableIssue("invalid variable", invalidVariableFormatIssue.getVariable(),
				invalidVariableFormatIssue.getRuleName().orElse(null));
		return null;
	}

	@Override
	public Void visit(DuplicateContextBindingIssue duplicateContextBindingIssue) throws IOException {
		out.write("variable ");
		out.write(duplicateContextBindingIssue.getVariable().getName());
		out.write(" bound twice in one context in typing rule (");
		out.write(duplicateContextBindingIssue.getRuleName().orElse(""));
		out.write(")");
		return null;
	}
}

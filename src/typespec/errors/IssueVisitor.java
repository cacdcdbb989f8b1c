package typespec.errors;

import typespec.lexer.LexicalIssue;
import typespec.parser.ContextSyntaxIssue;
import typespec.parser.PremiseSyntaxIssue;
import typespec.parser.ProductionSyntaxIssue;
import typespec.parser.RuleSyntaxIssue;
import typespec.parser.TypeSyntaxIssue;
import typespec.trans.passes.parse.EmptyDocumentIssue;
import typespec.trans.passes.validation.*;

public abstract class IssueVisitor<T, E extends Throwable> {
	public abstract T visit(IssueWithContext issueWithContext) throws E;
	public abstract T visit(LexicalIssue lexicalIssue) throws E;
	public abstract T visit(TypeSyntaxIssue typeSyntaxIssue) throws E;
	public abstract T visit(ContextSyntaxIssue contextSyntaxIssue) throws E;
	public abstract T visit(PremiseSyntaxIssue premiseSyntaxIssue) throws E;
	public abstract T visit(ProductionSyntaxIssue productionSyntaxIssue) throws E;
	public abstract T visit(RuleSyntaxIssue ruleSyntaxIssue) throws E;
	public abstract T visit(EmptyDocumentIssue emptyDocumentIssue) throws E;
	public abstract T visit(UnmatchedRuleNameIssue unmatchedRuleNameIssue) throws E;
	public abstract T visit(MissingTypingRuleIssue missingTypingRuleIssue) throws E;
	public abstract T visit(DuplicateTypingRuleIssue duplicateTypingRuleIssue) throws E;
	public abstract T visit(AmbiguousRuleNameIssue ambiguousRuleNameIssue) throws E;
	public abstract T visit(UnboundVariableIssue unboundVariableIssue) throws E;
	public abstract T visit(InvalidVariableFormatIssue invalidVariableFormatIssue) throws E;
	public abstract T visit(DuplicateContextBindingIssue duplicateContextBindingIssue) throws E;
}

package typespec.parser;

import typespec.errors.DiagnosticKind;
import typespec.errors.IssueVisitor;
import typespec.util.SourceLocation;

/**
 * An error in the layout of a typing rule: its bar, name or conclusion line.
 */
public class RuleSyntaxIssue extends SyntaxIssue {

	public RuleSyntaxIssue(DiagnosticKind kind, SourceLocation location, String fragment) {
		super(kind, location, fragment);
	}

	public RuleSyntaxIssue(DiagnosticKind kind, SourceLocation location, String detail, String fragment) {
		super(kind, location, detail, fragment);
	}

	@Override
	public <T, E extends Throwable> T accept(IssueVisitor<T, E> v) throws E {
		return v.visit(this);
	}
}

package typespec.parser;

import typespec.errors.DiagnosticKind;
import typespec.errors.IssueVisitor;
import typespec.util.SourceLocation;

/**
 * A premise that fits none of the premise forms, or fits one badly.
 */
public class PremiseSyntaxIssue extends SyntaxIssue {

	public PremiseSyntaxIssue(DiagnosticKind kind, SourceLocation location, String fragment) {
		super(kind, location, fragment);
	}

	public PremiseSyntaxIssue(DiagnosticKind kind, SourceLocation location, String detail, String fragment) {
		super(kind, location, detail, fragment);
	}

	@Override
	public <T, E extends Throwable> T accept(IssueVisitor<T, E> v) throws E {
		return v.visit(this);
	}
}

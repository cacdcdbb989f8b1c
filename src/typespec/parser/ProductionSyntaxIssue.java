package typespec.parser;

import typespec.errors.DiagnosticKind;
import typespec.errors.IssueVisitor;
import typespec.util.SourceLocation;

/**
 * An error in a production rule.
 */
public class ProductionSyntaxIssue extends SyntaxIssue {

	public ProductionSyntaxIssue(DiagnosticKind kind, SourceLocation location, String fragment) {
		super(kind, location, fragment);
	}

	public ProductionSyntaxIssue(DiagnosticKind kind, SourceLocation location, String detail, String fragment) {
		super(kind, location, detail, fragment);
	}

	@Override
	public <T, E extends Throwable> T accept(IssueVisitor<T, E> v) throws E {
		return v.visit(this);
	}
}

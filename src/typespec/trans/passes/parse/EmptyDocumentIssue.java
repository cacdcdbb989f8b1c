package typespec.trans.passes.parse;

import typespec.errors.DiagnosticKind;
import typespec.errors.Issue;
import typespec.errors.IssueVisitor;
import typespec.util.SourceLocation;

/**
 * The document is empty, or has no production line and no inference bar.
 */
public class EmptyDocumentIssue extends Issue {
	private final SourceLocation location;

	public EmptyDocumentIssue(SourceLocation location) {
		this.location = location;
	}

	@Override
	public DiagnosticKind getKind() {
		return DiagnosticKind.EMPTY_DOCUMENT;
	}

	@Override
	public SourceLocation getLocation() {
		return location;
	}

	@Override
	public <T, E extends Throwable> T accept(IssueVisitor<T, E> v) throws E {
		return v.visit(this);
	}
}

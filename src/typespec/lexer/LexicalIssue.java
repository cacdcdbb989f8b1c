package typespec.lexer;

import typespec.errors.DiagnosticKind;
import typespec.errors.Issue;
import typespec.errors.IssueVisitor;
import typespec.util.SourceLocation;

public class LexicalIssue extends Issue {
	private final DiagnosticKind kind;
	private final SourceLocation location;
	private final String text;

	public LexicalIssue(DiagnosticKind kind, SourceLocation location, String text) {
		this.kind = kind;
		this.location = location;
		this.text = text;
	}

	@Override
	public DiagnosticKind getKind() {
		return kind;
	}

	@Override
	public SourceLocation getLocation() {
		return location;
	}

	public String getText() {
		return text;
	}

	@Override
	public <T, E extends Throwable> T accept(IssueVisitor<T, E> v) throws E {
		return v.visit(this);
	}
}

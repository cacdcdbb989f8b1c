package typespec.errors;

import typespec.util.SourceLocation;

import java.util.Optional;

public class IssueWithContext extends Issue {
	private final Context context;
	private final Issue issue;

	public IssueWithContext(Issue issue, Context context) {
		this.issue = issue;
		this.context = context;
	}

	public Issue getIssue() {
		return issue;
	}

	public Context getContext() {
		return context;
	}

	@Override
	public DiagnosticKind getKind() {
		return issue.getKind();
	}

	@Override
	public SourceLocation getLocation() {
		return issue.getLocation();
	}

	@Override
	public Optional<String> getRuleName() {
		Optional<String> inner = issue.getRuleName();
		if (inner.isPresent()) {
			return inner;
		}
		return context.getRuleName();
	}

	@Override
	public <T, E extends Throwable> T accept(IssueVisitor<T, E> v) throws E {
		return v.visit(this);
	}
}

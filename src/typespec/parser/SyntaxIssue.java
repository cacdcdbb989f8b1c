package typespec.parser;

import java.util.Optional;

import typespec.errors.DiagnosticKind;
import typespec.errors.Issue;
import typespec.util.SourceLocation;

/**
 * A syntax error inside one declaration. The fragment is the text of the smallest piece of input
 * the parser can blame, as written.
 */
public abstract class SyntaxIssue extends Issue {
	private final DiagnosticKind kind;
	private final SourceLocation location;
	private final String detail;
	private final String fragment;

	public SyntaxIssue(DiagnosticKind kind, SourceLocation location, String fragment) {
		this(kind, location, null, fragment);
	}

	public SyntaxIssue(DiagnosticKind kind, SourceLocation location, String detail, String fragment) {
		this.kind = kind;
		this.location = location;
		this.detail = detail;
		this.fragment = fragment;
	}

	@Override
	public DiagnosticKind getKind() {
		return kind;
	}

	@Override
	public SourceLocation getLocation() {
		return location;
	}

	/**
	 * @return what exactly is wrong, when the kind alone does not say it
	 */
	public Optional<String> getDetail() {
		return Optional.ofNullable(detail);
	}

	public String getFragment() {
		return fragment;
	}
}

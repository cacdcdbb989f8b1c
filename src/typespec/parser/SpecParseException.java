package typespec.parser;

import typespec.errors.Issue;

/**
 * Aborts parsing of the current declaration. Carries the issue to report for it.
 */
@SuppressWarnings("serial")
public class SpecParseException extends Exception {
	private final Issue issue;

	public SpecParseException(Issue issue) {
		super(issue.getMessage());
		this.issue = issue;
	}

	public Issue getIssue() {
		return issue;
	}
}

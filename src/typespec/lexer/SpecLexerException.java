package typespec.lexer;

@SuppressWarnings("serial")
public class SpecLexerException extends Exception {
	private final LexicalIssue issue;

	public SpecLexerException(LexicalIssue issue) {
		super(issue.getMessage());
		this.issue = issue;
	}

	public LexicalIssue getIssue() {
		return issue;
	}
}

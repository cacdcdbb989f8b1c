package typespec.trans.passes.validation;

import java.util.Optional;

import typespec.errors.DiagnosticKind;
import typespec.errors.Issue;
import typespec.errors.IssueVisitor;
import typespec.model.typing.TypingRule;
import typespec.util.SourceLocation;

public class UnmatchedRuleNameIssue extends Issue {
	private final TypingRule typingRule;

	public UnmatchedRuleNameIssue(TypingRule typingRule) {
		this.typingRule = typingRule;
	}

	public TypingRule getTypingRule() {
		return typingRule;
	}

	@Override
	public DiagnosticKind getKind() {
		return DiagnosticKind.UNMATCHED_RULE_NAME;
	}

	@Override
	public SourceLocation getLocation() {
		return typingRule.getRuleNameLocation();
	}

	@Override
	public Optional<String> getRuleName() {
		return Optional.of(typingRule.getRuleName());
	}

	@Override
	public <T, E extends Throwable> T accept(IssueVisitor<T, E> v) throws E {
		return v.visit(this);
	}
}

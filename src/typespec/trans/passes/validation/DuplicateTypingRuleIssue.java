package typespec.trans.passes.validation;

import java.util.Optional;

import typespec.errors.DiagnosticKind;
import typespec.errors.Issue;
import typespec.errors.IssueVisitor;
import typespec.model.typing.TypingRule;
import typespec.util.SourceLocation;

public class DuplicateTypingRuleIssue extends Issue {
	private final TypingRule duplicate;
	private final TypingRule first;

	public DuplicateTypingRuleIssue(TypingRule duplicate, TypingRule first) {
		this.duplicate = duplicate;
		this.first = first;
	}

	public TypingRule getDuplicate() {
		return duplicate;
	}

	public TypingRule getFirst() {
		return first;
	}

	@Override
	public DiagnosticKind getKind() {
		return DiagnosticKind.DUPLICATE_TYPING_RULE;
	}

	@Override
	public SourceLocation getLocation() {
		return duplicate.getRuleNameLocation();
	}

	@Override
	public Optional<String> getRuleName() {
		return Optional.of(duplicate.getRuleName());
	}

	@Override
	public <T, E extends Throwable> T accept(IssueVisitor<T, E> v) throws E {
		return v.visit(this);
	}
}

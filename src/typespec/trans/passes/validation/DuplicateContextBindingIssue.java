package typespec.trans.passes.validation;

import java.util.Optional;

import typespec.errors.DiagnosticKind;
import typespec.errors.Issue;
import typespec.errors.IssueVisitor;
import typespec.model.typing.SemanticVar;
import typespec.util.SourceLocation;

public class DuplicateContextBindingIssue extends Issue {
	private final SemanticVar variable;
	private final String ruleName;

	public DuplicateContextBindingIssue(SemanticVar variable, String ruleName) {
		this.variable = variable;
		this.ruleName = ruleName;
	}

	public SemanticVar getVariable() {
		return variable;
	}

	@Override
	public DiagnosticKind getKind() {
		return DiagnosticKind.DUPLICATE_CONTEXT_BINDING;
	}

	@Override
	public SourceLocation getLocation() {
		return variable.getLocation();
	}

	@Override
	public Optional<String> getRuleName() {
		return Optional.of(ruleName);
	}

	@Override
	public <T, E extends Throwable> T accept(IssueVisitor<T, E> v) throws E {
		return v.visit(this);
	}
}

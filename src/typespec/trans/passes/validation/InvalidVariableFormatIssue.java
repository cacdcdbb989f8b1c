package typespec.trans.passes.validation;

import java.util.Optional;

import typespec.errors.DiagnosticKind;
import typespec.errors.Issue;
import typespec.errors.IssueVisitor;
import typespec.model.typing.SemanticVar;
import typespec.util.SourceLocation;

/**
 * A variable that is not one Latin or Greek letter followed by optional subscript digits.
 */
public class InvalidVariableFormatIssue extends Issue {
	private final SemanticVar variable;
	private final String ruleName;

	/**
	 * @param ruleName the typing rule the variable occurs in, or null for a production binding
	 */
	public InvalidVariableFormatIssue(SemanticVar variable, String ruleName) {
		this.variable = variable;
		this.ruleName = ruleName;
	}

	public SemanticVar getVariable() {
		return variable;
	}

	@Override
	public DiagnosticKind getKind() {
		return DiagnosticKind.INVALID_VARIABLE_FORMAT;
	}

	@Override
	public SourceLocation getLocation() {
		return variable.getLocation();
	}

	@Override
	public Optional<String> getRuleName() {
		return Optional.ofNullable(ruleName);
	}

	@Override
	public <T, E extends Throwable> T accept(IssueVisitor<T, E> v) throws E {
		return v.visit(this);
	}
}

package typespec.trans.passes.validation;

import java.util.Optional;

import typespec.errors.DiagnosticKind;
import typespec.errors.Issue;
import typespec.errors.IssueVisitor;
import typespec.model.grammar.ProductionRule;
import typespec.util.SourceLocation;

public class MissingTypingRuleIssue extends Issue {
	private final ProductionRule production;

	public MissingTypingRuleIssue(ProductionRule production) {
		this.production = production;
	}

	public ProductionRule getProduction() {
		return production;
	}

	@Override
	public DiagnosticKind getKind() {
		return DiagnosticKind.MISSING_TYPING_RULE;
	}

	@Override
	public SourceLocation getLocation() {
		return production.getTypingRuleNameLocation();
	}

	@Override
	public Optional<String> getRuleName() {
		return production.getTypingRuleName();
	}

	@Override
	public <T, E extends Throwable> T accept(IssueVisitor<T, E> v) throws E {
		return v.visit(this);
	}
}

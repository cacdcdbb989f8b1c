package typespec.trans.passes.validation;

import java.util.Optional;

import typespec.errors.DiagnosticKind;
import typespec.errors.Issue;
import typespec.errors.IssueVisitor;
import typespec.model.grammar.ProductionRule;
import typespec.util.SourceLocation;

/**
 * A production declares a typing rule name that an earlier production already declared.
 */
public class AmbiguousRuleNameIssue extends Issue {
	private final ProductionRule production;
	private final ProductionRule first;

	public AmbiguousRuleNameIssue(ProductionRule production, ProductionRule first) {
		this.production = production;
		this.first = first;
	}

	public ProductionRule getProduction() {
		return production;
	}

	public ProductionRule getFirst() {
		return first;
	}

	@Override
	public DiagnosticKind getKind() {
		return DiagnosticKind.AMBIGUOUS_RULE_NAME;
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

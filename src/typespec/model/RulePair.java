package typespec.model;

import typespec.model.grammar.ProductionRule;
import typespec.model.typing.TypingRule;

/**
 * A production together with the typing rule it names.
 */
public class RulePair {
	private final ProductionRule production;
	private final TypingRule typingRule;

	public RulePair(ProductionRule production, TypingRule typingRule) {
		this.production = production;
		this.typingRule = typingRule;
	}

	public ProductionRule getProduction() {
		return production;
	}

	public TypingRule getTypingRule() {
		return typingRule;
	}

	@Override
	public String toString() {
		return production.getName() + "(" + typingRule.getRuleName() + ")";
	}
}

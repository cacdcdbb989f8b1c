package typespec.model.typing;

import java.util.Collections;
import java.util.List;

import typespec.model.Declaration;
import typespec.model.DeclarationVisitor;
import typespec.util.SourceLocation;

/**
 * An inference rule:
 *
 * <pre>
 * premise, premise, ...
 * --------------------- (ruleName)
 * conclusion
 * </pre>
 *
 * An empty premise list makes the rule an axiom.
 */
public class TypingRule extends Declaration {
	private final String ruleName;
	private final SourceLocation ruleNameLocation;
	private final List<Premise> premises;
	private final Conclusion conclusion;

	public TypingRule(SourceLocation location, String ruleName, SourceLocation ruleNameLocation,
	                  List<Premise> premises, Conclusion conclusion) {
		super(location);
		this.ruleName = ruleName;
		this.ruleNameLocation = ruleNameLocation;
		this.premises = Collections.unmodifiableList(premises);
		this.conclusion = conclusion;
	}

	public String getRuleName() {
		return ruleName;
	}

	public SourceLocation getRuleNameLocation() {
		return ruleNameLocation;
	}

	public List<Premise> getPremises() {
		return premises;
	}

	public Conclusion getConclusion() {
		return conclusion;
	}

	public boolean isAxiom() {
		return premises.isEmpty();
	}

	@Override
	public <T, E extends Throwable> T accept(DeclarationVisitor<T, E> v) throws E {
		return v.visit(this);
	}

	@Override
	public int hashCode() {
		final int prime = 31;
		int result = 1;
		result = prime * result + ruleName.hashCode();
		result = prime * result + premises.hashCode();
		result = prime * result + conclusion.hashCode();
		return result;
	}

	@Override
	public boolean equals(Object obj) {
		if (this == obj)
			return true;
		if (obj == null || getClass() != obj.getClass())
			return false;
		TypingRule other = (TypingRule) obj;
		return ruleName.equals(other.ruleName) && premises.equals(other.premises) &&
				conclusion.equals(other.conclusion);
	}
}

package typespec.model.grammar;

import java.util.Objects;
import java.util.Optional;

import typespec.model.Declaration;
import typespec.model.DeclarationVisitor;
import typespec.util.SourceLocation;

/**
 * `Name(ruleName) ::= rhs` or `Name ::= rhs`.
 */
public class ProductionRule extends Declaration {
	private final String name;
	private final String typingRuleName;
	private final SourceLocation typingRuleNameLocation;
	private final GrammarExpr rhs;

	public ProductionRule(SourceLocation location, String name, String typingRuleName,
	                      SourceLocation typingRuleNameLocation, GrammarExpr rhs) {
		super(location);
		this.name = name;
		this.typingRuleName = typingRuleName;
		this.typingRuleNameLocation = typingRuleNameLocation;
		this.rhs = rhs;
	}

	public String getName() {
		return name;
	}

	public Optional<String> getTypingRuleName() {
		return Optional.ofNullable(typingRuleName);
	}

	/**
	 * @return where the typing rule name is written, or the production's own location if there is none
	 */
	public SourceLocation getTypingRuleNameLocation() {
		return typingRuleNameLocation == null ? getLocation() : typingRuleNameLocation;
	}

	public GrammarExpr getRHS() {
		return rhs;
	}

	@Override
	public <T, E extends Throwable> T accept(DeclarationVisitor<T, E> v) throws E {
		return v.visit(this);
	}

	@Override
	public int hashCode() {
		return Objects.hash(name, typingRuleName, rhs);
	}

	@Override
	public boolean equals(Object obj) {
		if (this == obj)
			return true;
		if (obj == null || getClass() != obj.getClass())
			return false;
		ProductionRule other = (ProductionRule) obj;
		return name.equals(other.name) && Objects.equals(typingRuleName, other.typingRuleName) &&
				rhs.equals(other.rhs);
	}
}

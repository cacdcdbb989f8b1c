package typespec.model.grammar;

import java.util.Objects;
import java.util.Optional;

import typespec.model.typing.SemanticVar;
import typespec.util.SourceLocation;

/**
 * A reference to another production, optionally bound to a semantic variable: Term[e].
 */
public class NonTerminal extends GrammarExpr {
	private final String name;
	private final SemanticVar binding;

	public NonTerminal(SourceLocation location, String name, SemanticVar binding) {
		super(location);
		this.name = name;
		this.binding = binding;
	}

	public String getName() {
		return name;
	}

	public Optional<SemanticVar> getBinding() {
		return Optional.ofNullable(binding);
	}

	@Override
	public <T, E extends Throwable> T accept(GrammarExprVisitor<T, E> v) throws E {
		return v.visit(this);
	}

	@Override
	public int hashCode() {
		return Objects.hash(name, binding);
	}

	@Override
	public boolean equals(Object obj) {
		if (this == obj)
			return true;
		if (obj == null || getClass() != obj.getClass())
			return false;
		NonTerminal other = (NonTerminal) obj;
		return name.equals(other.name) && Objects.equals(binding, other.binding);
	}
}

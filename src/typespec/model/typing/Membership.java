package typespec.model.typing;

import typespec.util.SourceLocation;

/**
 * `x ∈ Γ`: the variable is bound in the named context.
 */
public class Membership extends Premise {
	private final SemanticVar variable;
	private final ContextRef context;

	public Membership(SourceLocation location, SemanticVar variable, ContextRef context) {
		super(location);
		this.variable = variable;
		this.context = context;
	}

	public SemanticVar getVariable() {
		return variable;
	}

	public ContextRef getContext() {
		return context;
	}

	@Override
	public <T, E extends Throwable> T accept(PremiseVisitor<T, E> v) throws E {
		return v.visit(this);
	}

	@Override
	public int hashCode() {
		return variable.hashCode() * 31 + context.hashCode();
	}

	@Override
	public boolean equals(Object obj) {
		if (this == obj)
			return true;
		if (obj == null || getClass() != obj.getClass())
			return false;
		Membership other = (Membership) obj;
		return variable.equals(other.variable) && context.equals(other.context);
	}
}

package typespec.model.typing;

import typespec.util.SourceLocation;

/**
 * `Γ(x)`: the type is whatever the context binds x to.
 */
public class ContextLookupConclusion extends Conclusion {
	private final SemanticVar variable;

	public ContextLookupConclusion(SourceLocation location, SemanticVar variable) {
		super(location);
		this.variable = variable;
	}

	public SemanticVar getVariable() {
		return variable;
	}

	@Override
	public <T, E extends Throwable> T accept(ConclusionVisitor<T, E> v) throws E {
		return v.visit(this);
	}

	@Override
	public int hashCode() {
		return variable.hashCode() * 17 + 17;
	}

	@Override
	public boolean equals(Object obj) {
		if (!(obj instanceof ContextLookupConclusion)) {
			return false;
		}
		return variable.equals(((ContextLookupConclusion) obj).variable);
	}
}

package typespec.model.typing;

import java.util.Collections;
import java.util.List;
import java.util.Optional;

import typespec.model.TypeSpecNode;
import typespec.util.SourceLocation;

/**
 * A typing context: the base context Γ followed by zero or more extensions, e.g. `Γ,x:τ,y:σ`.
 */
public class TypingContext extends TypeSpecNode {
	private final List<ContextExtension> extensions;

	public TypingContext(SourceLocation location, List<ContextExtension> extensions) {
		super(location);
		this.extensions = Collections.unmodifiableList(extensions);
	}

	public List<ContextExtension> getExtensions() {
		return extensions;
	}

	/**
	 * Finds the type bound to a variable by this context's own extensions. When the same variable
	 * is extended more than once the most recent extension wins.
	 */
	public Optional<TypeExpr> lookup(SemanticVar variable) {
		for (int i = extensions.size() - 1; i >= 0; --i) {
			if (extensions.get(i).getVariable().equals(variable)) {
				return Optional.of(extensions.get(i).getType());
			}
		}
		return Optional.empty();
	}

	@Override
	public int hashCode() {
		return extensions.hashCode();
	}

	@Override
	public boolean equals(Object obj) {
		if (this == obj)
			return true;
		if (obj == null || getClass() != obj.getClass())
			return false;
		return extensions.equals(((TypingContext) obj).extensions);
	}
}

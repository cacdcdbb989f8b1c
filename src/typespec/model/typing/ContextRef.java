package typespec.model.typing;

import typespec.model.TypeSpecNode;
import typespec.util.SourceLocation;

/**
 * Names the context on the right of a membership premise: `Γ` or another context variable.
 */
public class ContextRef extends TypeSpecNode {
	public static final String BASE = "Γ";

	private final String name;

	public ContextRef(SourceLocation location, String name) {
		super(location);
		this.name = name;
	}

	public String getName() {
		return name;
	}

	public boolean isBase() {
		return BASE.equals(name);
	}

	@Override
	public int hashCode() {
		return name.hashCode();
	}

	@Override
	public boolean equals(Object obj) {
		if (this == obj)
			return true;
		if (obj == null || getClass() != obj.getClass())
			return false;
		return name.equals(((ContextRef) obj).name);
	}

	@Override
	public String toString() {
		return name;
	}
}

package typespec.model.typing;

import typespec.model.TypeSpecNode;
import typespec.util.SourceLocation;

/**
 * One `x:τ` binding appended to a typing context.
 */
public class ContextExtension extends TypeSpecNode {
	private final SemanticVar variable;
	private final TypeExpr type;

	public ContextExtension(SourceLocation location, SemanticVar variable, TypeExpr type) {
		super(location);
		this.variable = variable;
		this.type = type;
	}

	public SemanticVar getVariable() {
		return variable;
	}

	public TypeExpr getType() {
		return type;
	}

	@Override
	public int hashCode() {
		return variable.hashCode() * 31 + type.hashCode();
	}

	@Override
	public boolean equals(Object obj) {
		if (this == obj)
			return true;
		if (obj == null || getClass() != obj.getClass())
			return false;
		ContextExtension other = (ContextExtension) obj;
		return variable.equals(other.variable) && type.equals(other.type);
	}
}

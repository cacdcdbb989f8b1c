package typespec.model.typing;

import java.util.Collections;
import java.util.List;

import typespec.util.SourceLocation;

/**
 * A named side condition over variables, e.g. `fresh(x)` or `distinct(x, y)`.
 */
public class CustomPredicate extends Premise {
	private final String name;
	private final List<SemanticVar> arguments;

	public CustomPredicate(SourceLocation location, String name, List<SemanticVar> arguments) {
		super(location);
		this.name = name;
		this.arguments = Collections.unmodifiableList(arguments);
	}

	public String getName() {
		return name;
	}

	public List<SemanticVar> getArguments() {
		return arguments;
	}

	@Override
	public <T, E extends Throwable> T accept(PremiseVisitor<T, E> v) throws E {
		return v.visit(this);
	}

	@Override
	public int hashCode() {
		return name.hashCode() * 31 + arguments.hashCode();
	}

	@Override
	public boolean equals(Object obj) {
		if (this == obj)
			return true;
		if (obj == null || getClass() != obj.getClass())
			return false;
		CustomPredicate other = (CustomPredicate) obj;
		return name.equals(other.name) && arguments.equals(other.arguments);
	}
}

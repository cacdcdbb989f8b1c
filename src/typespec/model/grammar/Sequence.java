package typespec.model.grammar;

import java.util.Collections;
import java.util.List;

import typespec.util.SourceLocation;

public class Sequence extends GrammarExpr {
	private final List<GrammarExpr> parts;

	public Sequence(SourceLocation location, List<GrammarExpr> parts) {
		super(location);
		this.parts = Collections.unmodifiableList(parts);
	}

	public List<GrammarExpr> getParts() {
		return parts;
	}

	@Override
	public <T, E extends Throwable> T accept(GrammarExprVisitor<T, E> v) throws E {
		return v.visit(this);
	}

	@Override
	public int hashCode() {
		return parts.hashCode() * 17 + 1;
	}

	@Override
	public boolean equals(Object obj) {
		if (this == obj)
			return true;
		if (obj == null || getClass() != obj.getClass())
			return false;
		return parts.equals(((Sequence) obj).parts);
	}
}

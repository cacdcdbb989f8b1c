package typespec.model.grammar;

import java.util.Collections;
import java.util.List;

import typespec.util.SourceLocation;

/**
 * `a | b | c`, in the order written.
 */
public class Alternatives extends GrammarExpr {
	private final List<GrammarExpr> alternatives;

	public Alternatives(SourceLocation location, List<GrammarExpr> alternatives) {
		super(location);
		this.alternatives = Collections.unmodifiableList(alternatives);
	}

	public List<GrammarExpr> getAlternatives() {
		return alternatives;
	}

	@Override
	public <T, E extends Throwable> T accept(GrammarExprVisitor<T, E> v) throws E {
		return v.visit(this);
	}

	@Override
	public int hashCode() {
		return alternatives.hashCode() * 17 + 2;
	}

	@Override
	public boolean equals(Object obj) {
		if (this == obj)
			return true;
		if (obj == null || getClass() != obj.getClass())
			return false;
		return alternatives.equals(((Alternatives) obj).alternatives);
	}
}

package typespec.model.typing;

import typespec.util.SourceLocation;

/**
 * A relation between two types, e.g. `τ₁ = τ₂` or `σ <: τ`.
 */
public class TypeRelation extends Premise {
	private final TypeExpr lhs;
	private final String operator;
	private final TypeExpr rhs;

	public TypeRelation(SourceLocation location, TypeExpr lhs, String operator, TypeExpr rhs) {
		super(location);
		this.lhs = lhs;
		this.operator = operator;
		this.rhs = rhs;
	}

	public TypeExpr getLHS() {
		return lhs;
	}

	public String getOperator() {
		return operator;
	}

	public TypeExpr getRHS() {
		return rhs;
	}

	@Override
	public <T, E extends Throwable> T accept(PremiseVisitor<T, E> v) throws E {
		return v.visit(this);
	}

	@Override
	public int hashCode() {
		final int prime = 31;
		int result = 1;
		result = prime * result + lhs.hashCode();
		result = prime * result + operator.hashCode();
		result = prime * result + rhs.hashCode();
		return result;
	}

	@Override
	public boolean equals(Object obj) {
		if (this == obj)
			return true;
		if (obj == null || getClass() != obj.getClass())
			return false;
		TypeRelation other = (TypeRelation) obj;
		return lhs.equals(other.lhs) && operator.equals(other.operator) && rhs.equals(other.rhs);
	}
}

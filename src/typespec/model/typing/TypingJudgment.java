package typespec.model.typing;

import typespec.util.SourceLocation;

/**
 * `Γ ⊢ e : τ`: under the context, expression e has type τ.
 */
public class TypingJudgment extends Premise {
	private final TypingContext context;
	private final SemanticVar expression;
	private final TypeExpr type;

	public TypingJudgment(SourceLocation location, TypingContext context, SemanticVar expression, TypeExpr type) {
		super(location);
		this.context = context;
		this.expression = expression;
		this.type = type;
	}

	public TypingContext getContext() {
		return context;
	}

	public SemanticVar getExpression() {
		return expression;
	}

	public TypeExpr getType() {
		return type;
	}

	@Override
	public <T, E extends Throwable> T accept(PremiseVisitor<T, E> v) throws E {
		return v.visit(this);
	}

	@Override
	public int hashCode() {
		final int prime = 31;
		int result = 1;
		result = prime * result + context.hashCode();
		result = prime * result + expression.hashCode();
		result = prime * result + type.hashCode();
		return result;
	}

	@Override
	public boolean equals(Object obj) {
		if (this == obj)
			return true;
		if (obj == null || getClass() != obj.getClass())
			return false;
		TypingJudgment other = (TypingJudgment) obj;
		return context.equals(other.context) && expression.equals(other.expression) && type.equals(other.type);
	}
}

package typespec.model.typing;

import typespec.util.SourceLocation;

/**
 * A conclusion written as a full typing judgment, e.g. `Γ ⊢ e : τ`.
 */
public class JudgmentConclusion extends Conclusion {
	private final TypingJudgment judgment;

	public JudgmentConclusion(SourceLocation location, TypingJudgment judgment) {
		super(location);
		this.judgment = judgment;
	}

	public TypingJudgment getJudgment() {
		return judgment;
	}

	@Override
	public <T, E extends Throwable> T accept(ConclusionVisitor<T, E> v) throws E {
		return v.visit(this);
	}

	@Override
	public int hashCode() {
		return judgment.hashCode() * 17 + 13;
	}

	@Override
	public boolean equals(Object obj) {
		if (!(obj instanceof JudgmentConclusion)) {
			return false;
		}
		return judgment.equals(((JudgmentConclusion) obj).judgment);
	}
}

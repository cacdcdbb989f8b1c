package typespec.trans.passes.validation;

import java.util.List;

import typespec.model.typing.CustomPredicate;
import typespec.model.typing.Membership;
import typespec.model.typing.PremiseVisitor;
import typespec.model.typing.TypeRelation;
import typespec.model.typing.TypingContext;
import typespec.model.typing.TypingJudgment;

public class ContextCollectionVisitor extends PremiseVisitor<Void, RuntimeException> {
	private final List<TypingContext> contexts;

	public ContextCollectionVisitor(List<TypingContext> contexts) {
		this.contexts = contexts;
	}

	@Override
	public Void visit(TypingJudgment typingJudgment) throws RuntimeException {
		contexts.add(typingJudgment.getContext());
		return null;
	}

	@Override
	public Void visit(Membership membership) throws RuntimeException {
		// only names a context
		return null;
	}

	@Override
	public Void visit(TypeRelation typeRelation) throws RuntimeException {
		return null;
	}

	@Override
	public Void visit(CustomPredicate customPredicate) throws RuntimeException {
		return null;
	}
}

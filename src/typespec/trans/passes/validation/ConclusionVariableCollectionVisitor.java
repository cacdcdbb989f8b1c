package typespec.trans.passes.validation;

import java.util.List;

import typespec.model.typing.ConclusionVisitor;
import typespec.model.typing.ContextLookupConclusion;
import typespec.model.typing.JudgmentConclusion;
import typespec.model.typing.TypeConclusion;

public class ConclusionVariableCollectionVisitor extends ConclusionVisitor<Void, RuntimeException> {
	private final List<VariableUse> uses;

	public ConclusionVariableCollectionVisitor(List<VariableUse> uses) {
		this.uses = uses;
	}

	@Override
	public Void visit(TypeConclusion typeConclusion) throws RuntimeException {
		typeConclusion.getType().accept(new TypeVariableCollectionVisitor(uses));
		return null;
	}

	@Override
	public Void visit(JudgmentConclusion judgmentConclusion) throws RuntimeException {
		judgmentConclusion.getJudgment().accept(new PremiseVariableCollectionVisitor(uses));
		return null;
	}

	@Override
	public Void visit(ContextLookupConclusion contextLookupConclusion) throws RuntimeException {
		uses.add(new VariableUse(contextLookupConclusion.getVariable(), VariableUse.Role.EXPRESSION));
		return null;
	}
}

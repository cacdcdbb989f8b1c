package typespec.trans.passes.validation;

import java.util.List;

import typespec.model.typing.ContextExtension;
import typespec.model.typing.CustomPredicate;
import typespec.model.typing.Membership;
import typespec.model.typing.PremiseVisitor;
import typespec.model.typing.SemanticVar;
import typespec.model.typing.TypeRelation;
import typespec.model.typing.TypingJudgment;

/**
 * Lists the variable occurrences of a premise in reading order.
 */
public class PremiseVariableCollectionVisitor extends PremiseVisitor<Void, RuntimeException> {
	private final List<VariableUse> uses;

	public PremiseVariableCollectionVisitor(List<VariableUse> uses) {
		this.uses = uses;
	}

	@Override
	public Void visit(TypingJudgment typingJudgment) throws RuntimeException {
		TypeVariableCollectionVisitor types = new TypeVariableCollectionVisitor(uses);
		for (ContextExtension extension : typingJudgment.getContext().getExtensions()) {
			uses.add(new VariableUse(extension.getVariable(), VariableUse.Role.EXTENSION));
			extension.getType().accept(types);
		}
		uses.add(new VariableUse(typingJudgment.getExpression(), VariableUse.Role.EXPRESSION));
		typingJudgment.getType().accept(types);
		return null;
	}

	@Override
	public Void visit(Membership membership) throws RuntimeException {
		uses.add(new VariableUse(membership.getVariable(), VariableUse.Role.EXPRESSION));
		return null;
	}

	@Override
	public Void visit(TypeRelation typeRelation) throws RuntimeException {
		TypeVariableCollectionVisitor types = new TypeVariableCollectionVisitor(uses);
		typeRelation.getLHS().accept(types);
		typeRelation.getRHS().accept(types);
		return null;
	}

	@Override
	public Void visit(CustomPredicate customPredicate) throws RuntimeException {
		for (SemanticVar argument : customPredicate.getArguments()) {
			uses.add(new VariableUse(argument, VariableUse.Role.EXPRESSION));
		}
		return null;
	}
}

package typespec.trans.passes.validation;

import java.util.List;

import typespec.model.typing.ArrowType;
import typespec.model.typing.ParenType;
import typespec.model.typing.TypeConstructor;
import typespec.model.typing.TypeExprVisitor;
import typespec.model.typing.TypeVar;

public class TypeVariableCollectionVisitor extends TypeExprVisitor<Void, RuntimeException> {
	private final List<VariableUse> uses;

	public TypeVariableCollectionVisitor(List<VariableUse> uses) {
		this.uses = uses;
	}

	@Override
	public Void visit(TypeVar typeVar) throws RuntimeException {
		uses.add(new VariableUse(typeVar.getVariable(), VariableUse.Role.TYPE));
		return null;
	}

	@Override
	public Void visit(TypeConstructor typeConstructor) throws RuntimeException {
		typeConstructor.getArguments().forEach(a -> a.accept(this));
		return null;
	}

	@Override
	public Void visit(ArrowType arrowType) throws RuntimeException {
		arrowType.getLeft().accept(this);
		arrowType.getRight().accept(this);
		return null;
	}

	@Override
	public Void visit(ParenType parenType) throws RuntimeException {
		parenType.getInner().accept(this);
		return null;
	}
}

package typespec.formatters;

import java.io.IOException;

import typespec.model.typing.ArrowType;
import typespec.model.typing.ParenType;
import typespec.model.typing.TypeConstructor;
import typespec.model.typing.TypeExprVisitor;
import typespec.model.typing.TypeVar;

public class TypeExprFormattingVisitor extends TypeExprVisitor<Void, IOException> {
	private final IndentingWriter out;

	public TypeExprFormattingVisitor(IndentingWriter out) {
		this.out = out;
	}

	@Override
	public Void visit(TypeVar typeVar) throws IOException {
		out.write(typeVar.getVariable().getName());
		return null;
	}

	@Override
	public Void visit(TypeConstructor typeConstructor) throws IOException {
		out.write(typeConstructor.getName());
		if (typeConstructor.isGeneric()) {
			// no space: a detached '<' reads as a relation
			out.write("<");
			FormattingTools.writeCommaSeparated(out, typeConstructor.getArguments(), a -> a.accept(this));
			out.write(">");
		}
		return null;
	}

	@Override
	public Void visit(ArrowType arrowType) throws IOException {
		// arrows nest to the right, so a left operand arrow needs parentheses
		boolean wrap = arrowType.getLeft() instanceof ArrowType;
		if (wrap) {
			out.write("(");
		}
		arrowType.getLeft().accept(this);
		if (wrap) {
			out.write(")");
		}
		out.write(" -> ");
		arrowType.getRight().accept(this);
		return null;
	}

	@Override
	public Void visit(ParenType parenType) throws IOException {
		out.write("(");
		parenType.getInner().accept(this);
		out.write(")");
		return null;
	}
}

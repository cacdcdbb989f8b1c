package typespec.formatters;

import java.io.IOException;

import typespec.model.typing.ContextExtension;
import typespec.model.typing.ContextRef;
import typespec.model.typing.CustomPredicate;
import typespec.model.typing.Membership;
import typespec.model.typing.PremiseVisitor;
import typespec.model.typing.TypeRelation;
import typespec.model.typing.TypingContext;
import typespec.model.typing.TypingJudgment;

public class PremiseFormattingVisitor extends PremiseVisitor<Void, IOException> {
	private final IndentingWriter out;

	public PremiseFormattingVisitor(IndentingWriter out) {
		this.out = out;
	}

	public void writeContext(TypingContext context) throws IOException {
		out.write(ContextRef.BASE);
		for (ContextExtension extension : context.getExtensions()) {
			out.write(", ");
			out.write(extension.getVariable().getName());
			out.write(":");
			extension.getType().accept(new TypeExprFormattingVisitor(out));
		}
	}

	@Override
	public Void visit(TypingJudgment typingJudgment) throws IOException {
		writeContext(typingJudgment.getContext());
		out.write(" ⊢ ");
		out.write(typingJudgment.getExpression().getName());
		out.write(" : ");
		typingJudgment.getType().accept(new TypeExprFormattingVisitor(out));
		return null;
	}

	@Override
	public Void visit(Membership membership) throws IOException {
		out.write(membership.getVariable().getName());
		out.write(" ∈ ");
		out.write(membership.getContext().getName());
		return null;
	}

	@Override
	public Void visit(TypeRelation typeRelation) throws IOException {
		typeRelation.getLHS().accept(new TypeExprFormattingVisitor(out));
		out.write(" ");
		out.write(typeRelation.getOperator());
		out.write(" ");
		typeRelation.getRHS().accept(new TypeExprFormattingVisitor(out));
		return null;
	}

	@Override
	public Void visit(CustomPredicate customPredicate) throws IOException {
		out.write(customPredicate.getName());
		out.write("(");
		FormattingTools.writeCommaSeparated(out, customPredicate.getArguments(), a -> out.write(a.getName()));
		out.write(")");
		return null;
	}
}

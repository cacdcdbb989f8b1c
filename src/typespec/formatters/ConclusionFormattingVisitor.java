package typespec.formatters;

import java.io.IOException;

import typespec.model.typing.ConclusionVisitor;
import typespec.model.typing.ContextLookupConclusion;
import typespec.model.typing.ContextRef;
import typespec.model.typing.JudgmentConclusion;
import typespec.model.typing.TypeConclusion;

public class ConclusionFormattingVisitor extends ConclusionVisitor<Void, IOException> {
	private final IndentingWriter out;

	public ConclusionFormattingVisitor(IndentingWriter out) {
		this.out = out;
	}

	@Override
	public Void visit(TypeConclusion typeConclusion) throws IOException {
		typeConclusion.getType().accept(new TypeExprFormattingVisitor(out));
		return null;
	}

	@Override
	public Void visit(JudgmentConclusion judgmentConclusion) throws IOException {
		judgmentConclusion.getJudgment().accept(new PremiseFormattingVisitor(out));
		return null;
	}

	@Override
	public Void visit(ContextLookupConclusion contextLookupConclusion) throws IOException {
		out.write(ContextRef.BASE);
		out.write("(");
		out.write(contextLookupConclusion.getVariable().getName());
		out.write(")");
		return null;
	}
}

package typespec.formatters;

import typespec.errors.ContextVisitor;
import typespec.trans.passes.parse.WhileParsingProduction;
import typespec.trans.passes.parse.WhileParsingTypingRule;

import java.io.IOException;

public class ContextFormattingVisitor extends ContextVisitor<Void, IOException> {

	private IndentingWriter out;

	public ContextFormattingVisitor(IndentingWriter out) {
		this.out = out;
	}

	@Override
	public Void visit(WhileParsingProduction whileParsingProduction) throws IOException {
		out.write("while parsing production ");
		if (whileParsingProduction.getRuleName().isPresent()) {
			out.write("(");
			out.write(whileParsingProduction.getRuleName().get());
			out.write(") ");
		}
		out.write("at line ");
		out.write(Integer.toString(whileParsingProduction.getLocation().getStartLine()));
		out.write(" column ");
		out.write(Integer.toString(whileParsingProduction.getLocation().getStartColumn()));
		return null;
	}

	@Override
	public Void visit(WhileParsingTypingRule whileParsingTypingRule) throws IOException {
		out.write("while parsing typing rule ");
		if (whileParsingTypingRule.getRuleName().isPresent()) {
			out.write("(");
			out.write(whileParsingTypingRule.getRuleName().get());
			out.write(") ");
		}
		out.write("at line ");
		out.write(Integer.toString(whileParsingTypingRule.getLocation().getStartLine()));
		out.write(" column ");
		out.write(Integer.toString(whileParsingTypingRule.getLocation().getStartColumn()));
		return null;
	}

}

package typespec.errors;

import typespec.trans.passes.parse.WhileParsingProduction;
import typespec.trans.passes.parse.WhileParsingTypingRule;

public abstract class ContextVisitor<T, E extends Throwable> {

	public abstract T visit(WhileParsingProduction whileParsingProduction) throws E;
	public abstract T visit(WhileParsingTypingRule whileParsingTypingRule) throws E;

}

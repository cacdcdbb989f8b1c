package typespec.model.grammar;

import java.io.IOException;
import java.io.StringWriter;

import typespec.InternalCheckerError;
import typespec.formatters.GrammarExprFormattingVisitor;
import typespec.formatters.IndentingWriter;
import typespec.model.TypeSpecNode;
import typespec.util.SourceLocation;

/**
 * A node of a production's right-hand side.
 */
public abstract class GrammarExpr extends TypeSpecNode {

	public GrammarExpr(SourceLocation location) {
		super(location);
	}

	@Override
	public String toString() {
		StringWriter writer = new StringWriter();
		try {
			accept(new GrammarExprFormattingVisitor(new IndentingWriter(writer)));
		} catch (IOException e) {
			throw new InternalCheckerError("string writers should not throw IO errors", e);
		}
		return writer.toString();
	}

	public abstract <T, E extends Throwable> T accept(GrammarExprVisitor<T, E> v) throws E;
}

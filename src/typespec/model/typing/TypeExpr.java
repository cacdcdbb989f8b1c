package typespec.model.typing;

import java.io.IOException;
import java.io.StringWriter;

import typespec.InternalCheckerError;
import typespec.formatters.IndentingWriter;
import typespec.formatters.TypeExprFormattingVisitor;
import typespec.model.TypeSpecNode;
import typespec.util.SourceLocation;

public abstract class TypeExpr extends TypeSpecNode {

	public TypeExpr(SourceLocation location) {
		super(location);
	}

	@Override
	public String toString() {
		StringWriter writer = new StringWriter();
		try {
			accept(new TypeExprFormattingVisitor(new IndentingWriter(writer)));
		} catch (IOException e) {
			throw new InternalCheckerError("string writers should not throw IO errors", e);
		}
		return writer.toString();
	}

	public abstract <T, E extends Throwable> T accept(TypeExprVisitor<T, E> v) throws E;
}

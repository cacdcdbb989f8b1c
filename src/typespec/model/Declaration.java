package typespec.model;

import java.io.IOException;
import java.io.StringWriter;

import typespec.InternalCheckerError;
import typespec.formatters.DeclarationFormattingVisitor;
import typespec.formatters.IndentingWriter;
import typespec.util.SourceLocation;

/**
 * A top-level item of a spec document: a production, a typing rule or a comment.
 */
public abstract class Declaration extends TypeSpecNode {

	public Declaration(SourceLocation location) {
		super(location);
	}

	@Override
	public String toString() {
		StringWriter writer = new StringWriter();
		try {
			accept(new DeclarationFormattingVisitor(new IndentingWriter(writer)));
		} catch (IOException e) {
			throw new InternalCheckerError("string writers should not throw IO errors", e);
		}
		return writer.toString();
	}

	public abstract <T, E extends Throwable> T accept(DeclarationVisitor<T, E> v) throws E;

}

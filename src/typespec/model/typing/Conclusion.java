package typespec.model.typing;

import java.io.IOException;
import java.io.StringWriter;

import typespec.InternalCheckerError;
import typespec.formatters.ConclusionFormattingVisitor;
import typespec.formatters.IndentingWriter;
import typespec.model.TypeSpecNode;
import typespec.util.SourceLocation;

/**
 * What a typing rule establishes below its bar.
 */
public abstract class Conclusion extends TypeSpecNode {

	public Conclusion(SourceLocation location) {
		super(location);
	}

	@Override
	public String toString() {
		StringWriter writer = new StringWriter();
		try {
			accept(new ConclusionFormattingVisitor(new IndentingWriter(writer)));
		} catch (IOException e) {
			throw new InternalCheckerError("string writers should not throw IO errors", e);
		}
		return writer.toString();
	}

	public abstract <T, E extends Throwable> T accept(ConclusionVisitor<T, E> v) throws E;
}

package typespec.model.typing;

import java.io.IOException;
import java.io.StringWriter;

import typespec.InternalCheckerError;
import typespec.formatters.IndentingWriter;
import typespec.formatters.PremiseFormattingVisitor;
import typespec.model.TypeSpecNode;
import typespec.util.SourceLocation;

/**
 * One condition above the inference bar. The four kinds are a closed set; see {@link PremiseVisitor}.
 */
public abstract class Premise extends TypeSpecNode {

	public Premise(SourceLocation location) {
		super(location);
	}

	@Override
	public String toString() {
		StringWriter writer = new StringWriter();
		try {
			accept(new PremiseFormattingVisitor(new IndentingWriter(writer)));
		} catch (IOException e) {
			throw new InternalCheckerError("string writers should not throw IO errors", e);
		}
		return writer.toString();
	}

	public abstract <T, E extends Throwable> T accept(PremiseVisitor<T, E> v) throws E;
}

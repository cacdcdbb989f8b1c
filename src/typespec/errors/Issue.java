package typespec.errors;

import typespec.InternalCheckerError;
import typespec.TypeSpecException;
import typespec.formatters.IndentingWriter;
import typespec.formatters.IssueFormattingVisitor;
import typespec.util.SourceLocation;

import java.io.IOException;
import java.io.StringWriter;
import java.util.Optional;

public abstract class Issue extends TypeSpecException {
	public Issue() {
		super("", "");
	}

	@Override
	public String getMessage() {
		StringWriter sw = new StringWriter();
		IndentingWriter out = new IndentingWriter(sw);
		try {
			accept(new IssueFormattingVisitor(out));
		} catch (IOException e) {
			throw new InternalCheckerError("string writers should not throw IO errors", e);
		}
		return sw.getBuffer().toString();
	}

	public Issue withContext(Context ctx) {
		return new IssueWithContext(this, ctx);
	}

	public abstract DiagnosticKind getKind();

	public abstract SourceLocation getLocation();

	/**
	 * @return the name of the typing rule this issue is about, if there is one
	 */
	public Optional<String> getRuleName() {
		return Optional.empty();
	}

	public abstract <T, E extends Throwable> T accept(IssueVisitor<T, E> v) throws E;

}

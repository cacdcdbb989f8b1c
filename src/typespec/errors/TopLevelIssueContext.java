package typespec.errors;

import java.io.IOException;
import java.io.StringWriter;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.stream.Collectors;

import typespec.InternalCheckerError;
import typespec.formatters.IndentingWriter;

public class TopLevelIssueContext extends IssueContext {

	private final List<Issue> errors;

	public TopLevelIssueContext() {
		this.errors = new ArrayList<>();
	}

	@Override
	public synchronized void error(Issue err) {
		errors.add(err);
	}

	@Override
	public synchronized boolean hasErrors() {
		return !errors.isEmpty();
	}

	public synchronized List<Issue> getIssues() {
		return Collections.unmodifiableList(new ArrayList<>(errors));
	}

	/**
	 * @return one diagnostic per recorded issue, in (line, column, kind, message) order
	 */
	public List<Diagnostic> getDiagnostics() {
		return getIssues().stream()
				.map(Diagnostic::fromIssue)
				.sorted()
				.collect(Collectors.toList());
	}

	public void format(IndentingWriter out) throws IOException {
		List<Diagnostic> diagnostics = getDiagnostics();
		out.write("Detected ");
		out.write(Integer.toString(diagnostics.size()));
		out.write(" issue(s):");
		try (IndentingWriter.Indent ignored = out.indent()) {
			for (Diagnostic d : diagnostics) {
				out.newLine();
				out.write(d.getMessage());
			}
		}
	}

	public String format() {
		StringWriter w = new StringWriter();
		IndentingWriter out = new IndentingWriter(w);
		try {
			format(out);
		} catch (IOException e) {
			throw new InternalCheckerError("StringWriter should not throw IOException", e);
		}
		return w.toString();
	}
}

package typespec.errors;

import java.util.Comparator;
import java.util.Objects;
import java.util.Optional;

import typespec.util.SourceLocation;

/**
 * The externally visible, immutable rendering of an {@link Issue}.
 */
public final class Diagnostic implements Comparable<Diagnostic> {

	private static final Comparator<Diagnostic> ORDER = Comparator
			.comparingInt(Diagnostic::getLine)
			.thenComparingInt(Diagnostic::getColumn)
			.thenComparing(Diagnostic::getKind)
			.thenComparing(Diagnostic::getMessage);

	private final DiagnosticKind kind;
	private final String message;
	private final int line;
	private final int column;
	private final String ruleName;

	public Diagnostic(DiagnosticKind kind, String message, int line, int column, Optional<String> ruleName) {
		this.kind = kind;
		this.message = message;
		this.line = line;
		this.column = column;
		this.ruleName = ruleName.orElse(null);
	}

	/**
	 * Renders an issue on one line. Contexts only contribute their rule name; the message is the
	 * innermost issue's.
	 */
	public static Diagnostic fromIssue(Issue issue) {
		SourceLocation location = issue.getLocation();
		Issue innermost = issue;
		while (innermost instanceof IssueWithContext) {
			innermost = ((IssueWithContext) innermost).getIssue();
		}
		return new Diagnostic(
				issue.getKind(),
				location.prettyString() + ": " + innermost.getMessage(),
				location.isUnknown() ? 0 : location.getStartLine(),
				location.isUnknown() ? 0 : location.getStartColumn(),
				issue.getRuleName());
	}

	public DiagnosticKind getKind() {
		return kind;
	}

	public String getMessage() {
		return message;
	}

	public int getLine() {
		return line;
	}

	public int getColumn() {
		return column;
	}

	public Optional<String> getRuleName() {
		return Optional.ofNullable(ruleName);
	}

	@Override
	public int compareTo(Diagnostic o) {
		return ORDER.compare(this, o);
	}

	@Override
	public boolean equals(Object o) {
		if (this == o) return true;
		if (o == null || getClass() != o.getClass()) return false;
		Diagnostic that = (Diagnostic) o;
		return line == that.line &&
				column == that.column &&
				kind == that.kind &&
				Objects.equals(message, that.message) &&
				Objects.equals(ruleName, that.ruleName);
	}

	@Override
	public int hashCode() {
		return Objects.hash(kind, message, line, column, ruleName);
	}

	@Override
	public String toString() {
		return message;
	}
}

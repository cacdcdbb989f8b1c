package typespec;

import java.util.Collections;
import java.util.List;
import java.util.Optional;

import typespec.errors.Diagnostic;
import typespec.errors.Issue;
import typespec.model.ValidatedDocument;

/**
 * Either a validated document or the issues that kept the document from validating, never both.
 */
public final class ValidationResult {
	private final ValidatedDocument document;
	private final List<Issue> issues;
	private final List<Diagnostic> diagnostics;

	private ValidationResult(ValidatedDocument document, List<Issue> issues, List<Diagnostic> diagnostics) {
		this.document = document;
		this.issues = issues;
		this.diagnostics = diagnostics;
	}

	public static ValidationResult valid(ValidatedDocument document) {
		return new ValidationResult(document, Collections.emptyList(), Collections.emptyList());
	}

	public static ValidationResult invalid(List<Issue> issues, List<Diagnostic> diagnostics) {
		if (diagnostics.isEmpty()) {
			throw new InternalCheckerError("an invalid result needs at least one diagnostic");
		}
		return new ValidationResult(null, Collections.unmodifiableList(issues),
				Collections.unmodifiableList(diagnostics));
	}

	public boolean isValid() {
		return document != null;
	}

	public Optional<ValidatedDocument> getDocument() {
		return Optional.ofNullable(document);
	}

	/**
	 * @return the diagnostics in (line, column, kind, message) order; empty when valid
	 */
	public List<Diagnostic> getDiagnostics() {
		return diagnostics;
	}

	/**
	 * @return the recorded issues with their parsing contexts, in the order they were found
	 */
	public List<Issue> getIssues() {
		return issues;
	}
}

package typespec;

import java.util.Optional;
import java.util.Set;
import java.util.logging.Logger;
import java.util.stream.Collectors;

import typespec.errors.Issue;
import typespec.errors.TopLevelIssueContext;
import typespec.model.Document;
import typespec.model.ValidatedDocument;
import typespec.trans.passes.parse.SpecParsingPass;
import typespec.trans.passes.validation.BindingValidationPass;

/**
 * Parses and validates a whole document in two phases: every declaration is parsed first, and only
 * then are typing rules matched against productions.
 */
public class TypeSpecChecker {
	private TypeSpecChecker() {}

	private static final Logger logger = Logger.getLogger(TypeSpecChecker.class.getName());

	public static ValidationResult parseAndValidate(String text) {
		return parseAndValidate(text, ValidationPolicy.defaults());
	}

	public static ValidationResult parseAndValidate(String text, ValidationPolicy policy) {
		TopLevelIssueContext ctx = new TopLevelIssueContext();

		logger.fine("parsing declarations with policy " + policy);
		Optional<Document> document = SpecParsingPass.perform(ctx, text, policy.isParallel());
		if (!document.isPresent()) {
			return ValidationResult.invalid(ctx.getIssues(), ctx.getDiagnostics());
		}

		Set<String> unparsedRuleNames = ctx.getIssues().stream()
				.map(Issue::getRuleName)
				.filter(Optional::isPresent)
				.map(Optional::get)
				.collect(Collectors.toSet());
		logger.fine("validating bindings");
		ValidatedDocument validated = BindingValidationPass.perform(ctx, document.get(), policy, unparsedRuleNames);
		if (ctx.hasErrors()) {
			return ValidationResult.invalid(ctx.getIssues(), ctx.getDiagnostics());
		}
		return ValidationResult.valid(validated);
	}
}

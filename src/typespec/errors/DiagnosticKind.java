package typespec.errors;

/**
 * Every kind of problem the checker can report. Declaration order is significant: it is the
 * tie-breaker when two diagnostics start at the same line and column.
 */
public enum DiagnosticKind {
	// lexical
	UNRECOGNIZED_CHARACTER(Category.LEXICAL, "unrecognized character"),
	UNTERMINATED_LITERAL(Category.LEXICAL, "unterminated literal"),

	// type expressions
	MISSING_ARROW_OPERAND(Category.SYNTACTIC, "missing arrow operand"),
	UNBALANCED_GENERIC(Category.SYNTACTIC, "unbalanced generic brackets"),
	EMPTY_GENERIC_ARGS(Category.SYNTACTIC, "empty generic argument list"),
	INVALID_CONSTRUCTOR_CASE(Category.SYNTACTIC, "type constructor must start with an uppercase letter"),
	MALFORMED_TYPE(Category.SYNTACTIC, "malformed type expression"),

	// contexts
	MISSING_BASE(Category.SYNTACTIC, "context must start with Γ"),
	MALFORMED_EXTENSION(Category.SYNTACTIC, "malformed context extension"),

	// premises
	MULTIPLE_JUDGMENT_SYMBOLS(Category.SYNTACTIC, "typing judgment needs exactly one ⊢ and one :"),
	MALFORMED_JUDGMENT(Category.SYNTACTIC, "malformed typing judgment"),
	INVALID_MEMBERSHIP_ARITY(Category.SYNTACTIC, "membership needs exactly one variable"),
	MULTIPLE_RELATION_SYMBOLS(Category.SYNTACTIC, "more than one relation symbol"),
	AMBIGUOUS_WITH_JUDGMENT(Category.SYNTACTIC, "type relation may not contain ⊢"),
	INVALID_PREDICATE_NAME(Category.SYNTACTIC, "invalid predicate name"),
	INVALID_PREDICATE_ARGUMENT(Category.SYNTACTIC, "predicate argument is not a variable"),
	UNRECOGNIZED_PREMISE_FORM(Category.SYNTACTIC, "unrecognized premise"),

	// productions
	DUPLICATE_BINDING(Category.SYNTACTIC, "variable bound twice"),
	MALFORMED_PRODUCTION(Category.SYNTACTIC, "malformed production"),

	// typing rules
	MISSING_BAR(Category.SYNTACTIC, "missing inference bar"),
	MISSING_RULE_NAME(Category.SYNTACTIC, "missing rule name after inference bar"),
	EMPTY_CONCLUSION(Category.SYNTACTIC, "missing conclusion"),

	// binding
	UNMATCHED_RULE_NAME(Category.BINDING, "no production declares typing rule"),
	MISSING_TYPING_RULE(Category.BINDING, "missing typing rule"),
	DUPLICATE_TYPING_RULE(Category.BINDING, "duplicate typing rule"),
	AMBIGUOUS_RULE_NAME(Category.BINDING, "typing rule claimed by more than one production"),
	UNBOUND_VARIABLE(Category.BINDING, "unbound variable"),
	INVALID_VARIABLE_FORMAT(Category.BINDING, "invalid variable"),
	DUPLICATE_CONTEXT_BINDING(Category.BINDING, "variable bound twice in one context"),

	// whole document
	EMPTY_DOCUMENT(Category.DOCUMENT, "no declarations found");

	public enum Category {
		LEXICAL,
		SYNTACTIC,
		BINDING,
		DOCUMENT,
	}

	private final Category category;
	private final String description;

	DiagnosticKind(Category category, String description) {
		this.category = category;
		this.description = description;
	}

	public Category getCategory() {
		return category;
	}

	public String getDescription() {
		return description;
	}
}

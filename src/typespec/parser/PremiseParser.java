package typespec.parser;

import java.util.ArrayList;
import java.util.List;
import java.util.regex.Pattern;

import typespec.errors.DiagnosticKind;
import typespec.lexer.SpecToken;
import typespec.lexer.SpecTokenType;
import typespec.model.typing.ContextRef;
import typespec.model.typing.CustomPredicate;
import typespec.model.typing.Membership;
import typespec.model.typing.Premise;
import typespec.model.typing.SemanticVar;
import typespec.model.typing.TypeExpr;
import typespec.model.typing.TypeRelation;
import typespec.model.typing.TypingContext;
import typespec.model.typing.TypingJudgment;
import typespec.util.SourceLocation;

/**
 * Classifies one premise fragment and parses it. The forms are tried in this order, and the first
 * one whose shape matches decides how the fragment is parsed:
 *
 * <ol>
 *     <li>anything containing `⊢` is a typing judgment `Γ,x:τ ⊢ e : σ`</li>
 *     <li>`x ∈ Γ` is a membership</li>
 *     <li>`τ op σ` with a relation symbol is a type relation</li>
 *     <li>`name(x, y)` is a custom predicate</li>
 * </ol>
 */
public final class PremiseParser {
	private PremiseParser() {}

	private static final Pattern PREDICATE_NAME = Pattern.compile("[a-zA-Z]+");

	public static Premise parsePremise(List<SpecToken> tokens, SourceLocation fragmentLocation)
			throws SpecParseException {
		SourceLocation location = ParseTools.span(tokens, fragmentLocation);
		if (ParseTools.count(tokens, SpecTokenType.TURNSTILE) > 0) {
			return parseJudgment(tokens, location);
		}
		List<Integer> relations = relationSymbols(tokens);
		if (relations.size() == 1 && tokens.get(relations.get(0)).is(SpecTokenType.IN)) {
			List<SpecToken> rhs = tokens.subList(relations.get(0) + 1, tokens.size());
			if (rhs.size() == 1 && (rhs.get(0).is(SpecTokenType.CONTEXT) || rhs.get(0).is(SpecTokenType.NAME))) {
				return readMembership(tokens, relations.get(0), location);
			}
		}
		if (!relations.isEmpty()) {
			return parseTypeRelation(tokens, location);
		}
		if (looksLikePredicate(tokens)) {
			return readPredicate(tokens, location);
		}
		throw error(DiagnosticKind.UNRECOGNIZED_PREMISE_FORM, location, tokens);
	}

	/**
	 * Parses `Γ,x:τ ⊢ e : σ`. Also used for judgment-shaped conclusions.
	 */
	public static TypingJudgment parseJudgment(List<SpecToken> tokens, SourceLocation fragmentLocation)
			throws SpecParseException {
		SourceLocation location = ParseTools.span(tokens, fragmentLocation);
		int turnstile = ParseTools.indexOf(tokens, SpecTokenType.TURNSTILE, 0);
		if (turnstile == -1 || ParseTools.count(tokens, SpecTokenType.TURNSTILE) != 1) {
			throw error(DiagnosticKind.MULTIPLE_JUDGMENT_SYMBOLS, location, tokens);
		}
		List<SpecToken> afterTurnstile = tokens.subList(turnstile + 1, tokens.size());
		int colon = ParseTools.indexOf(afterTurnstile, SpecTokenType.COLON, 0);
		if (colon == -1 || ParseTools.count(afterTurnstile, SpecTokenType.COLON) != 1) {
			throw error(DiagnosticKind.MULTIPLE_JUDGMENT_SYMBOLS, location, tokens);
		}

		TypingContext context = ContextParser.parseContext(tokens.subList(0, turnstile),
				tokens.get(turnstile).getLocation());

		List<SpecToken> expression = afterTurnstile.subList(0, colon);
		if (expression.size() != 1 || !expression.get(0).is(SpecTokenType.NAME)) {
			throw new SpecParseException(new PremiseSyntaxIssue(DiagnosticKind.MALFORMED_JUDGMENT,
					ParseTools.span(expression, afterTurnstile.get(colon).getLocation()),
					"expected a single variable between ⊢ and :", ParseTools.render(tokens)));
		}
		List<SpecToken> type = afterTurnstile.subList(colon + 1, afterTurnstile.size());
		if (type.isEmpty()) {
			throw new SpecParseException(new PremiseSyntaxIssue(DiagnosticKind.MALFORMED_JUDGMENT,
					afterTurnstile.get(colon).getLocation(),
					"expected a type after :", ParseTools.render(tokens)));
		}
		SpecToken e = expression.get(0);
		return new TypingJudgment(location, context, new SemanticVar(e.getLocation(), e.getValue()),
				TypeExprParser.parseType(type, location));
	}

	/**
	 * Parses `τ op σ`. Rejects anything containing `⊢`, which would be ambiguous with a judgment.
	 */
	public static TypeRelation parseTypeRelation(List<SpecToken> tokens, SourceLocation fragmentLocation)
			throws SpecParseException {
		SourceLocation location = ParseTools.span(tokens, fragmentLocation);
		int turnstile = ParseTools.indexOf(tokens, SpecTokenType.TURNSTILE, 0);
		if (turnstile != -1) {
			throw new SpecParseException(new PremiseSyntaxIssue(DiagnosticKind.AMBIGUOUS_WITH_JUDGMENT,
					tokens.get(turnstile).getLocation(), ParseTools.render(tokens)));
		}
		List<Integer> relations = relationSymbols(tokens);
		if (relations.size() > 1) {
			throw new SpecParseException(new PremiseSyntaxIssue(DiagnosticKind.MULTIPLE_RELATION_SYMBOLS,
					tokens.get(relations.get(1)).getLocation(), ParseTools.render(tokens)));
		}
		if (relations.isEmpty()) {
			throw error(DiagnosticKind.UNRECOGNIZED_PREMISE_FORM, location, tokens);
		}
		int op = relations.get(0);
		SpecToken operator = tokens.get(op);
		TypeExpr lhs = TypeExprParser.parseType(tokens.subList(0, op), operator.getLocation());
		TypeExpr rhs = TypeExprParser.parseType(tokens.subList(op + 1, tokens.size()), operator.getLocation());
		return new TypeRelation(location, lhs, operator.getValue(), rhs);
	}

	// indices of the relation symbols outside parentheses; a `<` glued to a name opens generics instead
	private static List<Integer> relationSymbols(List<SpecToken> tokens) {
		int[] depths = ParseTools.nestingDepths(tokens);
		List<Integer> found = new ArrayList<>();
		for (int i = 0; i < tokens.size(); ++i) {
			if (depths[i] != 0) {
				continue;
			}
			SpecToken tok = tokens.get(i);
			if (tok.is(SpecTokenType.RELATION) || tok.is(SpecTokenType.IN) ||
					(tok.is(SpecTokenType.LANGLE) && !ParseTools.opensGeneric(tokens, i))) {
				found.add(i);
			}
		}
		return found;
	}

	private static Membership readMembership(List<SpecToken> tokens, int in, SourceLocation location)
			throws SpecParseException {
		List<SpecToken> lhs = tokens.subList(0, in);
		if (lhs.size() != 1 || !lhs.get(0).is(SpecTokenType.NAME)) {
			throw new SpecParseException(new PremiseSyntaxIssue(DiagnosticKind.INVALID_MEMBERSHIP_ARITY,
					ParseTools.span(lhs, tokens.get(in).getLocation()), ParseTools.render(tokens)));
		}
		SpecToken variable = lhs.get(0);
		SpecToken context = tokens.get(in + 1);
		return new Membership(location, new SemanticVar(variable.getLocation(), variable.getValue()),
				new ContextRef(context.getLocation(), context.getValue()));
	}

	private static boolean looksLikePredicate(List<SpecToken> tokens) {
		return tokens.size() >= 3 && tokens.get(0).is(SpecTokenType.NAME) && tokens.get(1).is(SpecTokenType.LPAREN) &&
				ParseTools.closingParen(tokens, 1) == tokens.size() - 1;
	}

	private static CustomPredicate readPredicate(List<SpecToken> tokens, SourceLocation location)
			throws SpecParseException {
		SpecToken name = tokens.get(0);
		if (!PREDICATE_NAME.matcher(name.getValue()).matches()) {
			throw new SpecParseException(new PremiseSyntaxIssue(DiagnosticKind.INVALID_PREDICATE_NAME,
					name.getLocation(), name.getValue()));
		}
		List<SemanticVar> arguments = new ArrayList<>();
		List<SpecToken> inside = tokens.subList(2, tokens.size() - 1);
		if (!inside.isEmpty()) {
			for (List<SpecToken> argument : ParseTools.splitTopLevel(inside, SpecTokenType.COMMA)) {
				if (argument.size() != 1 || !argument.get(0).is(SpecTokenType.NAME)) {
					throw new SpecParseException(new PremiseSyntaxIssue(DiagnosticKind.INVALID_PREDICATE_ARGUMENT,
							ParseTools.span(argument, location), ParseTools.render(argument)));
				}
				arguments.add(new SemanticVar(argument.get(0).getLocation(), argument.get(0).getValue()));
			}
		}
		return new CustomPredicate(location, name.getValue(), arguments);
	}

	private static SpecParseException error(DiagnosticKind kind, SourceLocation location, List<SpecToken> tokens) {
		return new SpecParseException(new PremiseSyntaxIssue(kind, location, ParseTools.render(tokens)));
	}
}

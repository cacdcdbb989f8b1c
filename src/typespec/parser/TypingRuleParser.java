package typespec.parser;

import java.util.ArrayList;
import java.util.List;
import java.util.stream.Collectors;

import typespec.errors.DiagnosticKind;
import typespec.lexer.SpecLexerException;
import typespec.lexer.SpecToken;
import typespec.lexer.SpecTokenType;
import typespec.model.typing.Conclusion;
import typespec.model.typing.ContextLookupConclusion;
import typespec.model.typing.JudgmentConclusion;
import typespec.model.typing.Premise;
import typespec.model.typing.SemanticVar;
import typespec.model.typing.TypeConclusion;
import typespec.model.typing.TypingRule;
import typespec.util.SourceLocation;

/**
 * Parses an inference rule laid out over lines:
 *
 * <pre>
 * Γ ⊢ f : τ -> σ, Γ ⊢ a : τ
 * ------------------------- (app)
 * σ
 * </pre>
 *
 * Everything above the first bar line is the premises line (absent for an axiom), everything below
 * it is the conclusion.
 */
public final class TypingRuleParser {
	private TypingRuleParser() {}

	public static TypingRule parseTypingRule(String text) throws SpecLexerException, SpecParseException {
		return parseTypingRule(SourceLine.split(text).stream()
				.filter(line -> !line.isBlank() && !line.isComment())
				.collect(Collectors.toList()));
	}

	/**
	 * @param lines the rule's lines, without blank or comment lines
	 */
	public static TypingRule parseTypingRule(List<SourceLine> lines) throws SpecLexerException, SpecParseException {
		int bar = -1;
		for (int i = 0; i < lines.size(); ++i) {
			if (lines.get(i).isBar()) {
				bar = i;
				break;
			}
		}
		if (bar == -1) {
			SourceLocation location = lines.isEmpty() ? SourceLocation.unknown() : lines.get(0).getLocation();
			String fragment = lines.isEmpty() ? "" : lines.get(0).getTrimmed();
			throw new SpecParseException(new RuleSyntaxIssue(DiagnosticKind.MISSING_BAR, location, fragment));
		}
		SourceLine barLine = lines.get(bar);
		List<SpecToken> barTokens = barLine.tokenize();
		SpecToken ruleName = readRuleName(barLine, barTokens);

		List<SpecToken> premiseTokens = SourceLine.tokenize(lines.subList(0, bar));
		List<SpecToken> conclusionTokens = SourceLine.tokenize(lines.subList(bar + 1, lines.size()));
		if (conclusionTokens.isEmpty()) {
			SourceLocation barLocation = barLine.getLocation();
			throw new SpecParseException(new RuleSyntaxIssue(DiagnosticKind.EMPTY_CONCLUSION,
					barLocation, barLine.getTrimmed()));
		}

		List<Premise> premises = new ArrayList<>();
		for (List<SpecToken> fragment : splitPremises(premiseTokens)) {
			premises.add(PremiseParser.parsePremise(fragment, ParseTools.span(premiseTokens, barLine.getLocation())));
		}
		Conclusion conclusion = parseConclusion(conclusionTokens, barLine.getLocation());
		return new TypingRule(SourceLine.span(lines), ruleName.getValue(), ruleName.getLocation(), premises,
				conclusion);
	}

	// '-'+ '(' name ')'
	private static SpecToken readRuleName(SourceLine barLine, List<SpecToken> tokens) throws SpecParseException {
		if (tokens.size() != 4 || !tokens.get(0).is(SpecTokenType.BAR) || !tokens.get(1).is(SpecTokenType.LPAREN) ||
				!tokens.get(2).is(SpecTokenType.NAME) || !tokens.get(3).is(SpecTokenType.RPAREN) ||
				!ProductionParser.IDENTIFIER.matcher(tokens.get(2).getValue()).matches()) {
			SourceLocation location = tokens.size() > 1 ? ParseTools.span(tokens.subList(1, tokens.size()),
					barLine.getLocation()) : barLine.getLocation();
			throw new SpecParseException(new RuleSyntaxIssue(DiagnosticKind.MISSING_RULE_NAME,
					location, barLine.getTrimmed()));
		}
		return tokens.get(2);
	}

	/**
	 * Splits a premises line on top-level commas. The commas of a context in front of a `⊢`, as in
	 * `Γ, x:τ ⊢ e : σ`, do not end the premise.
	 */
	public static List<List<SpecToken>> splitPremises(List<SpecToken> tokens) {
		List<List<SpecToken>> result = new ArrayList<>();
		if (tokens.isEmpty()) {
			return result;
		}
		List<List<SpecToken>> parts = ParseTools.splitTopLevel(tokens, SpecTokenType.COMMA);
		int i = 0;
		while (i < parts.size()) {
			List<SpecToken> part = parts.get(i);
			int end = i;
			if (startsContext(part) && !containsTurnstile(part)) {
				int judgment = -1;
				for (int j = i + 1; j < parts.size() && !startsContext(parts.get(j)); ++j) {
					if (containsTurnstile(parts.get(j))) {
						judgment = j;
						break;
					}
				}
				if (judgment != -1) {
					end = judgment;
				}
			}
			if (end == i) {
				result.add(part);
			} else {
				// parts are views of tokens, so the merged premise is the range they cover
				int from = tokens.indexOf(part.get(0));
				List<SpecToken> last = parts.get(end);
				int to = tokens.indexOf(last.get(last.size() - 1));
				result.add(tokens.subList(from, to + 1));
			}
			i = end + 1;
		}
		return result;
	}

	private static boolean startsContext(List<SpecToken> part) {
		return !part.isEmpty() && part.get(0).is(SpecTokenType.CONTEXT);
	}

	private static boolean containsTurnstile(List<SpecToken> part) {
		return ParseTools.count(part, SpecTokenType.TURNSTILE) > 0;
	}

	private static Conclusion parseConclusion(List<SpecToken> tokens, SourceLocation barLocation)
			throws SpecParseException {
		SourceLocation location = ParseTools.span(tokens, barLocation);
		if (tokens.size() == 4 && tokens.get(0).is(SpecTokenType.CONTEXT) && tokens.get(1).is(SpecTokenType.LPAREN) &&
				tokens.get(2).is(SpecTokenType.NAME) && tokens.get(3).is(SpecTokenType.RPAREN)) {
			SpecToken var = tokens.get(2);
			return new ContextLookupConclusion(location, new SemanticVar(var.getLocation(), var.getValue()));
		}
		if (containsTurnstile(tokens)) {
			return new JudgmentConclusion(location, PremiseParser.parseJudgment(tokens, location));
		}
		return new TypeConclusion(location, TypeExprParser.parseType(tokens, location));
	}
}

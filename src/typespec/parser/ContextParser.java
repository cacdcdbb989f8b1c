package typespec.parser;

import java.util.ArrayList;
import java.util.List;

import typespec.errors.DiagnosticKind;
import typespec.lexer.SpecToken;
import typespec.lexer.SpecTokenType;
import typespec.model.typing.ContextExtension;
import typespec.model.typing.SemanticVar;
import typespec.model.typing.TypeExpr;
import typespec.model.typing.TypingContext;
import typespec.util.SourceLocation;

/**
 * Parses typing contexts: `Γ` followed by zero or more `, var : type` extensions.
 */
public final class ContextParser {
	private ContextParser() {}

	public static TypingContext parseContext(List<SpecToken> tokens, SourceLocation fragmentLocation)
			throws SpecParseException {
		if (tokens.isEmpty() || !tokens.get(0).is(SpecTokenType.CONTEXT)) {
			SourceLocation blame = tokens.isEmpty() ? fragmentLocation : tokens.get(0).getLocation();
			throw new SpecParseException(new ContextSyntaxIssue(
					DiagnosticKind.MISSING_BASE, blame, ParseTools.render(tokens)));
		}
		SpecToken base = tokens.get(0);
		List<ContextExtension> extensions = new ArrayList<>();
		if (tokens.size() == 1) {
			return new TypingContext(base.getLocation(), extensions);
		}
		if (!tokens.get(1).is(SpecTokenType.COMMA)) {
			List<SpecToken> rest = tokens.subList(1, tokens.size());
			throw new SpecParseException(new ContextSyntaxIssue(
					DiagnosticKind.MALFORMED_EXTENSION, ParseTools.span(rest, fragmentLocation), ParseTools.render(rest)));
		}
		SourceLocation afterComma = tokens.get(1).getLocation();
		for (List<SpecToken> segment : ParseTools.splitTopLevel(tokens.subList(2, tokens.size()), SpecTokenType.COMMA)) {
			extensions.add(readExtension(segment, afterComma));
			if (!segment.isEmpty()) {
				afterComma = segment.get(segment.size() - 1).getLocation();
			}
		}
		return new TypingContext(ParseTools.span(tokens, fragmentLocation), extensions);
	}

	// var ':' type
	private static ContextExtension readExtension(List<SpecToken> segment, SourceLocation previous)
			throws SpecParseException {
		SourceLocation location = ParseTools.span(segment, previous);
		if (segment.size() < 3 || !segment.get(0).is(SpecTokenType.NAME) || !segment.get(1).is(SpecTokenType.COLON)) {
			throw new SpecParseException(new ContextSyntaxIssue(
					DiagnosticKind.MALFORMED_EXTENSION, location, ParseTools.render(segment)));
		}
		SpecToken variable = segment.get(0);
		TypeExpr type = TypeExprParser.parseType(segment.subList(2, segment.size()), location);
		return new ContextExtension(location, new SemanticVar(variable.getLocation(), variable.getValue()), type);
	}
}

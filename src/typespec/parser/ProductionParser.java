package typespec.parser;

import java.util.ArrayList;
import java.util.HashSet;
import java.util.List;
import java.util.Set;
import java.util.regex.Pattern;

import typespec.errors.DiagnosticKind;
import typespec.lexer.SpecLexer;
import typespec.lexer.SpecLexerException;
import typespec.lexer.SpecToken;
import typespec.lexer.SpecTokenType;
import typespec.model.grammar.Alternatives;
import typespec.model.grammar.GrammarExpr;
import typespec.model.grammar.NonTerminal;
import typespec.model.grammar.ProductionRule;
import typespec.model.grammar.Sequence;
import typespec.model.grammar.Terminal;
import typespec.model.typing.SemanticVar;
import typespec.util.SourceLocation;

/**
 * Parses one production rule:
 *
 * <pre>
 * production ::= IDENT ( '(' IDENT ')' )? '::=' '|'? seq ( '|' seq )*
 * seq        ::= factor+
 * factor     ::= ( STRING | REGEX | IDENT ) ( '[' var ']' )?
 * </pre>
 *
 * A sequence of one factor is represented by the factor itself, and a single alternative by its
 * sequence, so that printing and re-parsing a production gives back the same tree.
 */
public class ProductionParser {

	static final Pattern IDENTIFIER = Pattern.compile("[a-zA-Z][a-zA-Z0-9_]*");

	private final TokenStream tokens;

	public ProductionParser(TokenStream tokens) {
		this.tokens = tokens;
	}

	public static ProductionRule parseProduction(String text) throws SpecLexerException, SpecParseException {
		List<SpecToken> tokens = new SpecLexer(text).readTokens();
		return parseProduction(tokens, new SourceLocation(0, text.length(), 1, 1, 1, 1));
	}

	/**
	 * Parses a production together with its `|` continuation lines.
	 */
	public static ProductionRule parseProduction(List<SourceLine> lines) throws SpecLexerException, SpecParseException {
		return parseProduction(SourceLine.tokenize(lines), SourceLine.span(lines));
	}

	public static ProductionRule parseProduction(List<SpecToken> tokens, SourceLocation fragmentLocation)
			throws SpecParseException {
		return new ProductionParser(new TokenStream(tokens, fragmentLocation)).readProduction();
	}

	public ProductionRule readProduction() throws SpecParseException {
		SpecToken name = expectIdentifier("expected a production name");
		String ruleName = null;
		SourceLocation ruleNameLocation = null;
		if (tokens.peekIs(SpecTokenType.LPAREN)) {
			tokens.next();
			SpecToken rule = expectIdentifier("expected a typing rule name");
			expect(SpecTokenType.RPAREN, "expected ')' after the typing rule name");
			ruleName = rule.getValue();
			ruleNameLocation = rule.getLocation();
		}
		expect(SpecTokenType.DEFINES, "expected '::='");
		if (tokens.peekIs(SpecTokenType.PIPE)) {
			tokens.next();
		}
		GrammarExpr rhs = readAlternatives();
		return new ProductionRule(
				ParseTools.span(tokens.getTokens(), tokens.getEndLocation()), name.getValue(), ruleName,
				ruleNameLocation, rhs);
	}

	private GrammarExpr readAlternatives() throws SpecParseException {
		List<GrammarExpr> alternatives = new ArrayList<>();
		alternatives.add(readSequence());
		while (tokens.peekIs(SpecTokenType.PIPE)) {
			tokens.next();
			alternatives.add(readSequence());
		}
		if (alternatives.size() == 1) {
			return alternatives.get(0);
		}
		return new Alternatives(alternatives.get(0).getLocation().combine(
				alternatives.get(alternatives.size() - 1).getLocation()), alternatives);
	}

	private GrammarExpr readSequence() throws SpecParseException {
		List<GrammarExpr> parts = new ArrayList<>();
		// bindings are scoped to one alternative
		Set<SemanticVar> bound = new HashSet<>();
		while (tokens.hasNext() && !tokens.peekIs(SpecTokenType.PIPE)) {
			parts.add(readFactor(bound));
		}
		if (parts.isEmpty()) {
			throw error(tokens.here(), "empty alternative");
		}
		if (parts.size() == 1) {
			return parts.get(0);
		}
		return new Sequence(parts.get(0).getLocation().combine(parts.get(parts.size() - 1).getLocation()), parts);
	}

	private GrammarExpr readFactor(Set<SemanticVar> bound) throws SpecParseException {
		SpecToken tok = tokens.next();
		switch (tok.getType()) {
			case STRING: {
				SemanticVar binding = readBinding(bound);
				return new Terminal(extendTo(tok.getLocation(), binding), Terminal.Kind.LITERAL, tok.getValue(), binding);
			}
			case REGEX: {
				SemanticVar binding = readBinding(bound);
				return new Terminal(extendTo(tok.getLocation(), binding), Terminal.Kind.PATTERN, tok.getValue(), binding);
			}
			case NAME: {
				if (!IDENTIFIER.matcher(tok.getValue()).matches()) {
					throw error(tok.getLocation(), "invalid nonterminal name " + tok.getValue());
				}
				SemanticVar binding = readBinding(bound);
				return new NonTerminal(extendTo(tok.getLocation(), binding), tok.getValue(), binding);
			}
			default:
				throw error(tok.getLocation(), "unexpected '" + tok.getValue() + "'");
		}
	}

	// '[' var ']', or null when the factor is not bound
	private SemanticVar readBinding(Set<SemanticVar> bound) throws SpecParseException {
		if (!tokens.peekIs(SpecTokenType.LBRACKET)) {
			return null;
		}
		tokens.next();
		if (!tokens.peekIs(SpecTokenType.NAME)) {
			throw error(tokens.here(), "expected a variable inside [ ]");
		}
		SpecToken var = tokens.next();
		expect(SpecTokenType.RBRACKET, "expected ']' after the bound variable");
		SemanticVar variable = new SemanticVar(var.getLocation(), var.getValue());
		if (!bound.add(variable)) {
			throw new SpecParseException(new ProductionSyntaxIssue(
					DiagnosticKind.DUPLICATE_BINDING, var.getLocation(), var.getValue()));
		}
		return variable;
	}

	private SourceLocation extendTo(SourceLocation location, SemanticVar binding) {
		if (binding == null) {
			return location;
		}
		return location.combine(tokens.previous().getLocation());
	}

	private SpecToken expectIdentifier(String detail) throws SpecParseException {
		if (!tokens.peekIs(SpecTokenType.NAME) || !IDENTIFIER.matcher(tokens.peek().getValue()).matches()) {
			throw error(tokens.here(), detail);
		}
		return tokens.next();
	}

	private SpecToken expect(SpecTokenType type, String detail) throws SpecParseException {
		if (!tokens.peekIs(type)) {
			throw error(tokens.here(), detail);
		}
		return tokens.next();
	}

	private SpecParseException error(SourceLocation location, String detail) {
		return new SpecParseException(new ProductionSyntaxIssue(
				DiagnosticKind.MALFORMED_PRODUCTION, location, detail, ParseTools.render(tokens.getTokens())));
	}
}

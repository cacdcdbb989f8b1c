package typespec.parser;

import java.util.ArrayList;
import java.util.List;
import java.util.regex.Pattern;

import typespec.errors.DiagnosticKind;
import typespec.lexer.SpecToken;
import typespec.lexer.SpecTokenType;
import typespec.model.typing.ArrowType;
import typespec.model.typing.ParenType;
import typespec.model.typing.SemanticVar;
import typespec.model.typing.TypeConstructor;
import typespec.model.typing.TypeExpr;
import typespec.model.typing.TypeVar;
import typespec.util.SourceLocation;

/**
 * Recursive-descent parser for type expressions.
 *
 * <pre>
 * type  ::= atom ( '->' type )?
 * atom  ::= typeVar
 *         | Constructor ( '<' type ( ',' type )* '>' )?
 *         | '(' type ')'
 * </pre>
 *
 * Names starting with an uppercase Latin letter are constructors, every other name is a type
 * variable. A `<` only opens generic arguments when it is written directly after the name.
 */
public class TypeExprParser {

	static final Pattern CONSTRUCTOR = Pattern.compile("[A-Z][a-zA-Z0-9]*");

	private final TokenStream tokens;

	public TypeExprParser(TokenStream tokens) {
		this.tokens = tokens;
	}

	/**
	 * Parses a complete type; every token must belong to it.
	 */
	public static TypeExpr parseType(List<SpecToken> tokens, SourceLocation fragmentLocation) throws SpecParseException {
		TokenStream stream = new TokenStream(tokens, fragmentLocation);
		TypeExprParser parser = new TypeExprParser(stream);
		TypeExpr type = parser.readType();
		if (stream.hasNext()) {
			SpecToken extra = stream.peek();
			if (extra.is(SpecTokenType.RANGLE)) {
				throw parser.error(DiagnosticKind.UNBALANCED_GENERIC, extra.getLocation(), null);
			}
			throw parser.error(DiagnosticKind.MALFORMED_TYPE, extra.getLocation(), "unexpected '" + extra.getValue() + "'");
		}
		return type;
	}

	/**
	 * Reads the longest type starting at the current position.
	 */
	public TypeExpr readType() throws SpecParseException {
		TypeExpr left = readAtom();
		if (tokens.peekIs(SpecTokenType.ARROW)) {
			SpecToken arrow = tokens.next();
			if (!canStartAtom(tokens.peek())) {
				throw error(DiagnosticKind.MISSING_ARROW_OPERAND, arrow.getLocation(), null);
			}
			TypeExpr right = readType();
			return new ArrowType(left.getLocation().combine(right.getLocation()), left, right);
		}
		return left;
	}

	private static boolean canStartAtom(SpecToken tok) {
		return tok != null && (tok.is(SpecTokenType.NAME) || tok.is(SpecTokenType.LPAREN));
	}

	private TypeExpr readAtom() throws SpecParseException {
		if (!tokens.hasNext()) {
			throw error(DiagnosticKind.MALFORMED_TYPE, tokens.getEndLocation(), "missing type");
		}
		SpecToken tok = tokens.next();
		switch (tok.getType()) {
			case ARROW:
				throw error(DiagnosticKind.MISSING_ARROW_OPERAND, tok.getLocation(), null);
			case LPAREN: {
				TypeExpr inner = readType();
				if (!tokens.peekIs(SpecTokenType.RPAREN)) {
					throw error(DiagnosticKind.MALFORMED_TYPE, tokens.here(), "expected ')' to close '(' at " +
							tok.getLocation().prettyString());
				}
				SpecToken close = tokens.next();
				return new ParenType(tok.getLocation().combine(close.getLocation()), inner);
			}
			case NAME:
				return readNamed(tok);
			case RANGLE:
				throw error(DiagnosticKind.UNBALANCED_GENERIC, tok.getLocation(), null);
			default:
				throw error(DiagnosticKind.MALFORMED_TYPE, tok.getLocation(), "unexpected '" + tok.getValue() + "'");
		}
	}

	private TypeExpr readNamed(SpecToken name) throws SpecParseException {
		String value = name.getValue();
		boolean generic = tokens.peekIs(SpecTokenType.LANGLE) && tokens.peek().follows(name);
		if (generic) {
			if (!CONSTRUCTOR.matcher(value).matches()) {
				throw error(DiagnosticKind.INVALID_CONSTRUCTOR_CASE, name.getLocation(), value + " is applied to type arguments");
			}
			return readGeneric(name);
		}
		if (CONSTRUCTOR.matcher(value).matches()) {
			return new TypeConstructor(name.getLocation(), value, new ArrayList<>());
		}
		char first = value.charAt(0);
		if (first >= 'A' && first <= 'Z') {
			throw error(DiagnosticKind.MALFORMED_TYPE, name.getLocation(), "invalid type constructor name " + value);
		}
		return new TypeVar(name.getLocation(), new SemanticVar(name.getLocation(), value));
	}

	private TypeExpr readGeneric(SpecToken name) throws SpecParseException {
		SpecToken open = tokens.next();
		if (tokens.peekIs(SpecTokenType.RANGLE)) {
			SpecToken close = tokens.next();
			throw error(DiagnosticKind.EMPTY_GENERIC_ARGS, open.getLocation().combine(close.getLocation()), null);
		}
		List<TypeExpr> arguments = new ArrayList<>();
		while (true) {
			if (!tokens.hasNext()) {
				throw error(DiagnosticKind.UNBALANCED_GENERIC, open.getLocation(), null);
			}
			arguments.add(readType());
			if (tokens.peekIs(SpecTokenType.COMMA)) {
				tokens.next();
				continue;
			}
			if (tokens.peekIs(SpecTokenType.RANGLE)) {
				SpecToken close = tokens.next();
				return new TypeConstructor(name.getLocation().combine(close.getLocation()), name.getValue(), arguments);
			}
			throw error(DiagnosticKind.UNBALANCED_GENERIC, open.getLocation(), null);
		}
	}

	// quotes the whole type; detail may be null
	private SpecParseException error(DiagnosticKind kind, SourceLocation location, String detail) {
		return new SpecParseException(new TypeSyntaxIssue(kind, location, detail, ParseTools.render(tokens.getTokens())));
	}
}

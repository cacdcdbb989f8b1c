package typespec.parser;

import java.util.ArrayList;
import java.util.List;

import typespec.lexer.SpecToken;
import typespec.lexer.SpecTokenType;
import typespec.util.SourceLocation;

/**
 * Helpers for working on flat token lists before handing pieces to a sub-parser.
 */
public final class ParseTools {
	private ParseTools() {}

	/**
	 * @return true if the token at index is a `<` that opens a generic argument list, i.e. it
	 * directly follows a name with no whitespace in between. After a lowercase name, which can only
	 * be a type variable, the `<` also needs a matching `>`; otherwise it is the relation glyph.
	 */
	public static boolean opensGeneric(List<SpecToken> tokens, int index) {
		if (index == 0 || !tokens.get(index).is(SpecTokenType.LANGLE)) {
			return false;
		}
		SpecToken previous = tokens.get(index - 1);
		if (!previous.is(SpecTokenType.NAME) || !tokens.get(index).follows(previous)) {
			return false;
		}
		return TypeExprParser.CONSTRUCTOR.matcher(previous.getValue()).matches() || hasClosingAngle(tokens, index);
	}

	// whether the `<` at openIndex is balanced by a later `>`
	private static boolean hasClosingAngle(List<SpecToken> tokens, int openIndex) {
		int depth = 0;
		for (int i = openIndex; i < tokens.size(); ++i) {
			SpecToken tok = tokens.get(i);
			if (tok.is(SpecTokenType.LANGLE) && i > 0 && tokens.get(i - 1).is(SpecTokenType.NAME) &&
					tok.follows(tokens.get(i - 1))) {
				++depth;
			} else if (tok.is(SpecTokenType.RANGLE) && --depth == 0) {
				return true;
			}
		}
		return false;
	}

	/**
	 * Computes, for each token, how many parentheses and generic brackets enclose it. A closing
	 * token is counted at the depth of its opening token.
	 */
	public static int[] nestingDepths(List<SpecToken> tokens) {
		int[] depths = new int[tokens.size()];
		int parens = 0;
		int angles = 0;
		for (int i = 0; i < tokens.size(); ++i) {
			SpecToken tok = tokens.get(i);
			if (tok.is(SpecTokenType.RPAREN) && parens > 0) {
				--parens;
			} else if (tok.is(SpecTokenType.RANGLE) && angles > 0) {
				--angles;
			}
			depths[i] = parens + angles;
			if (tok.is(SpecTokenType.LPAREN)) {
				++parens;
			} else if (opensGeneric(tokens, i)) {
				++angles;
			}
		}
		return depths;
	}

	/**
	 * Splits on separator tokens that are not nested inside parentheses or generic brackets.
	 * Always returns at least one (possibly empty) part.
	 */
	public static List<List<SpecToken>> splitTopLevel(List<SpecToken> tokens, SpecTokenType separator) {
		List<List<SpecToken>> parts = new ArrayList<>();
		int[] depths = nestingDepths(tokens);
		int start = 0;
		for (int i = 0; i < tokens.size(); ++i) {
			if (depths[i] == 0 && tokens.get(i).is(separator)) {
				parts.add(tokens.subList(start, i));
				start = i + 1;
			}
		}
		parts.add(tokens.subList(start, tokens.size()));
		return parts;
	}

	/**
	 * Renders tokens back to text, with a single space wherever the source had whitespace.
	 */
	public static String render(List<SpecToken> tokens) {
		StringBuilder sb = new StringBuilder();
		SpecToken previous = null;
		for (SpecToken tok : tokens) {
			if (previous != null && !tok.follows(previous)) {
				sb.append(' ');
			}
			sb.append(tok.getValue());
			previous = tok;
		}
		return sb.toString();
	}

	public static SourceLocation span(List<SpecToken> tokens, SourceLocation fallback) {
		if (tokens.isEmpty()) {
			return fallback;
		}
		return tokens.get(0).getLocation().combine(tokens.get(tokens.size() - 1).getLocation());
	}

	/**
	 * @return the index of the `)` matching the `(` at openIndex, or -1 if it is never closed
	 */
	public static int closingParen(List<SpecToken> tokens, int openIndex) {
		int depth = 0;
		for (int i = openIndex; i < tokens.size(); ++i) {
			if (tokens.get(i).is(SpecTokenType.LPAREN)) {
				++depth;
			} else if (tokens.get(i).is(SpecTokenType.RPAREN)) {
				--depth;
				if (depth == 0) {
					return i;
				}
			}
		}
		return -1;
	}

	public static int count(List<SpecToken> tokens, SpecTokenType type) {
		int n = 0;
		for (SpecToken tok : tokens) {
			if (tok.is(type)) {
				++n;
			}
		}
		return n;
	}

	public static int indexOf(List<SpecToken> tokens, SpecTokenType type, int from) {
		for (int i = from; i < tokens.size(); ++i) {
			if (tokens.get(i).is(type)) {
				return i;
			}
		}
		return -1;
	}
}

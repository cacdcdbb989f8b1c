package typespec.lexer;

import java.util.ArrayList;
import java.util.List;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

import typespec.errors.DiagnosticKind;
import typespec.util.SourceLocation;

/**
 * Turns a region of a spec document into tokens.
 *
 * Notable features: `// ...` comments are skipped, `->` and `→` both produce an ARROW, and
 * the lexer never decides whether a name is an identifier or a semantic variable; the parsers
 * do that, so that a malformed variable such as `τ_1` reaches the validator instead of
 * failing here.
 */
public class SpecLexer {

	static final Pattern WHITESPACE = Pattern.compile("\\s+");

	static final Pattern LINE_COMMENT = Pattern.compile("//[^\n]*");

	static final Pattern NAME = Pattern.compile("[a-zA-ZΑ-Ωα-ω][a-zA-Z0-9_Α-Ωα-ω₀-₉]*");

	static final Pattern STRING = Pattern.compile("'(?:\\\\.|[^'\\\\\n])*'|\"(?:\\\\.|[^\"\\\\\n])*\"");

	static final Pattern REGEX = Pattern.compile("/(?:\\\\.|[^/\\\\\n])+/");

	static final Pattern BAR = Pattern.compile("-+(?!>)");

	static final String CONTEXT_SYMBOL = "Γ";

	static final Object[][] BUILTIN = {
		{"::=", SpecTokenType.DEFINES},
		{"->", SpecTokenType.ARROW},
		{"→", SpecTokenType.ARROW},
		{"<:", SpecTokenType.RELATION},
		{"(", SpecTokenType.LPAREN},
		{")", SpecTokenType.RPAREN},
		{"[", SpecTokenType.LBRACKET},
		{"]", SpecTokenType.RBRACKET},
		{"<", SpecTokenType.LANGLE},
		{">", SpecTokenType.RANGLE},
		{",", SpecTokenType.COMMA},
		{"|", SpecTokenType.PIPE},
		{":", SpecTokenType.COLON},
		{"⊢", SpecTokenType.TURNSTILE},
		{"∈", SpecTokenType.IN},
		{"=", SpecTokenType.RELATION},
		{"≠", SpecTokenType.RELATION},
		{"≤", SpecTokenType.RELATION},
		{"⊆", SpecTokenType.RELATION},
		{"⊂", SpecTokenType.RELATION},
		{"⊇", SpecTokenType.RELATION},
		{"⊃", SpecTokenType.RELATION},
	};

	private final String text;
	private final int endOffset;
	private int offset;
	private int line;
	private int column;

	/**
	 * Lexes a whole document.
	 */
	public SpecLexer(String text) {
		this(text, 0, text.length(), 1, 1);
	}

	/**
	 * Lexes text[startOffset, endOffset), where startOffset sits at the given 1-based line and column.
	 */
	public SpecLexer(String text, int startOffset, int endOffset, int startLine, int startColumn) {
		this.text = text;
		this.offset = startOffset;
		this.endOffset = endOffset;
		this.line = startLine;
		this.column = startColumn;
	}

	public static List<SpecToken> tokenize(String text) throws SpecLexerException {
		return new SpecLexer(text).readTokens();
	}

	/**
	 * @return the tokens of the region the lexer was given
	 * @throws SpecLexerException if part of the input matches no token class
	 */
	public List<SpecToken> readTokens() throws SpecLexerException {
		List<SpecToken> tokens = new ArrayList<>();
		while(offset < endOffset) {
			Matcher m = WHITESPACE.matcher(text);
			m.region(offset, endOffset);
			if(m.lookingAt()) {
				advance(m.end());
				continue;
			}

			m = LINE_COMMENT.matcher(text);
			m.region(offset, endOffset);
			if(m.lookingAt()) {
				advance(m.end());
				continue;
			}

			m = NAME.matcher(text);
			m.region(offset, endOffset);
			if(m.lookingAt()) {
				String name = m.group();
				tokens.add(makeToken(name, CONTEXT_SYMBOL.equals(name) ? SpecTokenType.CONTEXT : SpecTokenType.NAME));
				continue;
			}

			char c = text.charAt(offset);
			if(c == '\'' || c == '"') {
				m = STRING.matcher(text);
				m.region(offset, endOffset);
				if(!m.lookingAt()) {
					throw unterminated();
				}
				tokens.add(makeToken(m.group(), SpecTokenType.STRING));
				continue;
			}
			if(c == '/') {
				m = REGEX.matcher(text);
				m.region(offset, endOffset);
				if(!m.lookingAt()) {
					throw unterminated();
				}
				tokens.add(makeToken(m.group(), SpecTokenType.REGEX));
				continue;
			}

			// match the longest builtin we can
			String possibleBuiltin = null;
			SpecTokenType possibleBuiltinType = null;
			for(Object[] builtin : BUILTIN) {
				String symbol = (String) builtin[0];
				if(possibleBuiltin != null && symbol.length() <= possibleBuiltin.length()) {
					continue;
				}
				if(text.regionMatches(offset, symbol, 0, symbol.length()) && offset + symbol.length() <= endOffset) {
					possibleBuiltin = symbol;
					possibleBuiltinType = (SpecTokenType) builtin[1];
				}
			}
			if(possibleBuiltin != null) {
				tokens.add(makeToken(possibleBuiltin, possibleBuiltinType));
				continue;
			}

			m = BAR.matcher(text);
			m.region(offset, endOffset);
			if(m.lookingAt()) {
				tokens.add(makeToken(m.group(), SpecTokenType.BAR));
				continue;
			}

			String offending = new String(Character.toChars(text.codePointAt(offset)));
			throw new SpecLexerException(new LexicalIssue(
					DiagnosticKind.UNRECOGNIZED_CHARACTER, here(offending.length()), offending));
		}
		return tokens;
	}

	private SpecLexerException unterminated() {
		int lineEnd = text.indexOf('\n', offset);
		if(lineEnd == -1 || lineEnd > endOffset) {
			lineEnd = endOffset;
		}
		String rest = text.substring(offset, lineEnd).trim();
		return new SpecLexerException(new LexicalIssue(
				DiagnosticKind.UNTERMINATED_LITERAL, here(rest.length()), rest));
	}

	private SourceLocation here(int length) {
		return new SourceLocation(offset, offset + length, line, line, column, column + length);
	}

	private SpecToken makeToken(String value, SpecTokenType type) {
		SpecToken token = new SpecToken(value, type, here(value.length()));
		advance(offset + value.length());
		return token;
	}

	// moves to newOffset, keeping the line and column counters in step
	private void advance(int newOffset) {
		for(int i = offset; i < newOffset; ++i) {
			if(text.charAt(i) == '\n') {
				++line;
				column = 1;
			}else {
				++column;
			}
		}
		offset = newOffset;
	}
}

package typespec.lexer;

public enum SpecTokenType {
	// identifiers and semantic variables alike; the parsers decide which one is meant
	NAME,
	// the base context symbol Γ
	CONTEXT,
	STRING,
	REGEX,
	LPAREN,
	RPAREN,
	LBRACKET,
	RBRACKET,
	LANGLE,
	RANGLE,
	COMMA,
	PIPE,
	COLON,
	DEFINES,
	ARROW,
	TURNSTILE,
	IN,
	// relation glyphs other than ∈ and <, which have their own token types
	RELATION,
	// the horizontal inference bar, one or more '-'
	BAR,
}

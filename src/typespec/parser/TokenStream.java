package typespec.parser;

import java.util.List;

import typespec.lexer.SpecToken;
import typespec.lexer.SpecTokenType;
import typespec.util.SourceLocation;

/**
 * A cursor over the tokens of one fragment.
 */
public class TokenStream {

	private final List<SpecToken> tokens;
	// blamed when the fragment ends too early
	private final SourceLocation endLocation;
	private int cur;

	public TokenStream(List<SpecToken> tokens, SourceLocation fragmentLocation) {
		this.tokens = tokens;
		this.cur = 0;
		if (tokens.isEmpty()) {
			this.endLocation = fragmentLocation;
		} else {
			SourceLocation last = tokens.get(tokens.size() - 1).getLocation();
			this.endLocation = new SourceLocation(last.getEndOffset(), last.getEndOffset(), last.getEndLine(),
					last.getEndLine(), last.getEndColumn(), last.getEndColumn());
		}
	}

	public boolean hasNext() {
		return cur < tokens.size();
	}

	/**
	 * @return the next token without consuming it, null at the end
	 */
	public SpecToken peek() {
		return hasNext() ? tokens.get(cur) : null;
	}

	public boolean peekIs(SpecTokenType type) {
		return hasNext() && tokens.get(cur).is(type);
	}

	public SpecToken next() {
		return tokens.get(cur++);
	}

	/**
	 * @return the token just consumed, or null before the first one
	 */
	public SpecToken previous() {
		return cur == 0 ? null : tokens.get(cur - 1);
	}

	public SourceLocation getEndLocation() {
		return endLocation;
	}

	/**
	 * @return the location of the next token, or of the end of the fragment
	 */
	public SourceLocation here() {
		return hasNext() ? peek().getLocation() : endLocation;
	}

	public List<SpecToken> getTokens() {
		return tokens;
	}
}

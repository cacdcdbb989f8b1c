package typespec.parser;

import java.util.ArrayList;
import java.util.List;
import java.util.regex.Pattern;

import typespec.lexer.SpecLexer;
import typespec.lexer.SpecLexerException;
import typespec.lexer.SpecToken;
import typespec.util.SourceLocation;

/**
 * One physical line of a document, kept as a window into the full text so that tokens lexed from
 * it carry document-wide offsets.
 */
public class SourceLine {

	private static final Pattern BAR_LINE = Pattern.compile("-+(?!>).*");

	private final String text;
	private final int startOffset;
	private final int endOffset;
	private final int lineNumber;

	public SourceLine(String text, int startOffset, int endOffset, int lineNumber) {
		this.text = text;
		this.startOffset = startOffset;
		this.endOffset = endOffset;
		this.lineNumber = lineNumber;
	}

	/**
	 * Splits text on '\n'. A trailing '\r' stays part of its line and is lexed as whitespace.
	 */
	public static List<SourceLine> split(String text) {
		List<SourceLine> lines = new ArrayList<>();
		int start = 0;
		int number = 1;
		while (true) {
			int end = text.indexOf('\n', start);
			if (end == -1) {
				lines.add(new SourceLine(text, start, text.length(), number));
				return lines;
			}
			lines.add(new SourceLine(text, start, end, number));
			start = end + 1;
			++number;
		}
	}

	public String getContent() {
		return text.substring(startOffset, endOffset);
	}

	public String getTrimmed() {
		return getContent().trim();
	}

	public int getLineNumber() {
		return lineNumber;
	}

	public boolean isBlank() {
		return getTrimmed().isEmpty();
	}

	public boolean isComment() {
		return getTrimmed().startsWith("//");
	}

	/**
	 * @return true for an inference bar line such as `----- (app)`
	 */
	public boolean isBar() {
		return BAR_LINE.matcher(getTrimmed()).matches();
	}

	public boolean startsProduction() {
		return !isComment() && getContent().contains("::=");
	}

	public boolean isContinuation() {
		return getTrimmed().startsWith("|");
	}

	/**
	 * @return the location of the line's text without surrounding whitespace
	 */
	public SourceLocation getLocation() {
		String content = getContent();
		int lead = 0;
		while (lead < content.length() && Character.isWhitespace(content.charAt(lead))) {
			++lead;
		}
		int length = getTrimmed().length();
		return new SourceLocation(startOffset + lead, startOffset + lead + length, lineNumber, lineNumber,
				lead + 1, lead + 1 + length);
	}

	public List<SpecToken> tokenize() throws SpecLexerException {
		return new SpecLexer(text, startOffset, endOffset, lineNumber, 1).readTokens();
	}

	/**
	 * Lexes several lines into one token list.
	 */
	public static List<SpecToken> tokenize(List<SourceLine> lines) throws SpecLexerException {
		List<SpecToken> tokens = new ArrayList<>();
		for (SourceLine line : lines) {
			tokens.addAll(line.tokenize());
		}
		return tokens;
	}

	/**
	 * @return the location spanning all given lines, unknown if there are none
	 */
	public static SourceLocation span(List<SourceLine> lines) {
		SourceLocation location = SourceLocation.unknown();
		for (SourceLine line : lines) {
			location = location.combine(line.getLocation());
		}
		return location;
	}

	@Override
	public String toString() {
		return getContent();
	}
}

package typespec.parser;

import java.util.Collections;
import java.util.List;

import typespec.lexer.SpecLexerException;
import typespec.model.Declaration;
import typespec.util.SourceLocation;

/**
 * The lines of one declaration, cut out of a document before anything is lexed. Each block can
 * be parsed on its own, in any order.
 */
public abstract class DeclarationBlock {
	private final List<SourceLine> lines;

	public DeclarationBlock(List<SourceLine> lines) {
		this.lines = Collections.unmodifiableList(lines);
	}

	public List<SourceLine> getLines() {
		return lines;
	}

	public SourceLocation getLocation() {
		return SourceLine.span(lines);
	}

	public abstract Declaration parse() throws SpecLexerException, SpecParseException;

	public abstract <T, E extends Throwable> T accept(DeclarationBlockVisitor<T, E> v) throws E;
}

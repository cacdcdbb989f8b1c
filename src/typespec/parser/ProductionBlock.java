package typespec.parser;

import java.util.List;
import java.util.Optional;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

import typespec.lexer.SpecLexerException;
import typespec.model.grammar.ProductionRule;

/**
 * A production line and its `|` continuation lines.
 */
public class ProductionBlock extends DeclarationBlock {

	private static final Pattern RULE_NAME = Pattern.compile(
			"\\s*[a-zA-Z][a-zA-Z0-9_]*\\s*\\(\\s*([a-zA-Z][a-zA-Z0-9_]*)\\s*\\)\\s*::=");

	public ProductionBlock(List<SourceLine> lines) {
		super(lines);
	}

	/**
	 * @return the typing rule name of `Name(rule) ::=`, if the first line starts that way
	 */
	public Optional<String> peekRuleName() {
		Matcher m = RULE_NAME.matcher(getLines().get(0).getContent());
		return m.lookingAt() ? Optional.of(m.group(1)) : Optional.empty();
	}

	@Override
	public ProductionRule parse() throws SpecLexerException, SpecParseException {
		return ProductionParser.parseProduction(getLines());
	}

	@Override
	public <T, E extends Throwable> T accept(DeclarationBlockVisitor<T, E> v) throws E {
		return v.visit(this);
	}
}

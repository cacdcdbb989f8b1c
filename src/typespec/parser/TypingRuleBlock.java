package typespec.parser;

import java.util.List;
import java.util.Optional;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

import typespec.lexer.SpecLexerException;
import typespec.model.typing.TypingRule;

/**
 * The non-comment lines of a paragraph that declares no production.
 */
public class TypingRuleBlock extends DeclarationBlock {

	private static final Pattern RULE_NAME = Pattern.compile("\\(\\s*([a-zA-Z][a-zA-Z0-9_]*)\\s*\\)");

	public TypingRuleBlock(List<SourceLine> lines) {
		super(lines);
	}

	/**
	 * Reads the rule name off the bar line without parsing the rule, so that errors in the rest of
	 * the rule can still name it.
	 */
	public Optional<String> peekRuleName() {
		for (SourceLine line : getLines()) {
			if (line.isBar()) {
				Matcher m = RULE_NAME.matcher(line.getContent());
				return m.find() ? Optional.of(m.group(1)) : Optional.empty();
			}
		}
		return Optional.empty();
	}

	@Override
	public TypingRule parse() throws SpecLexerException, SpecParseException {
		return TypingRuleParser.parseTypingRule(getLines());
	}

	@Override
	public <T, E extends Throwable> T accept(DeclarationBlockVisitor<T, E> v) throws E {
		return v.visit(this);
	}
}

package typespec.parser;

import static org.hamcrest.CoreMatchers.*;
import static org.junit.Assert.*;

import java.util.List;
import java.util.Optional;

import org.junit.Test;

public class DocumentParserTest {

	private static final String DOCUMENT = String.join("\n",
			"// variables and terms",
			"Term ::= Variable | Lambda",
			"Variable(var) ::= /[a-z]+/[x]",
			"  | 'it'",
			"",
			"",
			"// lookup",
			"x ∈ Γ",
			"------ (var)",
			"Γ(x)",
			"// done");

	@Test
	public void blocks() {
		List<DeclarationBlock> blocks = DocumentParser.split(DOCUMENT);
		assertThat(blocks.size(), is(6));
		assertThat(blocks.get(0), instanceOf(CommentBlock.class));
		assertThat(blocks.get(1), instanceOf(ProductionBlock.class));
		assertThat(blocks.get(2), instanceOf(ProductionBlock.class));
		assertThat(blocks.get(3), instanceOf(CommentBlock.class));
		assertThat(blocks.get(4), instanceOf(TypingRuleBlock.class));
		assertThat(blocks.get(5), instanceOf(CommentBlock.class));

		assertThat(blocks.get(2).getLines().size(), is(2));
		assertThat(blocks.get(4).getLocation().getStartLine(), is(8));
		assertThat(blocks.get(4).getLocation().getEndLine(), is(10));
	}

	@Test
	public void peekRuleNames() {
		List<DeclarationBlock> blocks = DocumentParser.split(DOCUMENT);
		assertThat(((ProductionBlock) blocks.get(1)).peekRuleName(), is(Optional.empty()));
		assertThat(((ProductionBlock) blocks.get(2)).peekRuleName(), is(Optional.of("var")));
		assertThat(((TypingRuleBlock) blocks.get(4)).peekRuleName(), is(Optional.of("var")));
	}

	@Test
	public void strayLineInProductionParagraphIsItsOwnBlock() {
		List<DeclarationBlock> blocks = DocumentParser.split("Term ::= Variable\nnot a production");
		assertThat(blocks.size(), is(2));
		assertThat(blocks.get(1), instanceOf(ProductionBlock.class));
	}

	@Test
	public void commentsBetweenContinuationLines() {
		List<DeclarationBlock> blocks = DocumentParser.split(String.join("\n",
				"Type ::= 'Unit'",
				"  // functions",
				"  | Type '->' Type",
				"// grouping",
				"  | '(' Type ')'",
				"// trailing",
				"Term ::= Variable"));
		assertThat(blocks.size(), is(4));
		assertThat(blocks.get(0), instanceOf(ProductionBlock.class));
		assertThat(blocks.get(0).getLines().size(), is(3));
		assertThat(blocks.get(0).getLocation().getEndLine(), is(5));
		assertThat(blocks.get(1), instanceOf(CommentBlock.class));
		assertThat(blocks.get(1).getLines().size(), is(2));
		assertThat(blocks.get(2), instanceOf(CommentBlock.class));
		assertThat(blocks.get(2).getLocation().getStartLine(), is(6));
		assertThat(blocks.get(3), instanceOf(ProductionBlock.class));
	}

	@Test
	public void carriageReturnsAreWhitespace() {
		List<DeclarationBlock> blocks = DocumentParser.split("Term ::= Variable\r\n\r\nx ∈ Γ\r\n---- (var)\r\nΓ(x)\r\n");
		assertThat(blocks.size(), is(2));
		assertThat(blocks.get(1), instanceOf(TypingRuleBlock.class));
	}

	@Test
	public void hasDeclarations() {
		assertThat(DocumentParser.hasDeclarations(""), is(false));
		assertThat(DocumentParser.hasDeclarations("   \n\n"), is(false));
		assertThat(DocumentParser.hasDeclarations("// Term ::= Variable"), is(false));
		assertThat(DocumentParser.hasDeclarations("x ∈ Γ"), is(false));
		assertThat(DocumentParser.hasDeclarations("Term ::= Variable"), is(true));
		assertThat(DocumentParser.hasDeclarations("---- (unit)\nUnit"), is(true));
	}
}

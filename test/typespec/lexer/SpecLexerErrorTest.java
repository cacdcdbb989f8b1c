package typespec.lexer;

import static org.hamcrest.CoreMatchers.*;
import static org.junit.Assert.*;

import java.util.List;

import org.junit.Test;

import typespec.errors.DiagnosticKind;

public class SpecLexerErrorTest {

	@Test
	public void unrecognizedCharacter() {
		try {
			SpecLexer.tokenize("Term ::= Term[e] #");
			fail("expected a lexer error");
		} catch (SpecLexerException e) {
			LexicalIssue issue = e.getIssue();
			assertThat(issue.getKind(), is(DiagnosticKind.UNRECOGNIZED_CHARACTER));
			assertThat(issue.getText(), is("#"));
			assertThat(issue.getLocation().getStartLine(), is(1));
			assertThat(issue.getLocation().getStartColumn(), is(18));
			assertThat(issue.getMessage(), is("unrecognized character '#'"));
		}
	}

	@Test
	public void unterminatedString() {
		try {
			SpecLexer.tokenize("Term ::= 'abc\nx");
			fail("expected a lexer error");
		} catch (SpecLexerException e) {
			assertThat(e.getIssue().getKind(), is(DiagnosticKind.UNTERMINATED_LITERAL));
			assertThat(e.getIssue().getText(), is("'abc"));
		}
	}

	@Test
	public void unterminatedRegex() {
		try {
			SpecLexer.tokenize("Num ::= /[0-9]+");
			fail("expected a lexer error");
		} catch (SpecLexerException e) {
			assertThat(e.getIssue().getKind(), is(DiagnosticKind.UNTERMINATED_LITERAL));
			assertThat(e.getIssue().getLocation().getStartColumn(), is(9));
		}
	}

	@Test
	public void locationsAcrossLines() throws SpecLexerException {
		List<SpecToken> tokens = SpecLexer.tokenize("x ∈ Γ\n----- (var)\nΓ(x)");
		SpecToken bar = tokens.get(3);
		assertThat(bar.getType(), is(SpecTokenType.BAR));
		assertThat(bar.getLocation().getStartLine(), is(2));
		assertThat(bar.getLocation().getStartColumn(), is(1));
		SpecToken last = tokens.get(tokens.size() - 1);
		assertThat(last.getType(), is(SpecTokenType.RPAREN));
		assertThat(last.getLocation().getStartLine(), is(3));
		assertThat(last.getLocation().getStartColumn(), is(4));
	}

	@Test
	public void gluedAngleFollowsName() throws SpecLexerException {
		List<SpecToken> glued = SpecLexer.tokenize("List<τ>");
		assertTrue(glued.get(1).follows(glued.get(0)));
		List<SpecToken> spaced = SpecLexer.tokenize("τ < σ");
		assertFalse(spaced.get(1).follows(spaced.get(0)));
	}
}

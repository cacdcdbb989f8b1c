package typespec.parser;

import static org.hamcrest.CoreMatchers.*;
import static org.junit.Assert.*;

import java.util.Collections;
import java.util.Optional;

import org.junit.Test;

import typespec.errors.DiagnosticKind;
import typespec.lexer.SpecLexer;
import typespec.lexer.SpecLexerException;
import typespec.model.typing.ContextExtension;
import typespec.model.typing.SemanticVar;
import typespec.model.typing.TypeConstructor;
import typespec.model.typing.TypeExpr;
import typespec.model.typing.TypeVar;
import typespec.model.typing.TypingContext;
import typespec.util.SourceLocation;

public class ContextParserTest {

	private static TypingContext parse(String text) throws SpecLexerException, SpecParseException {
		return ContextParser.parseContext(SpecLexer.tokenize(text),
				new SourceLocation(0, text.length(), 1, 1, 1, text.length() + 1));
	}

	private static DiagnosticKind errorKind(String text) throws SpecLexerException {
		try {
			parse(text);
		} catch (SpecParseException e) {
			return e.getIssue().getKind();
		}
		fail("expected '" + text + "' not to parse");
		return null;
	}

	private static SemanticVar v(String name) {
		return new SemanticVar(SourceLocation.unknown(), name);
	}

	private static TypeExpr t(String name) {
		return new TypeVar(SourceLocation.unknown(), v(name));
	}

	@Test
	public void baseOnly() throws Exception {
		TypingContext context = parse("Γ");
		assertThat(context.getExtensions().isEmpty(), is(true));
	}

	@Test
	public void extensionsInOrder() throws Exception {
		TypingContext context = parse("Γ, x:τ, y : List<τ>");
		assertThat(context.getExtensions().size(), is(2));
		assertThat(context.getExtensions().get(0),
				is(new ContextExtension(SourceLocation.unknown(), v("x"), t("τ"))));
		assertThat(context.getExtensions().get(1), is(new ContextExtension(SourceLocation.unknown(), v("y"),
				new TypeConstructor(SourceLocation.unknown(), "List", Collections.singletonList(t("τ"))))));
	}

	@Test
	public void laterBindingShadows() throws Exception {
		TypingContext context = parse("Γ, x:τ, x:σ");
		assertThat(context.lookup(v("x")), is(Optional.of(t("σ"))));
		assertThat(context.lookup(v("y")), is(Optional.empty()));
	}

	@Test
	public void missingBase() throws Exception {
		assertThat(errorKind("Δ, x:τ"), is(DiagnosticKind.MISSING_BASE));
		assertThat(errorKind("x:τ"), is(DiagnosticKind.MISSING_BASE));
		assertThat(errorKind(""), is(DiagnosticKind.MISSING_BASE));
	}

	@Test
	public void malformedExtension() throws Exception {
		assertThat(errorKind("Γ x:τ"), is(DiagnosticKind.MALFORMED_EXTENSION));
		assertThat(errorKind("Γ, x"), is(DiagnosticKind.MALFORMED_EXTENSION));
		assertThat(errorKind("Γ, x:"), is(DiagnosticKind.MALFORMED_EXTENSION));
		assertThat(errorKind("Γ, x:τ,"), is(DiagnosticKind.MALFORMED_EXTENSION));
		assertThat(errorKind("Γ, :τ"), is(DiagnosticKind.MALFORMED_EXTENSION));
	}

	@Test
	public void malformedExtensionQuotesTheSegment() throws Exception {
		try {
			parse("Γ, x:τ, y");
			fail("expected a parse error");
		} catch (SpecParseException e) {
			assertThat(e.getIssue().getMessage(), is("malformed context extension in 'y'"));
			assertThat(e.getIssue().getLocation().getStartColumn(), is(9));
		}
	}

	@Test
	public void typeErrorsInsideExtensions() throws Exception {
		assertThat(errorKind("Γ, x:τ ->"), is(DiagnosticKind.MISSING_ARROW_OPERAND));
	}
}

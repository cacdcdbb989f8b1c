package typespec.parser;

import static org.hamcrest.CoreMatchers.*;
import static org.junit.Assert.*;

import java.util.Arrays;
import java.util.Collections;

import org.junit.Test;

import typespec.errors.DiagnosticKind;
import typespec.lexer.SpecLexer;
import typespec.lexer.SpecLexerException;
import typespec.model.typing.ArrowType;
import typespec.model.typing.ParenType;
import typespec.model.typing.SemanticVar;
import typespec.model.typing.TypeConstructor;
import typespec.model.typing.TypeExpr;
import typespec.model.typing.TypeVar;
import typespec.util.SourceLocation;

public class TypeExprParserTest {

	private static TypeExpr parse(String text) throws SpecLexerException, SpecParseException {
		return TypeExprParser.parseType(SpecLexer.tokenize(text),
				new SourceLocation(0, text.length(), 1, 1, 1, text.length() + 1));
	}

	private static TypeSyntaxIssue parseError(String text) throws SpecLexerException {
		try {
			parse(text);
		} catch (SpecParseException e) {
			return (TypeSyntaxIssue) e.getIssue();
		}
		fail("expected '" + text + "' not to parse");
		return null;
	}

	private static TypeExpr var(String name) {
		return new TypeVar(SourceLocation.unknown(), new SemanticVar(SourceLocation.unknown(), name));
	}

	private static TypeExpr arrow(TypeExpr left, TypeExpr right) {
		return new ArrowType(SourceLocation.unknown(), left, right);
	}

	private static TypeExpr cons(String name, TypeExpr... args) {
		return new TypeConstructor(SourceLocation.unknown(), name, Arrays.asList(args));
	}

	@Test
	public void arrowsAssociateRight() throws Exception {
		assertThat(parse("τ -> σ -> ρ"), is(arrow(var("τ"), arrow(var("σ"), var("ρ")))));
		assertThat(parse("τ → σ → ρ"), is(arrow(var("τ"), arrow(var("σ"), var("ρ")))));
	}

	@Test
	public void parenthesesOverrideAssociativity() throws Exception {
		assertThat(parse("(τ -> σ) -> ρ"),
				is(arrow(new ParenType(SourceLocation.unknown(), arrow(var("τ"), var("σ"))), var("ρ"))));
	}

	@Test
	public void constructors() throws Exception {
		assertThat(parse("Int"), is(new TypeConstructor(SourceLocation.unknown(), "Int", Collections.emptyList())));
		assertThat(parse("List<τ>"), is(cons("List", var("τ"))));
		assertThat(parse("Map<κ, List<ν>>"), is(cons("Map", var("κ"), cons("List", var("ν")))));
		assertThat(parse("List<τ -> σ> -> Bool"), is(arrow(cons("List", arrow(var("τ"), var("σ"))), cons("Bool"))));
	}

	@Test
	public void lowercaseNamesAreTypeVariables() throws Exception {
		assertThat(parse("α₁"), is(var("α₁")));
		// validation rejects it later as a variable
		assertThat(parse("int"), is(var("int")));
	}

	@Test
	public void locationsSpanTheType() throws Exception {
		TypeExpr type = parse("τ -> σ");
		assertThat(type.getLocation().getStartColumn(), is(1));
		assertThat(type.getLocation().getEndColumn(), is(7));
	}

	@Test
	public void missingArrowOperand() throws Exception {
		TypeSyntaxIssue issue = parseError("τ ->");
		assertThat(issue.getKind(), is(DiagnosticKind.MISSING_ARROW_OPERAND));
		assertThat(issue.getLocation().getStartColumn(), is(3));
		assertThat(issue.getMessage(), is("missing arrow operand in 'τ ->'"));

		assertThat(parseError("-> τ").getKind(), is(DiagnosticKind.MISSING_ARROW_OPERAND));
		assertThat(parseError("τ -> -> σ").getKind(), is(DiagnosticKind.MISSING_ARROW_OPERAND));
	}

	@Test
	public void unbalancedGeneric() throws Exception {
		assertThat(parseError("List<τ").getKind(), is(DiagnosticKind.UNBALANCED_GENERIC));
		assertThat(parseError("List<τ, σ").getKind(), is(DiagnosticKind.UNBALANCED_GENERIC));
		assertThat(parseError("τ>").getKind(), is(DiagnosticKind.UNBALANCED_GENERIC));
	}

	@Test
	public void emptyGenericArgs() throws Exception {
		TypeSyntaxIssue issue = parseError("List<>");
		assertThat(issue.getKind(), is(DiagnosticKind.EMPTY_GENERIC_ARGS));
		assertThat(issue.getLocation().getStartColumn(), is(5));
	}

	@Test
	public void invalidConstructorCase() throws Exception {
		TypeSyntaxIssue issue = parseError("list<τ>");
		assertThat(issue.getKind(), is(DiagnosticKind.INVALID_CONSTRUCTOR_CASE));
		assertThat(issue.getDetail().get(), is("list is applied to type arguments"));
		assertThat(issue.getMessage(),
				is("type constructor must start with an uppercase letter: list is applied to type arguments in 'list<τ>'"));
	}

	@Test
	public void malformedType() throws Exception {
		assertThat(parseError("Γ").getKind(), is(DiagnosticKind.MALFORMED_TYPE));
		assertThat(parseError("").getDetail().get(), is("missing type"));
		assertThat(parseError("My_Type").getDetail().get(), is("invalid type constructor name My_Type"));
		// a detached '<' is a relation symbol, not a generic bracket
		assertThat(parseError("List <τ>").getDetail().get(), is("unexpected '<'"));
		assertThat(parseError("(τ -> σ").getKind(), is(DiagnosticKind.MALFORMED_TYPE));
	}
}

package typespec.parser;

import static org.hamcrest.CoreMatchers.*;
import static org.junit.Assert.*;

import java.util.Arrays;
import java.util.Collections;

import org.junit.Test;

import typespec.errors.DiagnosticKind;
import typespec.lexer.SpecLexer;
import typespec.lexer.SpecLexerException;
import typespec.model.typing.ContextExtension;
import typespec.model.typing.ContextRef;
import typespec.model.typing.CustomPredicate;
import typespec.model.typing.Membership;
import typespec.model.typing.Premise;
import typespec.model.typing.SemanticVar;
import typespec.model.typing.TypeConstructor;
import typespec.model.typing.TypeExpr;
import typespec.model.typing.TypeRelation;
import typespec.model.typing.TypeVar;
import typespec.model.typing.TypingContext;
import typespec.model.typing.TypingJudgment;
import typespec.util.SourceLocation;

public class PremiseParserTest {

	static Premise parse(String text) throws SpecLexerException, SpecParseException {
		return PremiseParser.parsePremise(SpecLexer.tokenize(text),
				new SourceLocation(0, text.length(), 1, 1, 1, text.length() + 1));
	}

	private static SpecParseException parseError(String text) throws SpecLexerException {
		try {
			parse(text);
		} catch (SpecParseException e) {
			return e;
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

	private static TypeRelation relation(TypeExpr lhs, String op, TypeExpr rhs) {
		return new TypeRelation(SourceLocation.unknown(), lhs, op, rhs);
	}

	@Test
	public void judgment() throws Exception {
		TypingContext context = new TypingContext(SourceLocation.unknown(), Collections.singletonList(
				new ContextExtension(SourceLocation.unknown(), v("x"), t("τ"))));
		assertThat(parse("Γ,x:τ ⊢ e : σ"),
				is(new TypingJudgment(SourceLocation.unknown(), context, v("e"), t("σ"))));
		assertThat(parse("Γ ⊢ f : τ -> σ"), instanceOf(TypingJudgment.class));
	}

	@Test
	public void membership() throws Exception {
		assertThat(parse("x ∈ Γ"), is(new Membership(SourceLocation.unknown(), v("x"),
				new ContextRef(SourceLocation.unknown(), ContextRef.BASE))));
		Premise other = parse("x ∈ Δ");
		assertThat(other, instanceOf(Membership.class));
		assertThat(((Membership) other).getContext().isBase(), is(false));
	}

	@Test
	public void typeRelations() throws Exception {
		assertThat(parse("τ = σ"), is(relation(t("τ"), "=", t("σ"))));
		assertThat(parse("τ <: σ"), is(relation(t("τ"), "<:", t("σ"))));
		assertThat(parse("τ < σ"), is(relation(t("τ"), "<", t("σ"))));
		assertThat(parse("τ ≠ σ -> ρ"), is(relation(t("τ"), "≠",
				new typespec.model.typing.ArrowType(SourceLocation.unknown(), t("σ"), t("ρ")))));
		assertThat(parse("List<τ> ⊆ σ"), is(relation(
				new TypeConstructor(SourceLocation.unknown(), "List", Collections.singletonList(t("τ"))), "⊆", t("σ"))));
		// a membership whose right side is not a single context name is a relation
		assertThat(parse("τ ∈ List<σ>"), instanceOf(TypeRelation.class));
	}

	@Test
	public void lessThanGluedToTypeVariable() throws Exception {
		assertThat(parse("τ<σ"), is(relation(t("τ"), "<", t("σ"))));
		assertThat(parse("τ<σ -> ρ"), instanceOf(TypeRelation.class));
		// a closed argument list after a lowercase name is still a misplaced generic
		assertThat(parseError("int<a> = τ").getIssue().getKind(), is(DiagnosticKind.INVALID_CONSTRUCTOR_CASE));
		assertThat(parseError("List<τ = σ").getIssue().getKind(), is(DiagnosticKind.UNRECOGNIZED_PREMISE_FORM));
	}

	@Test
	public void customPredicate() throws Exception {
		assertThat(parse("fresh(x, y)"),
				is(new CustomPredicate(SourceLocation.unknown(), "fresh", Arrays.asList(v("x"), v("y")))));
		assertThat(parse("ok()"),
				is(new CustomPredicate(SourceLocation.unknown(), "ok", Collections.emptyList())));
	}

	@Test
	public void membershipArity() throws Exception {
		SpecParseException e = parseError("x, y ∈ Γ");
		assertThat(e.getIssue().getKind(), is(DiagnosticKind.INVALID_MEMBERSHIP_ARITY));
	}

	@Test
	public void multipleRelationSymbols() throws Exception {
		SpecParseException e = parseError("τ = σ = ρ");
		assertThat(e.getIssue().getKind(), is(DiagnosticKind.MULTIPLE_RELATION_SYMBOLS));
		assertThat(e.getIssue().getLocation().getStartColumn(), is(7));
		assertThat(parseError("x ∈ Γ = τ").getIssue().getKind(), is(DiagnosticKind.MULTIPLE_RELATION_SYMBOLS));
	}

	@Test
	public void ambiguousWithJudgment() throws Exception {
		String text = "Γ ⊢ τ = σ";
		try {
			PremiseParser.parseTypeRelation(SpecLexer.tokenize(text), SourceLocation.unknown());
			fail("expected a parse error");
		} catch (SpecParseException e) {
			assertThat(e.getIssue().getKind(), is(DiagnosticKind.AMBIGUOUS_WITH_JUDGMENT));
			assertThat(e.getIssue().getLocation().getStartColumn(), is(3));
		}
	}

	@Test
	public void predicateErrors() throws Exception {
		SpecParseException name = parseError("is_fresh(x)");
		assertThat(name.getIssue().getKind(), is(DiagnosticKind.INVALID_PREDICATE_NAME));
		assertThat(name.getIssue().getMessage(), is("invalid predicate name in 'is_fresh'"));

		SpecParseException argument = parseError("fresh(x, τ -> σ)");
		assertThat(argument.getIssue().getKind(), is(DiagnosticKind.INVALID_PREDICATE_ARGUMENT));
		assertThat(argument.getIssue().getMessage(), is("predicate argument is not a variable in 'τ -> σ'"));
	}

	@Test
	public void unrecognizedForm() throws Exception {
		SpecParseException e = parseError("x y");
		assertThat(e.getIssue().getKind(), is(DiagnosticKind.UNRECOGNIZED_PREMISE_FORM));
		assertThat(e.getIssue().getMessage(), is("unrecognized premise in 'x y'"));
		assertThat(parseError("fresh(x) y").getIssue().getKind(), is(DiagnosticKind.UNRECOGNIZED_PREMISE_FORM));
	}

	@Test
	public void judgmentErrors() throws Exception {
		assertThat(parseError("Γ ⊢ e").getIssue().getKind(), is(DiagnosticKind.MULTIPLE_JUDGMENT_SYMBOLS));
		assertThat(parseError("Γ ⊢ e : τ : σ").getIssue().getKind(), is(DiagnosticKind.MULTIPLE_JUDGMENT_SYMBOLS));
		assertThat(parseError("Γ ⊢ ⊢ e : τ").getIssue().getKind(), is(DiagnosticKind.MULTIPLE_JUDGMENT_SYMBOLS));

		SpecParseException twoExpressions = parseError("Γ ⊢ e f : τ");
		assertThat(twoExpressions.getIssue().getKind(), is(DiagnosticKind.MALFORMED_JUDGMENT));
		assertThat(twoExpressions.getIssue().getMessage(),
				is("malformed typing judgment: expected a single variable between ⊢ and : in 'Γ ⊢ e f : τ'"));
		assertThat(parseError("Γ ⊢ e :").getIssue().getKind(), is(DiagnosticKind.MALFORMED_JUDGMENT));
	}
}

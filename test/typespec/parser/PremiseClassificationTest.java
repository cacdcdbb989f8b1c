package typespec.parser;

import static org.hamcrest.CoreMatchers.*;
import static org.junit.Assert.*;

import java.util.Arrays;
import java.util.EnumSet;
import java.util.List;
import java.util.Set;

import org.junit.Test;
import org.junit.runner.RunWith;
import org.junit.runners.Parameterized;
import org.junit.runners.Parameterized.Parameters;

import typespec.errors.DiagnosticKind;
import typespec.lexer.SpecLexerException;
import typespec.model.typing.Premise;
import typespec.model.typing.TypingJudgment;

/**
 * Whatever else is wrong with it, a fragment containing ⊢ is never taken for a membership, a type
 * relation or a predicate.
 */
@RunWith(Parameterized.class)
public class PremiseClassificationTest {

	private static final Set<DiagnosticKind> OTHER_FORMS = EnumSet.of(
			DiagnosticKind.INVALID_MEMBERSHIP_ARITY,
			DiagnosticKind.MULTIPLE_RELATION_SYMBOLS,
			DiagnosticKind.AMBIGUOUS_WITH_JUDGMENT,
			DiagnosticKind.INVALID_PREDICATE_NAME,
			DiagnosticKind.INVALID_PREDICATE_ARGUMENT,
			DiagnosticKind.UNRECOGNIZED_PREMISE_FORM);

	@Parameters(name = "{0}")
	public static List<Object[]> data() {
		return Arrays.asList(new Object[][] {
				{ "Γ ⊢ e : τ" },
				{ "Γ,x:τ ⊢ e : σ" },
				{ "Γ, x:τ, y:σ ⊢ e : ρ" },
				{ "Γ ⊢ e" },
				{ "Γ ⊢ e : τ : σ" },
				{ "Γ ⊢ ⊢ e : τ" },
				{ "⊢ e : τ" },
				{ "x ∈ Γ ⊢ e : τ" },
				{ "τ = σ ⊢ e : τ" },
				{ "fresh(x) ⊢ e : τ" },
				{ "Γ ⊢ e : τ = σ" },
				{ "Γ ⊢ x ∈ Γ" },
				{ "Γ ⊢ e f : τ" },
				{ "Γ ⊢ e :" },
		});
	}

	private final String fragment;

	public PremiseClassificationTest(String fragment) {
		this.fragment = fragment;
	}

	@Test
	public void test() throws SpecLexerException {
		try {
			Premise premise = PremiseParserTest.parse(fragment);
			assertThat(premise, instanceOf(TypingJudgment.class));
		} catch (SpecParseException e) {
			assertThat(OTHER_FORMS.contains(e.getIssue().getKind()), is(false));
		}
	}
}

package typespec.formatters;

import static org.hamcrest.CoreMatchers.*;
import static org.junit.Assert.*;

import org.junit.Test;

import typespec.errors.TopLevelIssueContext;
import typespec.trans.passes.parse.SpecParsingPass;

public class DeclarationFormattingVisitorTest {

	private static String format(String text) {
		return SpecParsingPass.perform(new TopLevelIssueContext(), text, false).get().toString();
	}

	@Test
	public void axiomHasMinimumBar() {
		assertThat(format("------- (unit)\nUnit"), is("---- (unit)\nUnit\n"));
	}

	@Test
	public void barSpansPremises() {
		assertThat(format("Γ ⊢ f : τ->σ,Γ ⊢ a : τ\n-- (app)\nσ"),
				is("Γ ⊢ f : τ -> σ, Γ ⊢ a : τ\n" + "-".repeat(25) + " (app)\nσ\n"));
	}

	@Test
	public void barSpansConclusion() {
		assertThat(format("x ∈ Γ\n- (var)\nΓ ⊢ x : τ -> τ"),
				is("x ∈ Γ\n" + "-".repeat(14) + " (var)\nΓ ⊢ x : τ -> τ\n"));
	}

	@Test
	public void productionsAndComments() {
		assertThat(format("// terms\nTerm ::= Var|App\nVar(var) ::= /[a-z]+/[x]"),
				is("// terms\n\nTerm ::= Var | App\n\nVar(var) ::= /[a-z]+/[x]\n"));
	}

	@Test
	public void arrowsAssociateToTheRight() {
		assertThat(format("---- (r)\nτ -> σ -> ρ"), is("-".repeat(11) + " (r)\nτ -> σ -> ρ\n"));
		assertThat(format("---- (r)\n(τ -> σ) -> ρ"), is("-".repeat(13) + " (r)\n(τ -> σ) -> ρ\n"));
	}
}

package typespec.trans.passes.validation;

import static org.hamcrest.CoreMatchers.*;
import static org.junit.Assert.*;

import java.util.Arrays;
import java.util.List;

import org.junit.Test;
import org.junit.runner.RunWith;
import org.junit.runners.Parameterized;
import org.junit.runners.Parameterized.Parameters;

import typespec.TypeSpecChecker;
import typespec.ValidationResult;
import typespec.errors.Diagnostic;
import typespec.errors.DiagnosticKind;

@RunWith(Parameterized.class)
public class VariableFormatTest {

	@Parameters(name = "{0}")
	public static List<Object[]> data() {
		return Arrays.asList(new Object[][] {
				{ "x₁", true },
				{ "τ₂", true },
				{ "α₁₂₃", true },
				{ "Δ", true },
				{ "x1", false },
				{ "τ_1", false },
				{ "xy", false },
				{ "var", false },
		});
	}

	private final String variable;
	private final boolean accepted;

	public VariableFormatTest(String variable, boolean accepted) {
		this.variable = variable;
		this.accepted = accepted;
	}

	@Test
	public void test() {
		String text = "Thing(thing) ::= Term[" + variable + "]\n\n" +
				"Γ ⊢ " + variable + " : Unit\n" +
				"------- (thing)\n" +
				"Unit";
		ValidationResult result = TypeSpecChecker.parseAndValidate(text);
		if (accepted) {
			assertThat(result.getDiagnostics().toString(), result.isValid(), is(true));
			return;
		}
		assertThat(result.isValid(), is(false));
		// once where the production binds it, once where the rule uses it
		assertThat(result.getDiagnostics().size(), is(2));
		for (Diagnostic diagnostic : result.getDiagnostics()) {
			assertThat(diagnostic.getKind(), is(DiagnosticKind.INVALID_VARIABLE_FORMAT));
		}
		assertThat(result.getDiagnostics().get(0).getMessage(),
				is("1:23: invalid variable " + variable + " in typing rule (thing)"));
	}
}

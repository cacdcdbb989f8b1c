package typespec.formatters;

import static org.hamcrest.CoreMatchers.*;
import static org.junit.Assert.*;

import java.io.IOException;
import java.util.Arrays;
import java.util.List;

import org.junit.Test;
import org.junit.runner.RunWith;
import org.junit.runners.Parameterized;
import org.junit.runners.Parameterized.Parameters;

import typespec.TypeSpecCheckerTest;
import typespec.errors.TopLevelIssueContext;
import typespec.model.Document;
import typespec.trans.passes.parse.SpecParsingPass;

@RunWith(Parameterized.class)
public class RoundTripTest {

	@Parameters(name = "{0}")
	public static List<Object[]> data() throws IOException {
		return Arrays.asList(
				new Object[] {"stlc", TypeSpecCheckerTest.fixture("stlc.spec")},
				new Object[] {"pair", String.join("\n",
						"Pair(pair) ::= '(' Term[a] ',' Term[b] ')'",
						"",
						"Γ ⊢ a : τ, Γ ⊢ b : σ",
						"--- (pair)",
						"Pair<τ, σ>")},
				new Object[] {"relations and predicates", String.join("\n",
						"Sub(sub) ::= Term[e]",
						"",
						"Γ ⊢ e : σ, σ <: τ, distinct(e, σ), e ∈ Γ",
						"------------ (sub)",
						"τ")},
				new Object[] {"judgment conclusion", String.join("\n",
						"Γ, x:τ, y:List<σ> ⊢ e : σ",
						"---- (j)",
						"Γ ⊢ e : (τ -> σ) -> τ")},
				new Object[] {"alternatives and trailing comment", String.join("\n",
						"Num ::= | /[0-9]+/",
						"  | 'zero'[z]",
						"// digits only",
						"Digit(digit) ::= /[0-9]/[d] Num")},
				new Object[] {"nested generics", String.join("\n",
						"Map(map) ::= Term[m]",
						"",
						"Γ ⊢ m : Map<K, List<V>>, K = Key",
						"---- (map)",
						"Map<K, List<V>> -> Unit")}
		);
	}

	private final String text;

	public RoundTripTest(String name, String text) {
		this.text = text;
	}

	private static Document parse(String text) {
		TopLevelIssueContext ctx = new TopLevelIssueContext();
		Document document = SpecParsingPass.perform(ctx, text, false).get();
		assertThat(ctx.format(), ctx.hasErrors(), is(false));
		return document;
	}

	@Test
	public void printedDocumentParsesBackToEqualDocument() {
		Document original = parse(text);
		Document reparsed = parse(original.toString());
		assertThat(reparsed, is(original));
	}

	@Test
	public void printingIsStable() {
		String printed = parse(text).toString();
		assertThat(parse(printed).toString(), is(printed));
	}
}

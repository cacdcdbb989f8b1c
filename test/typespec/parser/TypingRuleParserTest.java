package typespec.parser;

import static org.hamcrest.CoreMatchers.*;
import static org.junit.Assert.*;

import java.util.List;

import org.junit.Test;

import typespec.errors.DiagnosticKind;
import typespec.lexer.SpecLexer;
import typespec.lexer.SpecLexerException;
import typespec.lexer.SpecToken;
import typespec.model.typing.ContextLookupConclusion;
import typespec.model.typing.JudgmentConclusion;
import typespec.model.typing.Membership;
import typespec.model.typing.SemanticVar;
import typespec.model.typing.TypeConclusion;
import typespec.model.typing.TypeRelation;
import typespec.model.typing.TypingJudgment;
import typespec.model.typing.TypingRule;
import typespec.util.SourceLocation;

public class TypingRuleParserTest {

	private static RuleSyntaxIssue ruleError(String text) throws SpecLexerException {
		try {
			TypingRuleParser.parseTypingRule(text);
		} catch (SpecParseException e) {
			return (RuleSyntaxIssue) e.getIssue();
		}
		fail("expected a rule syntax error");
		return null;
	}

	@Test
	public void variableRule() throws Exception {
		TypingRule rule = TypingRuleParser.parseTypingRule("x ∈ Γ\n------------ (var)\nΓ(x)");
		assertThat(rule.getRuleName(), is("var"));
		assertThat(rule.getRuleNameLocation().getStartLine(), is(2));
		assertThat(rule.getRuleNameLocation().getStartColumn(), is(15));
		assertThat(rule.getPremises().size(), is(1));
		assertThat(rule.getPremises().get(0), instanceOf(Membership.class));
		assertThat(rule.getConclusion(), is(new ContextLookupConclusion(SourceLocation.unknown(),
				new SemanticVar(SourceLocation.unknown(), "x"))));
	}

	@Test
	public void applicationRule() throws Exception {
		TypingRule rule = TypingRuleParser.parseTypingRule("Γ ⊢ f : τ -> σ, Γ ⊢ a : τ\n-------------- (app)\nσ");
		assertThat(rule.getPremises().size(), is(2));
		assertThat(rule.getPremises().get(0), instanceOf(TypingJudgment.class));
		assertThat(rule.getPremises().get(1), instanceOf(TypingJudgment.class));
		assertThat(rule.getConclusion(), instanceOf(TypeConclusion.class));
		assertThat(rule.getConclusion().toString(), is("σ"));
	}

	@Test
	public void premisesOverSeveralLines() throws Exception {
		TypingRule rule = TypingRuleParser.parseTypingRule("Γ ⊢ f : τ -> σ,\nΓ ⊢ a : τ\n----- (app)\nσ");
		assertThat(rule.getPremises().size(), is(2));
	}

	@Test
	public void judgmentConclusion() throws Exception {
		TypingRule rule = TypingRuleParser.parseTypingRule("Γ, x:τ ⊢ e : σ\n----- (abs)\nΓ ⊢ λ : τ -> σ");
		assertThat(rule.getConclusion(), instanceOf(JudgmentConclusion.class));
	}

	@Test
	public void axiom() throws Exception {
		TypingRule rule = TypingRuleParser.parseTypingRule("------ (unit)\nUnit");
		assertThat(rule.isAxiom(), is(true));
		assertThat(rule.getConclusion().toString(), is("Unit"));
	}

	@Test
	public void commentsAndBlankLinesAreIgnored() throws Exception {
		TypingRule rule = TypingRuleParser.parseTypingRule("// lookup\nx ∈ Γ\n\n----- (var)\nΓ(x)");
		assertThat(rule.getPremises().size(), is(1));
	}

	@Test
	public void missingBar() throws Exception {
		RuleSyntaxIssue issue = ruleError("x ∈ Γ\nΓ(x)");
		assertThat(issue.getKind(), is(DiagnosticKind.MISSING_BAR));
		assertThat(issue.getLocation().getStartLine(), is(1));
		assertThat(issue.getMessage(), is("missing inference bar in 'x ∈ Γ'"));
	}

	@Test
	public void missingRuleName() throws Exception {
		assertThat(ruleError("x ∈ Γ\n------\nΓ(x)").getKind(), is(DiagnosticKind.MISSING_RULE_NAME));
		assertThat(ruleError("x ∈ Γ\n------ (var x)\nΓ(x)").getKind(), is(DiagnosticKind.MISSING_RULE_NAME));
		assertThat(ruleError("x ∈ Γ\n------ ()\nΓ(x)").getKind(), is(DiagnosticKind.MISSING_RULE_NAME));
	}

	@Test
	public void emptyConclusion() throws Exception {
		RuleSyntaxIssue issue = ruleError("x ∈ Γ\n------ (var)");
		assertThat(issue.getKind(), is(DiagnosticKind.EMPTY_CONCLUSION));
		assertThat(issue.getLocation().getStartLine(), is(2));
	}

	@Test
	public void premiseErrorsPropagate() throws Exception {
		try {
			TypingRuleParser.parseTypingRule("τ = σ = ρ\n----- (eq)\nτ");
			fail("expected a parse error");
		} catch (SpecParseException e) {
			assertThat(e.getIssue().getKind(), is(DiagnosticKind.MULTIPLE_RELATION_SYMBOLS));
		}
	}

	@Test
	public void splitPremisesKeepsContextsTogether() throws Exception {
		List<List<SpecToken>> parts = TypingRuleParser.splitPremises(SpecLexer.tokenize("Γ, x:τ ⊢ e : σ, y ∈ Γ"));
		assertThat(parts.size(), is(2));
		assertThat(ParseTools.render(parts.get(0)), is("Γ, x:τ ⊢ e : σ"));
		assertThat(ParseTools.render(parts.get(1)), is("y ∈ Γ"));

		parts = TypingRuleParser.splitPremises(SpecLexer.tokenize("x ∈ Γ, Γ, y:τ, z:σ ⊢ e : ρ"));
		assertThat(parts.size(), is(2));
		assertThat(ParseTools.render(parts.get(1)), is("Γ, y:τ, z:σ ⊢ e : ρ"));

		parts = TypingRuleParser.splitPremises(SpecLexer.tokenize("τ = σ, fresh(x, y), ρ <: σ"));
		assertThat(parts.size(), is(3));
		assertThat(ParseTools.render(parts.get(1)), is("fresh(x, y)"));

		assertThat(TypingRuleParser.splitPremises(SpecLexer.tokenize("")).isEmpty(), is(true));
	}

	@Test
	public void premiseInstances() throws Exception {
		TypingRule rule = TypingRuleParser.parseTypingRule("τ <: σ, Γ ⊢ e : τ\n----- (sub)\nσ");
		assertThat(rule.getPremises().get(0), instanceOf(TypeRelation.class));
		assertThat(rule.getPremises().get(1), instanceOf(TypingJudgment.class));
	}
}

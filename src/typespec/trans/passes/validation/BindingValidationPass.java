package typespec.trans.passes.validation;

import java.util.ArrayList;
import java.util.Collections;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.logging.Logger;
import java.util.stream.Stream;

import typespec.ValidationPolicy;
import typespec.errors.IssueContext;
import typespec.model.Document;
import typespec.model.RulePair;
import typespec.model.ValidatedDocument;
import typespec.model.grammar.ProductionRule;
import typespec.model.typing.ConclusionVisitor;
import typespec.model.typing.ContextExtension;
import typespec.model.typing.ContextLookupConclusion;
import typespec.model.typing.JudgmentConclusion;
import typespec.model.typing.Premise;
import typespec.model.typing.SemanticVar;
import typespec.model.typing.TypeConclusion;
import typespec.model.typing.TypingContext;
import typespec.model.typing.TypingRule;
import typespec.scope.BindingEnvironment;
import typespec.scope.RuleNameTable;

/**
 * Checks a parsed document:
 *
 *   * every typing rule is named by exactly one production, and every production naming a typing
 *     rule has exactly one
 *   * every variable a typing rule uses is bound by its production or by a context extension in
 *     the rule itself
 *   * every variable is spelled as one Latin or Greek letter with optional subscript digits
 *
 * Every problem is reported; nothing stops the pass early. Only the first typing rule of a name is
 * checked for bindings, and only against the first production that declares the name.
 */
public class BindingValidationPass {
	private BindingValidationPass() {}

	private static final Logger logger = Logger.getLogger(BindingValidationPass.class.getName());

	public static ValidatedDocument perform(IssueContext ctx, Document document, ValidationPolicy policy) {
		return perform(ctx, document, policy, Collections.emptySet());
	}

	/**
	 * @param unparsedRuleNames rule names of declarations that failed to parse; their counterparts are
	 *                          not reported as unmatched or missing
	 */
	public static ValidatedDocument perform(IssueContext ctx, Document document, ValidationPolicy policy,
	                                        Set<String> unparsedRuleNames) {
		// built in full before any typing rule is looked up
		RuleNameTable table = RuleNameTable.build(document.getProductionRules());

		for (String ruleName : table.getRuleNames()) {
			List<ProductionRule> claimants = table.lookup(ruleName);
			for (int i = 1; i < claimants.size(); ++i) {
				ctx.error(new AmbiguousRuleNameIssue(claimants.get(i), claimants.get(0)));
			}
		}
		for (ProductionRule production : table.getProductions()) {
			for (SemanticVar variable : BindingEnvironment.of(production).getVariables()) {
				if (!variable.isWellFormed()) {
					ctx.error(new InvalidVariableFormatIssue(variable, production.getTypingRuleName().orElse(null)));
				}
			}
		}

		Map<String, TypingRule> rulesByName = new LinkedHashMap<>();
		for (TypingRule rule : document.getTypingRules()) {
			if (table.lookup(rule.getRuleName()).isEmpty()) {
				if (!unparsedRuleNames.contains(rule.getRuleName())) {
					ctx.error(new UnmatchedRuleNameIssue(rule));
				}
				continue;
			}
			TypingRule first = rulesByName.putIfAbsent(rule.getRuleName(), rule);
			if (first != null) {
				ctx.error(new DuplicateTypingRuleIssue(rule, first));
			}
		}
		for (String ruleName : table.getRuleNames()) {
			if (!rulesByName.containsKey(ruleName) && !unparsedRuleNames.contains(ruleName)) {
				ctx.error(new MissingTypingRuleIssue(table.lookup(ruleName).get(0)));
			}
		}

		Map<String, RulePair> pairs = new LinkedHashMap<>();
		Map<String, BindingEnvironment> environments = new LinkedHashMap<>();
		for (TypingRule rule : rulesByName.values()) {
			ProductionRule production = table.lookup(rule.getRuleName()).get(0);
			pairs.put(rule.getRuleName(), new RulePair(production, rule));
			environments.put(rule.getRuleName(), BindingEnvironment.of(production));
		}

		// rules are independent of each other once the table is complete
		Stream<RulePair> stream = policy.isParallel()
				? new ArrayList<>(pairs.values()).parallelStream()
				: pairs.values().stream();
		stream.forEach(pair -> checkRule(ctx, pair.getTypingRule(),
				environments.get(pair.getTypingRule().getRuleName()), policy));

		logger.fine("checked " + pairs.size() + " typing rules against " + table.getProductions().size() +
				" productions");
		return new ValidatedDocument(document, pairs, environments);
	}

	private static void checkRule(IssueContext ctx, TypingRule rule, BindingEnvironment environment,
	                              ValidationPolicy policy) {
		List<VariableUse> uses = new ArrayList<>();
		for (Premise premise : rule.getPremises()) {
			premise.accept(new PremiseVariableCollectionVisitor(uses));
		}
		rule.getConclusion().accept(new ConclusionVariableCollectionVisitor(uses));

		Set<SemanticVar> allowed = new HashSet<>(environment.getVariables());
		Set<SemanticVar> usedAsExpression = new HashSet<>();
		Set<SemanticVar> usedInType = new HashSet<>();
		for (VariableUse use : uses) {
			switch (use.getRole()) {
				case EXTENSION:
					allowed.add(use.getVariable());
					break;
				case EXPRESSION:
					usedAsExpression.add(use.getVariable());
					break;
				case TYPE:
					usedInType.add(use.getVariable());
					break;
			}
		}
		if (policy.allowsFreshTypeVariables()) {
			usedInType.removeAll(usedAsExpression);
			allowed.addAll(usedInType);
		}

		String ruleName = rule.getRuleName();
		Set<SemanticVar> reportedFormat = new HashSet<>();
		Set<SemanticVar> reportedUnbound = new HashSet<>();
		for (VariableUse use : uses) {
			SemanticVar variable = use.getVariable();
			if (!variable.isWellFormed() && reportedFormat.add(variable)) {
				ctx.error(new InvalidVariableFormatIssue(variable, ruleName));
			}
			if (!allowed.contains(variable) && reportedUnbound.add(variable)) {
				ctx.error(new UnboundVariableIssue(variable, ruleName));
			}
		}

		if (policy.getContextRebinding() == ValidationPolicy.ContextRebinding.REJECT) {
			for (TypingContext context : contextsOf(rule)) {
				Set<SemanticVar> seen = new HashSet<>();
				for (ContextExtension extension : context.getExtensions()) {
					if (!seen.add(extension.getVariable())) {
						ctx.error(new DuplicateContextBindingIssue(extension.getVariable(), ruleName));
					}
				}
			}
		}
	}

	private static List<TypingContext> contextsOf(TypingRule rule) {
		List<TypingContext> contexts = new ArrayList<>();
		ContextCollectionVisitor visitor = new ContextCollectionVisitor(contexts);
		for (Premise premise : rule.getPremises()) {
			premise.accept(visitor);
		}
		rule.getConclusion().accept(new ConclusionVisitor<Void, RuntimeException>() {
			@Override
			public Void visit(TypeConclusion typeConclusion) {
				return null;
			}

			@Override
			public Void visit(JudgmentConclusion judgmentConclusion) {
				return judgmentConclusion.getJudgment().accept(visitor);
			}

			@Override
			public Void visit(ContextLookupConclusion contextLookupConclusion) {
				return null;
			}
		});
		return contexts;
	}
}

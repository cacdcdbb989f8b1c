package typespec.scope;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.stream.Collectors;

import typespec.model.grammar.ProductionRule;

/**
 * All productions of a document in document order, indexed by the typing rule name they declare.
 * Built once before any typing rule is checked against it and never changed afterwards.
 */
public class RuleNameTable {
	private final List<ProductionRule> productions;
	private final Map<String, List<Integer>> slotsByRuleName;

	private RuleNameTable(List<ProductionRule> productions, Map<String, List<Integer>> slotsByRuleName) {
		this.productions = productions;
		this.slotsByRuleName = slotsByRuleName;
	}

	public static RuleNameTable build(List<ProductionRule> productions) {
		List<ProductionRule> arena = Collections.unmodifiableList(new ArrayList<>(productions));
		Map<String, List<Integer>> index = new LinkedHashMap<>();
		for (int slot = 0; slot < arena.size(); ++slot) {
			int s = slot;
			arena.get(slot).getTypingRuleName()
					.ifPresent(name -> index.computeIfAbsent(name, k -> new ArrayList<>()).add(s));
		}
		index.replaceAll((name, slots) -> Collections.unmodifiableList(slots));
		return new RuleNameTable(arena, Collections.unmodifiableMap(index));
	}

	public List<ProductionRule> getProductions() {
		return productions;
	}

	/**
	 * @return the typing rule names declared by productions, in order of first declaration
	 */
	public Set<String> getRuleNames() {
		return slotsByRuleName.keySet();
	}

	/**
	 * @return every production declaring ruleName, in document order
	 */
	public List<ProductionRule> lookup(String ruleName) {
		return slotsByRuleName.getOrDefault(ruleName, Collections.emptyList()).stream()
				.map(productions::get)
				.collect(Collectors.toList());
	}
}

package typespec.scope;

import static org.hamcrest.CoreMatchers.*;
import static org.junit.Assert.*;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collections;
import java.util.List;

import org.junit.Test;

import typespec.model.grammar.ProductionRule;
import typespec.parser.ProductionParser;

public class RuleNameTableTest {

	private static List<ProductionRule> productions(String... lines) throws Exception {
		List<ProductionRule> result = new ArrayList<>();
		for (String line : lines) {
			result.add(ProductionParser.parseProduction(line));
		}
		return result;
	}

	@Test
	public void indexesByRuleName() throws Exception {
		List<ProductionRule> productions = productions(
				"Term ::= Variable | Lambda",
				"Variable(var) ::= /[a-z]+/[x]",
				"Lambda(abs) ::= 'λ' Variable[x] '.' Term[e]");
		RuleNameTable table = RuleNameTable.build(productions);

		assertThat(table.getProductions(), is(productions));
		assertThat(new ArrayList<>(table.getRuleNames()), is(Arrays.asList("var", "abs")));
		assertThat(table.lookup("var"), is(Collections.singletonList(productions.get(1))));
		assertThat(table.lookup("abs"), is(Collections.singletonList(productions.get(2))));
		assertThat(table.lookup("app").isEmpty(), is(true));
	}

	@Test
	public void keepsEveryClaimantInDocumentOrder() throws Exception {
		List<ProductionRule> productions = productions(
				"Name(var) ::= /[A-Z]+/[x]",
				"Term ::= Name",
				"Variable(var) ::= /[a-z]+/[x]");
		RuleNameTable table = RuleNameTable.build(productions);

		assertThat(table.lookup("var"), is(Arrays.asList(productions.get(0), productions.get(2))));
		assertThat(table.getRuleNames().size(), is(1));
	}

	@Test
	public void isNotAffectedByLaterChangesToItsInput() throws Exception {
		List<ProductionRule> productions = productions("Variable(var) ::= /[a-z]+/[x]");
		RuleNameTable table = RuleNameTable.build(productions);
		productions.clear();

		assertThat(table.getProductions().size(), is(1));
		assertThat(table.lookup("var").size(), is(1));
	}

	@Test(expected = UnsupportedOperationException.class)
	public void cannotBeModified() throws Exception {
		RuleNameTable table = RuleNameTable.build(productions("Variable(var) ::= /[a-z]+/[x]"));
		table.getProductions().clear();
	}
}

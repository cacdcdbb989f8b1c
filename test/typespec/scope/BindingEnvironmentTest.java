package typespec.scope;

import static org.hamcrest.CoreMatchers.*;
import static org.junit.Assert.*;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;
import java.util.stream.Collectors;

import org.junit.Test;

import typespec.model.typing.SemanticVar;
import typespec.parser.ProductionParser;
import typespec.util.SourceLocation;

public class BindingEnvironmentTest {

	private static List<String> names(BindingEnvironment environment) {
		return environment.getVariables().stream().map(SemanticVar::getName).collect(Collectors.toList());
	}

	@Test
	public void collectsBindingsInOrder() throws Exception {
		BindingEnvironment environment = BindingEnvironment.of(ProductionParser.parseProduction(
				"Lambda(abs) ::= 'λ' Variable[x] ':' Type[τ] '.' Term[e]"));
		assertThat(environment.getProductionName(), is("Lambda"));
		assertThat(names(environment), is(Arrays.asList("x", "τ", "e")));
		assertThat(environment.contains(new SemanticVar(SourceLocation.unknown(), "τ")), is(true));
		assertThat(environment.contains(new SemanticVar(SourceLocation.unknown(), "σ")), is(false));
	}

	@Test
	public void mergesAlternatives() throws Exception {
		BindingEnvironment environment = BindingEnvironment.of(ProductionParser.parseProduction(
				"Literal(lit) ::= /[0-9]+/[n] | 'true'[b] | '-' /[0-9]+/[n]"));
		assertThat(names(environment), is(Arrays.asList("n", "b")));
	}

	@Test
	public void unboundProductionHasEmptyEnvironment() throws Exception {
		BindingEnvironment environment = BindingEnvironment.of(ProductionParser.parseProduction(
				"UnitValue(unit) ::= '(' ')'"));
		assertThat(new ArrayList<>(environment.getVariables()).isEmpty(), is(true));
		assertThat(environment.toString(), is("UnitValue[]"));
	}
}

package typespec.scope;

import java.util.Collections;
import java.util.LinkedHashSet;
import java.util.Set;

import typespec.model.grammar.ProductionRule;
import typespec.model.typing.SemanticVar;

/**
 * The semantic variables a production binds with `[var]`, in order of first occurrence. These are
 * the variables its typing rule may use without introducing them itself.
 */
public class BindingEnvironment {
	private final String productionName;
	private final Set<SemanticVar> variables;

	public BindingEnvironment(String productionName, Set<SemanticVar> variables) {
		this.productionName = productionName;
		this.variables = Collections.unmodifiableSet(new LinkedHashSet<>(variables));
	}

	public static BindingEnvironment of(ProductionRule production) {
		Set<SemanticVar> variables = new LinkedHashSet<>();
		production.getRHS().accept(new BindingCollectionVisitor(variables));
		return new BindingEnvironment(production.getName(), variables);
	}

	public String getProductionName() {
		return productionName;
	}

	public Set<SemanticVar> getVariables() {
		return variables;
	}

	public boolean contains(SemanticVar variable) {
		return variables.contains(variable);
	}

	@Override
	public String toString() {
		return productionName + variables;
	}
}

package typespec.model;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Optional;

import typespec.scope.BindingEnvironment;

/**
 * A document that passed validation, with the binding environment each typing rule was checked
 * against.
 */
public class ValidatedDocument {
	private final Document document;
	private final Map<String, RulePair> pairs;
	private final Map<String, BindingEnvironment> environments;

	public ValidatedDocument(Document document, Map<String, RulePair> pairs,
	                         Map<String, BindingEnvironment> environments) {
		this.document = document;
		this.pairs = Collections.unmodifiableMap(new LinkedHashMap<>(pairs));
		this.environments = Collections.unmodifiableMap(new LinkedHashMap<>(environments));
	}

	public Document getDocument() {
		return document;
	}

	public Optional<RulePair> lookup(String ruleName) {
		return Optional.ofNullable(pairs.get(ruleName));
	}

	public Optional<BindingEnvironment> getEnvironment(String ruleName) {
		return Optional.ofNullable(environments.get(ruleName));
	}

	/**
	 * @return binding environments keyed by typing rule name, in document order
	 */
	public Map<String, BindingEnvironment> getEnvironments() {
		return environments;
	}
}

package typespec;

import org.json.JSONException;
import org.json.JSONObject;

/**
 * Validation choices the document language does not fix, plus how declarations are scheduled for
 * parsing.
 *
 * A policy can be read from a JSON object such as
 *
 * <pre>
 * {
 *   "contextRebinding": "reject",
 *   "freshTypeVariables": true,
 *   "parallel": false
 * }
 * </pre>
 *
 * where every field is optional.
 */
public class ValidationPolicy {

	public static final String CONTEXT_REBINDING_FIELD = "contextRebinding";
	public static final String FRESH_TYPE_VARIABLES_FIELD = "freshTypeVariables";
	public static final String PARALLEL_FIELD = "parallel";

	public enum ContextRebinding {
		// a later `x:τ` in the same context hides an earlier one
		SHADOW("shadow"),
		REJECT("reject");

		private final String configName;

		ContextRebinding(String configName) {
			this.configName = configName;
		}

		public String getConfigName() {
			return configName;
		}

		public static ContextRebinding fromConfigName(String name) throws TypeSpecOptionException {
			for (ContextRebinding value : values()) {
				if (value.configName.equals(name)) {
					return value;
				}
			}
			throw new TypeSpecOptionException(CONTEXT_REBINDING_FIELD + " must be \"shadow\" or \"reject\", not \"" +
					name + "\"");
		}
	}

	private final ContextRebinding contextRebinding;
	private final boolean freshTypeVariables;
	private final boolean parallel;

	public ValidationPolicy(ContextRebinding contextRebinding, boolean freshTypeVariables, boolean parallel) {
		this.contextRebinding = contextRebinding;
		this.freshTypeVariables = freshTypeVariables;
		this.parallel = parallel;
	}

	/**
	 * Shadowing contexts, no fresh type variables, sequential parsing.
	 */
	public static ValidationPolicy defaults() {
		return new ValidationPolicy(ContextRebinding.SHADOW, false, false);
	}

	public static ValidationPolicy fromJSON(JSONObject config) throws TypeSpecOptionException {
		ValidationPolicy defaults = defaults();
		try {
			ContextRebinding rebinding = config.has(CONTEXT_REBINDING_FIELD)
					? ContextRebinding.fromConfigName(config.getString(CONTEXT_REBINDING_FIELD))
					: defaults.contextRebinding;
			boolean fresh = config.has(FRESH_TYPE_VARIABLES_FIELD)
					? config.getBoolean(FRESH_TYPE_VARIABLES_FIELD)
					: defaults.freshTypeVariables;
			boolean parallel = config.has(PARALLEL_FIELD)
					? config.getBoolean(PARALLEL_FIELD)
					: defaults.parallel;
			return new ValidationPolicy(rebinding, fresh, parallel);
		} catch (JSONException e) {
			throw new TypeSpecOptionException(e.getMessage());
		}
	}

	public static ValidationPolicy fromJSON(String json) throws TypeSpecOptionException {
		JSONObject config;
		try {
			config = new JSONObject(json);
		} catch (JSONException e) {
			throw new TypeSpecOptionException("parsing error: " + e.getMessage());
		}
		return fromJSON(config);
	}

	public ValidationPolicy withContextRebinding(ContextRebinding contextRebinding) {
		return new ValidationPolicy(contextRebinding, freshTypeVariables, parallel);
	}

	public ValidationPolicy withFreshTypeVariables(boolean freshTypeVariables) {
		return new ValidationPolicy(contextRebinding, freshTypeVariables, parallel);
	}

	public ValidationPolicy withParallel(boolean parallel) {
		return new ValidationPolicy(contextRebinding, freshTypeVariables, parallel);
	}

	public ContextRebinding getContextRebinding() {
		return contextRebinding;
	}

	/**
	 * @return true if a variable that only occurs inside types may be left unbound
	 */
	public boolean allowsFreshTypeVariables() {
		return freshTypeVariables;
	}

	public boolean isParallel() {
		return parallel;
	}

	public JSONObject toJSON() {
		JSONObject json = new JSONObject();
		json.put(CONTEXT_REBINDING_FIELD, contextRebinding.getConfigName());
		json.put(FRESH_TYPE_VARIABLES_FIELD, freshTypeVariables);
		json.put(PARALLEL_FIELD, parallel);
		return json;
	}

	@Override
	public String toString() {
		return toJSON().toString();
	}
}

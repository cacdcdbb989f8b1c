package typespec.trans.passes.validation;

import typespec.model.typing.SemanticVar;

/**
 * One occurrence of a semantic variable in a typing rule, with the position it occurs in.
 */
public class VariableUse {

	public enum Role {
		// the subject of a judgment, a membership or a predicate argument
		EXPRESSION,
		// inside a type expression
		TYPE,
		// introduced by a context extension
		EXTENSION,
	}

	private final SemanticVar variable;
	private final Role role;

	public VariableUse(SemanticVar variable, Role role) {
		this.variable = variable;
		this.role = role;
	}

	public SemanticVar getVariable() {
		return variable;
	}

	public Role getRole() {
		return role;
	}
}

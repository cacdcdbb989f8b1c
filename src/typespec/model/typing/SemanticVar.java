package typespec.model.typing;

import java.util.regex.Pattern;

import typespec.model.TypeSpecNode;
import typespec.util.SourceLocation;

/**
 * A semantic variable as written, e.g. `x`, `τ₂` or `α₁₂₃`.
 *
 * Parsing accepts any name in variable position and keeps its text; whether the text has the
 * required shape (one Latin or Greek letter, then optional subscript digits) is checked by
 * {@link #isWellFormed()} during validation. Two variables are the same variable exactly when
 * they are spelled the same.
 */
public class SemanticVar extends TypeSpecNode {

	private static final Pattern WELL_FORMED = Pattern.compile("[a-zA-ZΑ-Ωα-ω][₀-₉]*");

	private final String name;

	public SemanticVar(SourceLocation location, String name) {
		super(location);
		this.name = name;
	}

	public static boolean isWellFormed(String name) {
		return WELL_FORMED.matcher(name).matches();
	}

	public boolean isWellFormed() {
		return isWellFormed(name);
	}

	public String getName() {
		return name;
	}

	public int getBase() {
		return name.codePointAt(0);
	}

	/**
	 * @return the trailing subscript digits, empty if there are none
	 */
	public String getSubscript() {
		int end = name.length();
		int start = end;
		while(start > 0 && name.charAt(start - 1) >= '₀' && name.charAt(start - 1) <= '₉') {
			--start;
		}
		return name.substring(start, end);
	}

	@Override
	public int hashCode() {
		return name.hashCode();
	}

	@Override
	public boolean equals(Object obj) {
		if (this == obj)
			return true;
		if (obj == null || getClass() != obj.getClass())
			return false;
		return name.equals(((SemanticVar) obj).name);
	}

	@Override
	public String toString() {
		return name;
	}
}

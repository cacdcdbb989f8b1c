package typespec.model.grammar;

import java.util.Objects;
import java.util.Optional;

import typespec.model.typing.SemanticVar;
import typespec.util.SourceLocation;

/**
 * A quoted literal such as 'λ' or a slash-delimited pattern such as /[0-9]+/, optionally bound
 * to a semantic variable: /[a-z]+/[x].
 */
public class Terminal extends GrammarExpr {

	public enum Kind {
		LITERAL,
		PATTERN,
	}

	private final Kind kind;
	// the source text including its delimiters
	private final String text;
	private final SemanticVar binding;

	public Terminal(SourceLocation location, Kind kind, String text, SemanticVar binding) {
		super(location);
		this.kind = kind;
		this.text = text;
		this.binding = binding;
	}

	public Kind getKind() {
		return kind;
	}

	public String getText() {
		return text;
	}

	/**
	 * @return the literal or pattern without its delimiters
	 */
	public String getContent() {
		return text.substring(1, text.length() - 1);
	}

	public Optional<SemanticVar> getBinding() {
		return Optional.ofNullable(binding);
	}

	@Override
	public <T, E extends Throwable> T accept(GrammarExprVisitor<T, E> v) throws E {
		return v.visit(this);
	}

	@Override
	public int hashCode() {
		return Objects.hash(kind, text, binding);
	}

	@Override
	public boolean equals(Object obj) {
		if (this == obj)
			return true;
		if (obj == null || getClass() != obj.getClass())
			return false;
		Terminal other = (Terminal) obj;
		return kind == other.kind && text.equals(other.text) && Objects.equals(binding, other.binding);
	}
}

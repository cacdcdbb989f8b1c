package typespec.model;

import typespec.util.SourceLocation;

/**
 * A run of `//` comment lines standing on their own between declarations.
 */
public class CommentDeclaration extends Declaration {
	private final String text;

	public CommentDeclaration(SourceLocation location, String text) {
		super(location);
		this.text = text;
	}

	/**
	 * @return the comment lines, each still starting with "//", joined by '\n'
	 */
	public String getText() {
		return text;
	}

	@Override
	public <T, E extends Throwable> T accept(DeclarationVisitor<T, E> v) throws E {
		return v.visit(this);
	}

	@Override
	public int hashCode() {
		return text.hashCode();
	}

	@Override
	public boolean equals(Object obj) {
		if (this == obj)
			return true;
		if (obj == null || getClass() != obj.getClass())
			return false;
		return text.equals(((CommentDeclaration) obj).text);
	}
}

package typespec.model;

import typespec.util.SourceLocatable;
import typespec.util.SourceLocation;

/**
 *
 * The base class for any node of a parsed spec document. Every node knows where it came from;
 * equality never looks at that location, so two parses of equivalent text compare equal.
 *
 */
public abstract class TypeSpecNode extends SourceLocatable {
	private final SourceLocation location;

	public TypeSpecNode(SourceLocation location) {
		this.location = location;
	}

	@Override
	public SourceLocation getLocation() {
		return location;
	}

	@Override
	public abstract int hashCode();

	@Override
	public abstract boolean equals(Object obj);

}

package typespec.lexer;

import typespec.util.SourceLocatable;
import typespec.util.SourceLocation;

public class SpecToken extends SourceLocatable {

	private final String value;
	private final SpecTokenType type;
	private final SourceLocation location;

	public SpecToken(String value, SpecTokenType type, SourceLocation location) {
		this.value = value;
		this.type = type;
		this.location = location;
	}

	@Override
	public SourceLocation getLocation() {
		return location;
	}

	public String getValue() {
		return value;
	}

	public SpecTokenType getType() {
		return type;
	}

	public boolean is(SpecTokenType type) {
		return this.type == type;
	}

	/**
	 * @return true if this token starts exactly where previous ends, with no whitespace in between
	 */
	public boolean follows(SpecToken previous) {
		return !location.isUnknown() && previous.getLocation().getEndOffset() == location.getStartOffset();
	}

	@Override
	public String toString() {
		return "SpecToken [value=" + value + ", type=" + type + ", location=" + location + "]";
	}

	@Override
	public int hashCode() {
		final int prime = 31;
		int result = 1;
		result = prime * result + ((location == null) ? 0 : location.hashCode());
		result = prime * result + ((type == null) ? 0 : type.hashCode());
		result = prime * result + ((value == null) ? 0 : value.hashCode());
		return result;
	}

	@Override
	public boolean equals(Object obj) {
		if (this == obj)
			return true;
		if (obj == null)
			return false;
		if (getClass() != obj.getClass())
			return false;
		SpecToken other = (SpecToken) obj;
		if (location == null) {
			if (other.location != null)
				return false;
		} else if (!location.equals(other.location))
			return false;
		if (type != other.type)
			return false;
		if (value == null) {
			return other.value == null;
		} else return value.equals(other.value);
	}

}

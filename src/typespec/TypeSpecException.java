package typespec;

/**
 * A typespec exception consisting of a prefix (type of error) and a message.
 */
public abstract class TypeSpecException extends RuntimeException {
	private final String msg;
	private final String prefix;

	public TypeSpecException(String prefix, String msg) {
		super(prefix.isEmpty() ? msg : prefix + ": " + msg);
		this.prefix = prefix;
		this.msg = msg;
	}

	public String getMsg() {
		return msg;
	}

	public String getPrefix() {
		return prefix;
	}
}

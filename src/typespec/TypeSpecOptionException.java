package typespec;

/**
 * A command-line option or configuration file value that cannot be used.
 */
public class TypeSpecOptionException extends TypeSpecException {

	private static final long serialVersionUID = 4410936212437985521L;
	private static final String prefix = "Option Error";

	public TypeSpecOptionException(String msg) {
		super(prefix, msg);
	}
}

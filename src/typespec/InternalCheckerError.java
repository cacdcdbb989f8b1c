package typespec;

/**
 * Thrown when the checker reaches a state its own invariants rule out, such as an IO error from a
 * StringWriter or a visitor meeting a node kind it was never given.
 */
public class InternalCheckerError extends RuntimeException {
	public InternalCheckerError(String reason) {
		super("internal checker error: " + reason);
	}

	public InternalCheckerError(String reason, Exception e) {
		super("internal checker error: " + reason, e);
	}
}

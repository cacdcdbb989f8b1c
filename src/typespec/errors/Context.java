package typespec.errors;

import java.util.Optional;

/**
 * Describes what the checker was working on when an issue was found.
 */
public abstract class Context {

	public abstract Optional<String> getRuleName();

	public abstract <T, E extends Throwable> T accept(ContextVisitor<T, E> ctx) throws E;

}

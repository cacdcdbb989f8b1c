package typespec.trans.passes.parse;

import java.util.Optional;

import typespec.errors.Context;
import typespec.errors.ContextVisitor;
import typespec.util.SourceLocation;

public class WhileParsingProduction extends Context {

	private final SourceLocation location;
	private final String ruleName;

	public WhileParsingProduction(SourceLocation location, String ruleName) {
		this.location = location;
		this.ruleName = ruleName;
	}

	public SourceLocation getLocation() {
		return location;
	}

	@Override
	public Optional<String> getRuleName() {
		return Optional.ofNullable(ruleName);
	}

	@Override
	public <T, E extends Throwable> T accept(ContextVisitor<T, E> ctx) throws E {
		return ctx.visit(this);
	}
}

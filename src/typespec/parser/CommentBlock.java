package typespec.parser;

import java.util.List;
import java.util.stream.Collectors;

import typespec.model.CommentDeclaration;

public class CommentBlock extends DeclarationBlock {

	public CommentBlock(List<SourceLine> lines) {
		super(lines);
	}

	@Override
	public CommentDeclaration parse() {
		return new CommentDeclaration(getLocation(),
				getLines().stream().map(SourceLine::getTrimmed).collect(Collectors.joining("\n")));
	}

	@Override
	public <T, E extends Throwable> T accept(DeclarationBlockVisitor<T, E> v) throws E {
		return v.visit(this);
	}
}

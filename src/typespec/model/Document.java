package typespec.model;

import java.io.IOException;
import java.io.StringWriter;
import java.util.Collections;
import java.util.List;
import java.util.stream.Collectors;

import typespec.InternalCheckerError;
import typespec.formatters.FormattingTools;
import typespec.formatters.IndentingWriter;
import typespec.model.grammar.ProductionRule;
import typespec.model.typing.TypingRule;
import typespec.util.SourceLocation;

/**
 * A parsed spec document: its declarations in source order.
 */
public class Document extends TypeSpecNode {
	private final List<Declaration> declarations;

	public Document(SourceLocation location, List<Declaration> declarations) {
		super(location);
		this.declarations = Collections.unmodifiableList(declarations);
	}

	public List<Declaration> getDeclarations() {
		return declarations;
	}

	public List<ProductionRule> getProductionRules() {
		return declarations.stream()
				.filter(d -> d instanceof ProductionRule)
				.map(d -> (ProductionRule) d)
				.collect(Collectors.toList());
	}

	public List<TypingRule> getTypingRules() {
		return declarations.stream()
				.filter(d -> d instanceof TypingRule)
				.map(d -> (TypingRule) d)
				.collect(Collectors.toList());
	}

	@Override
	public int hashCode() {
		return declarations.hashCode();
	}

	@Override
	public boolean equals(Object obj) {
		if (this == obj)
			return true;
		if (obj == null || getClass() != obj.getClass())
			return false;
		return declarations.equals(((Document) obj).declarations);
	}

	/**
	 * @return the document in the spec language; parsing it again gives an equal document
	 */
	@Override
	public String toString() {
		StringWriter writer = new StringWriter();
		try {
			FormattingTools.writeDocument(new IndentingWriter(writer), this);
		} catch (IOException e) {
			throw new InternalCheckerError("string writers should not throw IO errors", e);
		}
		return writer.toString();
	}
}

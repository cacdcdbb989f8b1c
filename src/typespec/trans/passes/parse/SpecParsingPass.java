package typespec.trans.passes.parse;

import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import java.util.logging.Logger;
import java.util.stream.Collectors;
import java.util.stream.Stream;

import typespec.InternalCheckerError;
import typespec.errors.Context;
import typespec.errors.Issue;
import typespec.errors.IssueContext;
import typespec.lexer.SpecLexerException;
import typespec.model.Declaration;
import typespec.model.Document;
import typespec.parser.CommentBlock;
import typespec.parser.DeclarationBlock;
import typespec.parser.DeclarationBlockVisitor;
import typespec.parser.DocumentParser;
import typespec.parser.ProductionBlock;
import typespec.parser.SpecParseException;
import typespec.parser.TypingRuleBlock;
import typespec.util.SourceLocation;

/**
 * Parses every declaration of a document. A declaration that fails to parse is reported and left
 * out of the resulting document; the others are unaffected by it.
 */
public class SpecParsingPass {
	private SpecParsingPass() {}

	private static final Logger logger = Logger.getLogger(SpecParsingPass.class.getName());

	/**
	 * @param parallel parse the declarations concurrently; the result and the reported issues do
	 *                 not depend on it
	 * @return the parsed document, or empty if the text has no declarations at all
	 */
	public static Optional<Document> perform(IssueContext ctx, String text, boolean parallel) {
		if (!DocumentParser.hasDeclarations(text)) {
			ctx.error(new EmptyDocumentIssue(new SourceLocation(0, 0, 1, 1, 1, 1)));
			return Optional.empty();
		}
		List<DeclarationBlock> blocks = DocumentParser.split(text);
		logger.fine("found " + blocks.size() + " declaration blocks");

		Stream<DeclarationBlock> stream = parallel ? blocks.parallelStream() : blocks.stream();
		// collecting keeps document order even for a parallel stream
		List<ParseOutcome> outcomes = stream.map(SpecParsingPass::parseBlock).collect(Collectors.toList());

		List<Declaration> declarations = new ArrayList<>();
		for (ParseOutcome outcome : outcomes) {
			if (outcome.declaration != null) {
				declarations.add(outcome.declaration);
			} else {
				ctx.withContext(outcome.block.accept(new ParsingContextVisitor())).error(outcome.failure);
			}
		}
		logger.fine("parsed " + declarations.size() + " of " + blocks.size() + " declaration blocks");
		SourceLocation location = blocks.isEmpty() ? SourceLocation.unknown()
				: blocks.get(0).getLocation().combine(blocks.get(blocks.size() - 1).getLocation());
		return Optional.of(new Document(location, declarations));
	}

	private static ParseOutcome parseBlock(DeclarationBlock block) {
		try {
			return new ParseOutcome(block, block.parse(), null);
		} catch (SpecLexerException e) {
			return new ParseOutcome(block, null, e.getIssue());
		} catch (SpecParseException e) {
			return new ParseOutcome(block, null, e.getIssue());
		}
	}

	private static final class ParseOutcome {
		final DeclarationBlock block;
		final Declaration declaration;
		final Issue failure;

		ParseOutcome(DeclarationBlock block, Declaration declaration, Issue failure) {
			this.block = block;
			this.declaration = declaration;
			this.failure = failure;
		}
	}

	private static final class ParsingContextVisitor extends DeclarationBlockVisitor<Context, RuntimeException> {
		@Override
		public Context visit(ProductionBlock productionBlock) {
			return new WhileParsingProduction(productionBlock.getLocation(), productionBlock.peekRuleName().orElse(null));
		}

		@Override
		public Context visit(TypingRuleBlock typingRuleBlock) {
			return new WhileParsingTypingRule(typingRuleBlock.getLocation(), typingRuleBlock.peekRuleName().orElse(null));
		}

		@Override
		public Context visit(CommentBlock commentBlock) {
			throw new InternalCheckerError("comment blocks always parse");
		}
	}
}

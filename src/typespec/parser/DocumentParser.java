package typespec.parser;

import java.util.ArrayList;
import java.util.List;

/**
 * Cuts a document into declaration blocks.
 *
 * Paragraphs are separated by blank lines. A paragraph with a `::=` line holds productions, one per
 * `::=` line plus the `|` lines that follow it, even across comment lines. Any other paragraph holds
 * a single typing rule. Lines starting with `//` become comment declarations wherever they appear.
 */
public final class DocumentParser {
	private DocumentParser() {}

	public static List<DeclarationBlock> split(String text) {
		List<DeclarationBlock> blocks = new ArrayList<>();
		List<SourceLine> paragraph = new ArrayList<>();
		for (SourceLine line : SourceLine.split(text)) {
			if (line.isBlank()) {
				splitParagraph(paragraph, blocks);
				paragraph = new ArrayList<>();
			} else {
				paragraph.add(line);
			}
		}
		splitParagraph(paragraph, blocks);
		return blocks;
	}

	/**
	 * @return false when the text has neither a production line nor an inference bar, so there is
	 * nothing that could be a declaration
	 */
	public static boolean hasDeclarations(String text) {
		for (SourceLine line : SourceLine.split(text)) {
			if (!line.isComment() && (line.startsProduction() || line.isBar())) {
				return true;
			}
		}
		return false;
	}

	private static void splitParagraph(List<SourceLine> paragraph, List<DeclarationBlock> blocks) {
		if (paragraph.isEmpty()) {
			return;
		}
		if (paragraph.stream().anyMatch(SourceLine::startsProduction)) {
			splitProductions(paragraph, blocks);
		} else {
			splitTypingRule(paragraph, blocks);
		}
	}

	private static void splitProductions(List<SourceLine> paragraph, List<DeclarationBlock> blocks) {
		int i = 0;
		while (i < paragraph.size()) {
			List<SourceLine> group = new ArrayList<>();
			if (paragraph.get(i).isComment()) {
				while (i < paragraph.size() && paragraph.get(i).isComment()) {
					group.add(paragraph.get(i++));
				}
				blocks.add(new CommentBlock(group));
				continue;
			}
			// a stray line that is not a production gets its own block and fails to parse as one
			group.add(paragraph.get(i++));
			// comments between a production and its `|` lines follow the production as their own block
			List<SourceLine> interleaved = new ArrayList<>();
			while (i < paragraph.size()) {
				int next = i;
				while (next < paragraph.size() && paragraph.get(next).isComment()) {
					++next;
				}
				if (next == paragraph.size() || !paragraph.get(next).isContinuation()) {
					break;
				}
				interleaved.addAll(paragraph.subList(i, next));
				group.add(paragraph.get(next));
				i = next + 1;
			}
			blocks.add(new ProductionBlock(group));
			if (!interleaved.isEmpty()) {
				blocks.add(new CommentBlock(interleaved));
			}
		}
	}

	private static void splitTypingRule(List<SourceLine> paragraph, List<DeclarationBlock> blocks) {
		List<SourceLine> leadingComments = new ArrayList<>();
		List<SourceLine> rule = new ArrayList<>();
		List<SourceLine> otherComments = new ArrayList<>();
		for (SourceLine line : paragraph) {
			if (!line.isComment()) {
				rule.add(line);
			} else if (rule.isEmpty()) {
				leadingComments.add(line);
			} else {
				otherComments.add(line);
			}
		}
		if (!leadingComments.isEmpty()) {
			blocks.add(new CommentBlock(leadingComments));
		}
		if (!rule.isEmpty()) {
			blocks.add(new TypingRuleBlock(rule));
		}
		if (!otherComments.isEmpty()) {
			blocks.add(new CommentBlock(otherComments));
		}
	}
}

package typespec.formatters;

import java.io.IOException;
import java.io.Writer;
import java.util.List;

import typespec.model.Declaration;
import typespec.model.Document;

public class FormattingTools {

	private FormattingTools() {}

	public interface Formatter<T>{
		void format(T param) throws IOException;
	}

	public static <T> void writeSeparated(Writer out, List<T> items, String separator, Formatter<T> writer)
			throws IOException {
		boolean isFirst = true;
		for(T item : items) {
			if(!isFirst) {
				out.write(separator);
			}
			isFirst = false;
			writer.format(item);
		}
	}

	public static <T> void writeCommaSeparated(Writer out, List<T> items, Formatter<T> writer) throws IOException {
		writeSeparated(out, items, ", ", writer);
	}

	/**
	 * Writes a document in the spec language, one blank line between declarations.
	 */
	public static void writeDocument(IndentingWriter out, Document document) throws IOException {
		DeclarationFormattingVisitor visitor = new DeclarationFormattingVisitor(out);
		List<Declaration> declarations = document.getDeclarations();
		for(int i = 0; i < declarations.size(); ++i) {
			if(i > 0) {
				out.newLine();
				out.newLine();
			}
			declarations.get(i).accept(visitor);
		}
		out.newLine();
	}
}

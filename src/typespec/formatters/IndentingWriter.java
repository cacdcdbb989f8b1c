package typespec.formatters;

import java.io.IOException;
import java.io.Writer;

/**
 * A Writer that prefixes every line after a newline with the current indentation.
 *
 * Line breaks are always written as a single '\n' so that formatted documents and diagnostic
 * reports are byte-identical across platforms.
 */
public class IndentingWriter extends Writer {

	private static final String LF = "\n";

	private final Writer out;
	private final int defaultIndent;
	private int indent = 0;
	private boolean shouldIndent = false;

	public static class Indent implements AutoCloseable {

		private final IndentingWriter writer;
		private final int spaces;

		public Indent(IndentingWriter writer, int spaces) {
			this.writer = writer;
			this.spaces = spaces;
		}

		@Override
		public void close() {
			writer.unindent(spaces);
		}

	}

	public IndentingWriter(Writer out) {
		this(out, 2);
	}

	public IndentingWriter(Writer out, int defaultIndent) {
		this.out = out;
		this.defaultIndent = defaultIndent;
	}

	public Indent indent(int spaces) {
		indent += spaces;
		return new Indent(this, spaces);
	}

	public Indent indent() {
		return indent(defaultIndent);
	}

	public void unindent(int spaces) {
		if(spaces > indent) {
			throw new IllegalStateException("can't unindent below 0");
		}
		indent -= spaces;
	}

	@Override
	public void close() throws IOException {
		out.close();
	}

	@Override
	public void flush() throws IOException {
		out.flush();
	}

	public void newLine() throws IOException {
		write(LF);
	}

	@Override
	public void write(char[] chars, int offset, int len) throws IOException {
		String data = String.valueOf(chars, offset, len);
		int start = 0;
		while(start < data.length()) {
			if(shouldIndent) {
				for(int i = 0; i < indent; ++i) {
					out.write(' ');
				}
				shouldIndent = false;
			}
			int next = data.indexOf(LF, start);
			if(next == -1) {
				out.write(data.substring(start));
				break;
			}
			out.write(data.substring(start, next + 1));
			start = next + 1;
			shouldIndent = true;
		}
	}

}

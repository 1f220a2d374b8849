package arisbe.formatters;

import java.io.IOException;
import java.io.Writer;

/**
 * A writer that prefixes every line after a newline with the current indentation. Lines are always
 * separated by '\n' so that generated EGIF text does not depend on the platform.
 */
public class IndentingWriter extends Writer {

	public static final String LINE_SEPARATOR = "\n";

	private final Writer out;
	private final int defaultIndent;
	private int indent = 0;
	private boolean shouldIndent = false;
	private boolean lineEmpty = true;

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
		this(out, 4);
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
			throw new RuntimeException("can't unindent below 0");
		}
		indent -= spaces;
	}

	public void newLine() throws IOException {
		write(LINE_SEPARATOR);
	}

	/**
	 * Writes a single space unless the current line is still empty.
	 */
	public void separate() throws IOException {
		if(!lineEmpty) {
			write(" ");
		}
	}

	@Override
	public void write(char[] chars, int offset, int len) throws IOException {
		String data = String.valueOf(chars, offset, len);
		int start = 0;
		while(start < data.length()) {
			if(shouldIndent && data.charAt(start) != '\n') {
				for(int i = 0; i < indent; ++i) {
					out.write(' ');
				}
				shouldIndent = false;
			}
			int next = data.indexOf(LINE_SEPARATOR, start);
			if(next == -1) {
				out.write(data, start, data.length() - start);
				lineEmpty = false;
				break;
			}
			out.write(data, start, next + 1 - start);
			start = next + 1;
			shouldIndent = true;
			lineEmpty = true;
		}
	}

	@Override
	public void flush() throws IOException {
		out.flush();
	}

	@Override
	public void close() throws IOException {
		out.close();
	}

}

package arisbe.util;

import arisbe.Unreachable;
import arisbe.formatters.IndentingWriter;

import java.io.IOException;
import java.io.StringWriter;
import java.nio.file.Path;
import java.util.Objects;

/**
 * A span of EGIF text. Offsets are 0-based character offsets into the text that was lexed, line and column are
 * 1-based and refer to the start of the span. The file is null for text that did not come from a file.
 */
public class SourceLocation implements Comparable<SourceLocation> {
	private final Path file;
	private final int startOffset;
	private final int endOffset;
	private final int line;
	private final int column;

	public SourceLocation(Path file, int startOffset, int endOffset, int line, int column) {
		this.file = file;
		this.startOffset = startOffset;
		this.endOffset = endOffset;
		this.line = line;
		this.column = column;
	}

	public static SourceLocation unknown() {
		return new SourceLocation(null, -1, -1, -1, -1);
	}

	public boolean isUnknown() {
		return startOffset < 0;
	}

	public String prettyString() {
		StringWriter sw = new StringWriter();
		try {
			writePretty(new IndentingWriter(sw));
		} catch (IOException e) {
			throw new Unreachable(e); // string ops shouldn't throw IO exceptions
		}
		return sw.getBuffer().toString();
	}

	public void writePretty(IndentingWriter out) throws IOException {
		if(isUnknown()) {
			out.write("at unknown source location");
			return;
		}
		out.write("at " + line + ":" + column + " (offset " + startOffset + ")");
		if(file != null) {
			out.write(" in file " + file);
		}
	}

	/**
	 * Writes the line of text this location points into, followed by a line of carets under the span.
	 */
	public void writeExcerpt(IndentingWriter out, CharSequence text) throws IOException {
		if(isUnknown() || startOffset > text.length()) {
			return;
		}
		int lineStart = startOffset;
		while(lineStart > 0 && text.charAt(lineStart - 1) != '\n') {
			lineStart--;
		}
		int lineEnd = startOffset;
		while(lineEnd < text.length() && text.charAt(lineEnd) != '\n') {
			lineEnd++;
		}
		out.append(text, lineStart, lineEnd);
		out.newLine();
		for(int pos = lineStart; pos < startOffset; pos++) {
			out.append(' ');
		}
		int effectiveEnd = Math.max(endOffset, startOffset + 1);
		for(int pos = startOffset; pos < effectiveEnd && pos < lineEnd; pos++) {
			out.append('^');
		}
		if(startOffset == text.length()) {
			out.append("^ EOF");
		}
	}

	public SourceLocation combine(SourceLocation other) {
		if(isUnknown()) {
			return other;
		}else if(other.isUnknown()) {
			return this;
		}
		if(!Objects.equals(file, other.file)) {
			throw new RuntimeException("Tried to combine source locations from two different files: " + file + ", " + other.file);
		}
		SourceLocation first = startOffset <= other.startOffset ? this : other;
		return new SourceLocation(file,
				first.startOffset,
				Integer.max(endOffset, other.endOffset),
				first.line,
				first.column);
	}

	public Path getFile() {
		return file;
	}

	public int getStartOffset() {
		return startOffset;
	}

	public int getEndOffset() {
		return endOffset;
	}

	public int getLine() {
		return line;
	}

	public int getColumn() {
		return column;
	}

	@Override
	public int hashCode() {
		return Objects.hash(file, startOffset, endOffset, line, column);
	}

	@Override
	public boolean equals(Object obj) {
		if (this == obj) {
			return true;
		}
		if (obj == null || getClass() != obj.getClass()) {
			return false;
		}
		SourceLocation other = (SourceLocation) obj;
		return startOffset == other.startOffset && endOffset == other.endOffset && line == other.line &&
				column == other.column && Objects.equals(file, other.file);
	}

	@Override
	public String toString() {
		if (isUnknown()) {
			return "SourceLocation [UNKNOWN]";
		}
		return "SourceLocation [file=" + file + ", startOffset=" + startOffset + ", endOffset=" + endOffset +
				", line=" + line + ", column=" + column + "]";
	}

	@Override
	public int compareTo(SourceLocation o) {
		if (isUnknown() && o.isUnknown()) {
			return 0;
		}
		if (isUnknown()) {
			return -1;
		}
		if (o.isUnknown()) {
			return 1;
		}
		int comparedStart = Integer.compare(startOffset, o.startOffset);
		if (comparedStart != 0) {
			return comparedStart;
		}
		return Integer.compare(endOffset, o.endOffset);
	}
}

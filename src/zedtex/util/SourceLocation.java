package zedtex.util;

import zedtex.Unreachable;
import zedtex.formatters.IndentingWriter;

import java.io.IOException;
import java.io.StringWriter;

/**
 * A span of the input text. Offsets are 0-based character offsets, lines and columns are 1-based and the end
 * column is exclusive, so a one character token at the start of a line spans columns 1 to 2.
 */
public class SourceLocation implements Comparable<SourceLocation> {
	private final int startOffset;
	private final int endOffset;
	private final int startLine;
	private final int endLine;
	private final int startColumn;
	private final int endColumn;

	public SourceLocation(int startOffset, int endOffset, int startLine, int endLine, int startColumn,
	                      int endColumn) {
		this.startOffset = startOffset;
		this.endOffset = endOffset;
		this.startLine = startLine;
		this.endLine = endLine;
		this.startColumn = startColumn;
		this.endColumn = endColumn;
	}

	public String prettyString(CharSequence source) {
		StringWriter sw = new StringWriter();
		writePretty(new IndentingWriter(sw), source);
		return sw.getBuffer().toString();
	}

	/**
	 * Writes the position, the source line it falls on and a row of carets under the span.
	 */
	public void writePretty(IndentingWriter out, CharSequence source) {
		try {
			if(isUnknown()) {
				out.write("at unknown source location");
				return;
			}
			out.write("at ");
			if(startLine != endLine) {
				out.write(startLine + ":" + startColumn + "-" + endLine + ":" + endColumn);
			} else if(endColumn > startColumn + 1) {
				out.write(startLine + ":" + startColumn + "-" + (endColumn - 1));
			} else {
				out.write(startLine + ":" + startColumn);
			}
			if(source == null) {
				return;
			}
			out.newLine();
			String line = lineText(source, startOffset);
			out.write(line);
			out.newLine();
			int lineStart = lineStartOffset(source, startOffset);
			for(int pos = lineStart; pos < startOffset; pos++) {
				out.append(source.charAt(pos) == '\t' ? '\t' : ' ');
			}
			int lineEnd = lineStart + line.length();
			int effectiveEndOffset = endOffset > startOffset ? endOffset : startOffset + 1;
			boolean wroteCaret = false;
			for(int pos = startOffset; pos < lineEnd && pos < effectiveEndOffset; pos++) {
				out.append('^');
				wroteCaret = true;
			}
			if(!wroteCaret) {
				out.append(startOffset >= source.length() ? "^ EOF" : "^");
			}
		} catch (IOException e) {
			throw new Unreachable(); // string ops shouldn't throw IO exceptions
		}
	}

	/**
	 * @return the full text of the line containing the offset, without its line terminator
	 */
	public static String lineText(CharSequence source, int offset) {
		int lineStart = lineStartOffset(source, offset);
		int lineEnd = lineStart;
		while(lineEnd < source.length() && source.charAt(lineEnd) != '\n' && source.charAt(lineEnd) != '\r') {
			lineEnd++;
		}
		return source.subSequence(lineStart, lineEnd).toString();
	}

	private static int lineStartOffset(CharSequence source, int offset) {
		int lineStart = Integer.min(offset, source.length());
		while(lineStart > 0 && source.charAt(lineStart - 1) != '\n') {
			lineStart--;
		}
		return lineStart;
	}

	public static SourceLocation unknown() {
		return new SourceLocation(-1, -1, -1, -1, -1, -1);
	}

	public boolean isUnknown() {
		return startLine == -1;
	}

	public SourceLocation combine(SourceLocation other) {
		if(isUnknown()) {
			return other;
		}else if(other.isUnknown()) {
			return this;
		}
		int mStartColumn, mEndColumn;
		if(startLine == other.getStartLine()) {
			mStartColumn = Integer.min(startColumn, other.getStartColumn());
		}else if(startLine < other.getStartLine()) {
			mStartColumn = startColumn;
		}else /* startLine > other.getStartLine() */ {
			mStartColumn = other.getStartColumn();
		}
		if(endLine == other.getEndLine()) {
			mEndColumn = Integer.max(endColumn, other.getEndColumn());
		}else if(endLine > other.getEndLine()) {
			mEndColumn = endColumn;
		}else /* endLine < other.getEndLine() */ {
			mEndColumn = other.getEndColumn();
		}
		return new SourceLocation(
				Integer.min(startOffset, other.startOffset),
				Integer.max(endOffset, other.endOffset),
				Integer.min(startLine, other.getStartLine()),
				Integer.max(endLine, other.getEndLine()),
				mStartColumn,
				mEndColumn);
	}

	public int getStartOffset() {
		return startOffset;
	}

	public int getEndOffset() {
		return endOffset;
	}

	public int getStartLine() {
		return startLine;
	}

	public int getEndLine() {
		return endLine;
	}

	public int getStartColumn() {
		return startColumn;
	}

	public int getEndColumn() {
		return endColumn;
	}

	@Override
	public int hashCode() {
		final int prime = 31;
		int result = 1;
		result = prime * result + endColumn;
		result = prime * result + endLine;
		result = prime * result + startOffset;
		result = prime * result + endOffset;
		result = prime * result + startColumn;
		result = prime * result + startLine;
		return result;
	}

	@Override
	public boolean equals(Object obj) {
		if (this == obj) {
			return true;
		}
		if (obj == null) {
			return false;
		}
		if (getClass() != obj.getClass()) {
			return false;
		}
		SourceLocation other = (SourceLocation) obj;
		return endColumn == other.endColumn && endLine == other.endLine && startColumn == other.startColumn &&
				startOffset == other.startOffset && endOffset == other.endOffset && startLine == other.startLine;
	}

	@Override
	public String toString() {
		if (isUnknown()) {
			return "SourceLocation [UNKNOWN]";
		} else {
			return "SourceLocation [startOffset=" + startOffset + ", endOffset=" + endOffset +
					", startLine=" + startLine + ", endLine=" + endLine + ", startColumn=" + startColumn +
					", endColumn=" + endColumn + "]";
		}
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
		int comparedStartLine = Integer.compare(getStartLine(), o.getStartLine());
		if (comparedStartLine != 0) {
			return comparedStartLine;
		}
		int comparedStartColumn = Integer.compare(getStartColumn(), o.getStartColumn());
		if (comparedStartColumn != 0) {
			return comparedStartColumn;
		}
		return Integer.compare(getEndOffset(), o.getEndOffset());
	}

}

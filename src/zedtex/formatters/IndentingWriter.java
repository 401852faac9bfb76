package zedtex.formatters;

import java.io.IOException;
import java.io.Writer;

/**
 * A writer that indents every line after the first by the current indentation and keeps track of the
 * horizontal position, so that generators can measure the lines they produce.
 *
 * Lines are always terminated with '\n' since the output is LaTeX and must be byte-identical across runs and
 * platforms.
 */
public class IndentingWriter extends Writer {

	private static final String LF = "\n";

	Writer out;
	int indent = 0;
	boolean shouldIndent = false;
	int defaultIndent = 4;
	int horizontalPosition = 0;
	int longestLine = 0;

	public static class Indent implements AutoCloseable {

		IndentingWriter writer;
		int spaces;

		public Indent(IndentingWriter writer, int spaces) {
			this.writer = writer;
			this.spaces = spaces;
		}

		@Override
		public void close() {
			writer.unindent(spaces);
		}

	}

	public Indent indent(int spaces) {
		indent += spaces;
		return new Indent(this, spaces);
	}

	public Indent indent() {
		return indent(defaultIndent);
	}

	public Indent indentToPosition() {
		return indentToPosition(horizontalPosition);
	}

	/**
	 * @return the 0-based position along the current line of text being written
	 */
	public int getHorizontalPosition() {
		return horizontalPosition;
	}

	/**
	 * @return the length of the longest line written so far, including the current one
	 */
	public int getLongestLine() {
		return Integer.max(longestLine, horizontalPosition);
	}

	/**
	 * 
	 * Indents any following lines such that they start at position
	 * 
	 * @param position 
	 * @return an AutoCloseable the will reverse the indent when closed
	 */
	public Indent indentToPosition(int position) {
		return indent(position - indent);
	}

	public void unindent(int spaces) {
		if(spaces > indent) {
			throw new IllegalStateException("can't unindent below 0");
		}
		indent -= spaces;
	}

	public IndentingWriter(Writer out) {
		this.out = out;
	}

	public IndentingWriter(Writer out, int defaultIndent) {
		this.out = out;
		this.defaultIndent = defaultIndent;
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
					out.write(" ");
				}
				shouldIndent = false;
				horizontalPosition = indent;
			}
			int next = data.indexOf(LF, start);
			if(next != -1) {
				horizontalPosition += next - start;
				longestLine = Integer.max(longestLine, horizontalPosition);
				out.write(data.substring(start, next + LF.length()));
				start = next + LF.length();
				horizontalPosition = 0;
				shouldIndent = true;
			}else {
				horizontalPosition += data.length() - start;
				out.write(data.substring(start));
				break;
			}
		}
	}

}

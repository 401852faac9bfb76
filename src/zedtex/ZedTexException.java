package zedtex;

import zedtex.errors.ErrorHints;
import zedtex.formatters.IndentingWriter;
import zedtex.util.SourceLocation;

import java.io.IOException;
import java.io.StringWriter;

/**
 * A zedtex exception consisting of a prefix (type of error), a message and, for errors raised while reading
 * the input, the position they were raised at together with the text of the offending line.
 *
 * The source line is captured when the exception is created so callers can print a pointer into the input
 * without re-scanning it.
 */
public abstract class ZedTexException extends RuntimeException {
	private final String msg;
	private final String prefix;
	private final SourceLocation location;
	private final String snippet;

	public ZedTexException(String prefix, String msg) {
		super(prefix + ": " + msg);
		this.prefix = prefix;
		this.msg = msg;
		this.location = SourceLocation.unknown();
		this.snippet = null;
	}

	public ZedTexException(String prefix, String msg, SourceLocation location, String snippet) {
		super(prefix + ": " + msg + describePosition(location));
		this.prefix = prefix;
		this.msg = msg;
		this.location = location;
		this.snippet = snippet;
	}

	private static String describePosition(SourceLocation location) {
		if(location.isUnknown()) {
			return "";
		}
		return " at line " + location.getStartLine() + ", column " + location.getStartColumn();
	}

	public String getMsg() {
		return msg;
	}

	public String getPrefix() {
		return prefix;
	}

	public SourceLocation getLocation() {
		return location;
	}

	public int getLine() {
		return location.getStartLine();
	}

	public int getColumn() {
		return location.getStartColumn();
	}

	/**
	 * @return the text of the input line the error points into, or null if the error has no position
	 */
	public String getSnippet() {
		return snippet;
	}

	public String prettyString() {
		StringWriter sw = new StringWriter();
		IndentingWriter out = new IndentingWriter(sw);
		try {
			writePretty(out);
		} catch (IOException e) {
			throw new Unreachable(); // string ops don't throw IO exceptions
		}
		return sw.getBuffer().toString();
	}

	public void writePretty(IndentingWriter out) throws IOException {
		out.write(prefix);
		out.write(": ");
		out.write(msg);
		if(!location.isUnknown()) {
			out.newLine();
			out.write("  line " + location.getStartLine() + ", column " + location.getStartColumn() + ":");
			if(snippet != null) {
				try (IndentingWriter.Indent ignored = out.indent(4)) {
					out.newLine();
					out.write(snippet);
					out.newLine();
					for(int i = 1; i < location.getStartColumn() && i <= snippet.length(); i++) {
						out.write(snippet.charAt(i - 1) == '\t' ? '\t' : ' ');
					}
					out.write('^');
				}
			}
		}
		String hint = ErrorHints.hintFor(msg);
		if(hint != null) {
			out.newLine();
			out.write("Hint: ");
			out.write(hint);
		}
	}
}

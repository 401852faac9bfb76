package zedtex.errors;

import zedtex.Unreachable;
import zedtex.formatters.IndentingWriter;
import zedtex.formatters.IssueFormattingVisitor;

import java.io.IOException;
import java.io.StringWriter;

/**
 * An advisory diagnostic produced while translating. Issues never change the generated output.
 */
public abstract class Issue {

	public String getMessage() {
		StringWriter sw = new StringWriter();
		IndentingWriter out = new IndentingWriter(sw);
		try {
			accept(new IssueFormattingVisitor(out));
		} catch (IOException e) {
			throw new Unreachable(); // string ops don't throw IO exceptions
		}
		return sw.getBuffer().toString();
	}

	@Override
	public String toString() {
		return getMessage();
	}

	public abstract <T, E extends Throwable> T accept(IssueVisitor<T, E> v) throws E;

}

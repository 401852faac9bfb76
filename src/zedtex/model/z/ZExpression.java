package zedtex.model.z;

import zedtex.formatters.IndentingWriter;
import zedtex.formatters.ZExpressionFormattingVisitor;
import zedtex.util.SourceLocation;

import java.io.IOException;
import java.io.StringWriter;

/**
 * Base class of the expression family. Predicates are expressions too.
 */
public abstract class ZExpression extends ZNode {

	public ZExpression(SourceLocation location) {
		super(location);
	}

	@Override
	public String toString() {
		StringWriter out = new StringWriter();
		try {
			accept(new ZExpressionFormattingVisitor(new IndentingWriter(out)));
		} catch (IOException e) {
			RuntimeException ex = new RuntimeException("You should never get an IO error from a StringWriter", e);
			throw ex;
		}
		return out.toString();
	}

	public abstract <T, E extends Throwable> T accept(ZExpressionVisitor<T, E> v) throws E;

}

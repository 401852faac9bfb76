package zedtex.trans.passes.codegen.latex;

import zedtex.errors.Issue;
import zedtex.errors.IssueVisitor;

/**
 * A generated line inside a boxed environment is longer than the configured limit. The external
 * typechecker accepts such lines but they overflow the box when typeset.
 */
public class LineTooLongIssue extends Issue {
	private final String environment;
	private final String line;
	private final int limit;

	public LineTooLongIssue(String environment, String line, int limit) {
		this.environment = environment;
		this.line = line;
		this.limit = limit;
	}

	public String getEnvironment() {
		return environment;
	}

	public String getLine() {
		return line;
	}

	public int getLimit() {
		return limit;
	}

	@Override
	public <T, E extends Throwable> T accept(IssueVisitor<T, E> v) throws E {
		return v.visit(this);
	}
}

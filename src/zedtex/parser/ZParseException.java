package zedtex.parser;

import zedtex.ZedTexException;
import zedtex.lexer.ZToken;

/**
 * A grammar violation. The parser does not recover, so the first one rejects the whole document.
 */
public class ZParseException extends ZedTexException {
	private final String expected;
	private final ZToken found;

	public ZParseException(String expected, ZToken found, String snippet) {
		super("Parse error", "expected " + expected + ", found " + found.describe(), found.getLocation(), snippet);
		this.expected = expected;
		this.found = found;
	}

	public ZParseException(String msg, String expected, ZToken found, String snippet) {
		super("Parse error", msg, found.getLocation(), snippet);
		this.expected = expected;
		this.found = found;
	}

	/**
	 * @return a description of what the parser was looking for
	 */
	public String getExpected() {
		return expected;
	}

	/**
	 * @return the token the parser stopped at; it is always one of the tokens it was given
	 */
	public ZToken getFound() {
		return found;
	}
}

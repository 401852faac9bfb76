package zedtex.lexer;

import zedtex.ZedTexException;
import zedtex.util.SourceLocation;

/**
 * A malformed token: a character with no meaning in the notation, or an unterminated marker.
 */
public class ZLexerException extends ZedTexException {

	public ZLexerException(String msg, SourceLocation location, String snippet) {
		super("Lexer error", msg, location, snippet);
	}

}

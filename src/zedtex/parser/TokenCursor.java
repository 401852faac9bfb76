package zedtex.parser;

import zedtex.lexer.ZToken;
import zedtex.lexer.ZTokenType;

import java.util.List;

/**
 * A position in a token list, as produced by {@link zedtex.lexer.ZLexer}. The list must end with an EOF token;
 * the cursor never moves past it.
 */
public class TokenCursor {
	private final List<ZToken> tokens;
	private int index;

	public TokenCursor(List<ZToken> tokens) {
		if(tokens.isEmpty() || tokens.get(tokens.size() - 1).getType() != ZTokenType.EOF) {
			throw new IllegalArgumentException("token list must end with EOF");
		}
		this.tokens = tokens;
		this.index = 0;
	}

	public ZToken peek() {
		return tokens.get(index);
	}

	public ZToken peek(int ahead) {
		return tokens.get(Integer.min(index + ahead, tokens.size() - 1));
	}

	public ZToken previous() {
		return tokens.get(Integer.max(index - 1, 0));
	}

	public ZToken advance() {
		ZToken token = tokens.get(index);
		if(token.getType() != ZTokenType.EOF) {
			++index;
		}
		return token;
	}

	public boolean atEnd() {
		return peek().getType() == ZTokenType.EOF;
	}

	public boolean check(ZTokenType type) {
		return peek().getType() == type;
	}

	public boolean check(ZTokenType type, String value) {
		return peek().is(type, value);
	}

	public boolean checkDelimiter(String value) {
		return check(ZTokenType.DELIMITER, value);
	}

	/**
	 * @return whether the next token is at the end of a line: a NEWLINE or the end of input
	 */
	public boolean atLineEnd() {
		return check(ZTokenType.NEWLINE) || check(ZTokenType.EOF);
	}

	public boolean match(ZTokenType type, String value) {
		if(check(type, value)) {
			advance();
			return true;
		}
		return false;
	}

	public boolean matchDelimiter(String value) {
		return match(ZTokenType.DELIMITER, value);
	}

	public ZToken expect(ZTokenType type, String value, String description) {
		if(!check(type, value)) {
			throw error(description);
		}
		return advance();
	}

	public ZToken expectDelimiter(String value) {
		return expect(ZTokenType.DELIMITER, value, "'" + value + "'");
	}

	public ZToken expectType(ZTokenType type, String description) {
		if(!check(type)) {
			throw error(description);
		}
		return advance();
	}

	/**
	 * Consumes the NEWLINE ending the current line. At the end of input there is nothing to consume.
	 */
	public void expectLineEnd() {
		if(check(ZTokenType.EOF)) {
			return;
		}
		expectType(ZTokenType.NEWLINE, "end of line");
	}

	public void skipNewLines() {
		while(check(ZTokenType.NEWLINE)) {
			advance();
		}
	}

	public ZParseException error(String expected) {
		return errorAt(peek(), expected);
	}

	public ZParseException errorAt(ZToken token, String expected) {
		return new ZParseException(expected, token, lineSnippet(token.getLine()));
	}

	public ZParseException errorAt(ZToken token, String msg, String expected) {
		return new ZParseException(msg, expected, token, lineSnippet(token.getLine()));
	}

	/**
	 * Rebuilds the text of a source line from its tokens, placing each token at its column. Justifications lose
	 * their brackets, otherwise the line reads as it was written.
	 */
	String lineSnippet(int line) {
		StringBuilder builder = new StringBuilder();
		for(ZToken token : tokens) {
			if(token.getLine() != line || token.getType() == ZTokenType.NEWLINE
					|| token.getType() == ZTokenType.EOF) {
				continue;
			}
			while(builder.codePointCount(0, builder.length()) < token.getColumn() - 1) {
				builder.append(' ');
			}
			builder.append(token.getValue());
		}
		return builder.length() == 0 ? null : builder.toString();
	}
}

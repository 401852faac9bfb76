package zedtex.lexer;

public enum ZTokenType {
	OPERATOR,
	KEYWORD,
	IDENTIFIER,
	NUMBER,
	DELIMITER,
	/** an opaque run of text: prose, block payloads and proof justifications */
	TEXT,
	/** a trailing \\ that joins the next line onto the current one */
	CONTINUATION,
	NEWLINE,
	EOF,
}

package zedtex.parser;

import zedtex.lexer.ZToken;
import zedtex.model.z.ReservedWords;
import zedtex.model.z.ZOperator;

import java.util.Arrays;
import java.util.Collections;
import java.util.HashSet;
import java.util.Set;

/**
 * The tokens that can begin an operand. Wherever the parser has to decide whether a token continues the
 * current expression as an argument (f x), or whether a symbol that is both infix and postfix (R+ x) is used
 * as a postfix closure, it asks this class, so that all such decisions agree.
 */
public class OperandStart {
	private OperandStart() {}

	private static final Set<String> OPENING_DELIMITERS = Collections.unmodifiableSet(new HashSet<>(Arrays.asList(
			"(", "{", "<", "⟨", "[[", "⟦")));

	public static boolean isOperandStart(ZToken token) {
		switch(token.getType()) {
			case IDENTIFIER:
			case NUMBER:
				return true;
			case DELIMITER:
				return OPENING_DELIMITERS.contains(token.getValue());
			case OPERATOR: {
				// a symbol that is also infix, such as -, is read as infix between two operands
				ZOperator prefix = ReservedWords.prefix(token.getValue());
				return prefix != null && prefix != ZOperator.NOT && ReservedWords.infix(token.getValue()) == null;
			}
			default:
				return false;
		}
	}
}

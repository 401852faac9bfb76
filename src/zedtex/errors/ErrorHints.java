package zedtex.errors;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.regex.Pattern;

/**
 * Suggestions attached to common lexing and parsing errors when they are pretty-printed.
 */
public class ErrorHints {
	private ErrorHints() {}

	private static final Map<Pattern, String> HINTS;

	static {
		Map<Pattern, String> hints = new LinkedHashMap<>();
		hints.put(Pattern.compile("expected 'end'"), "Did you forget 'end' before starting a new block?");
		hints.put(Pattern.compile("expected closing '==='"), "Section markers must match: === Title ===");
		hints.put(Pattern.compile("expected closing '\\*\\*'"), "Solution markers must match: ** Solution N **");
		hints.put(Pattern.compile("expected end of line"), "Check for missing operators or extra characters");
		hints.put(Pattern.compile("unexpected character"), "This character is not valid in whiteboard notation");
		hints.put(Pattern.compile("expected 'where' or 'end'"),
				"Schema and axdef blocks need 'where' before predicates and 'end' to close them");
		hints.put(Pattern.compile("unclosed '\\$'"), "Formulas in text are written between two $ signs");
		hints.put(Pattern.compile("unclosed|unterminated"),
				"Make sure all brackets, braces and parentheses are balanced");
		hints.put(Pattern.compile("expected identifier"), "A variable or type name is required here");
		hints.put(Pattern.compile("expected ':'"), "Declarations need a colon between name and type");
		HINTS = Collections.unmodifiableMap(hints);
	}

	/**
	 * @return the first hint whose pattern occurs in the message, or null
	 */
	public static String hintFor(String message) {
		if(message == null) {
			return null;
		}
		for(Map.Entry<Pattern, String> entry : HINTS.entrySet()) {
			if(entry.getKey().matcher(message).find()) {
				return entry.getValue();
			}
		}
		return null;
	}
}

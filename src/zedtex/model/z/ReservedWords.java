package zedtex.model.z;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collections;
import java.util.Comparator;
import java.util.HashMap;
import java.util.HashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Lookups over {@link ZOperator}, {@link ZKeyword} and {@link ZBuiltinType}, plus the word sets used to tell
 * prose from mathematics. Every stage of the pipeline reads its vocabulary from here.
 */
public class ReservedWords {
	private ReservedWords() {}

	/**
	 * Punctuation with a fixed meaning in expressions and declarations. Sequence and bag brackets written
	 * with ASCII characters are decided by the lexer from context and are not listed.
	 */
	public static final List<String> DELIMITERS = Collections.unmodifiableList(Arrays.asList(
			"::=", "::", "==", "(|", "|)", "\\\\", "(", ")", "{", "}", "[", "]", ",", ";", ":", "|", ".",
			"•", "@", "⟨", "⟩", "⟦", "⟧"));

	/**
	 * Words that open an English sentence.
	 */
	public static final Set<String> PROSE_STARTERS = Collections.unmodifiableSet(new HashSet<>(Arrays.asList(
			"a", "an", "the", "this", "that", "these", "those", "we", "it", "there", "here", "let", "note",
			"suppose", "since", "because", "i", "you", "they", "our", "its", "each", "every", "any", "some",
			"all", "no")));

	/**
	 * Words whose presence shortly after a starter marks the line as prose.
	 */
	public static final Set<String> PROSE_INDICATORS = Collections.unmodifiableSet(new HashSet<>(Arrays.asList(
			"is", "are", "was", "were", "be", "been", "means", "has", "have", "had", "can", "could", "will",
			"would", "should", "must", "may", "might", "do", "does", "did", "by", "holds", "follows", "denotes",
			"shows", "contains", "gives", "becomes")));

	/**
	 * Common English words that never occur in formulas; used when deciding where inline math ends.
	 */
	public static final Set<String> PROSE_WORDS;

	private static final Map<String, ZOperator> INFIX = new HashMap<>();
	private static final Map<String, ZOperator> PREFIX = new HashMap<>();
	private static final Map<String, ZOperator> POSTFIX = new HashMap<>();
	private static final Map<String, ZKeyword> KEYWORDS = new HashMap<>();
	private static final Map<String, ZBuiltinType> BUILTIN_TYPES = new HashMap<>();
	private static final List<String> SYMBOLS;

	static {
		Set<String> symbols = new HashSet<>(DELIMITERS);
		for(ZOperator op : ZOperator.values()) {
			Map<String, ZOperator> table;
			switch(op.getFixity()) {
				case PREFIX:
					table = PREFIX;
					break;
				case POSTFIX:
					table = POSTFIX;
					break;
				default:
					table = INFIX;
			}
			for(String spelling : op.getSpellings()) {
				table.put(spelling, op);
				if(!isWord(spelling)) {
					symbols.add(spelling);
				}
			}
		}
		for(ZKeyword keyword : ZKeyword.values()) {
			for(String spelling : keyword.getSpellings()) {
				KEYWORDS.put(spelling, keyword);
				if(keyword.isQuantifier() && !isWord(spelling)) {
					symbols.add(spelling);
				}
			}
		}
		for(ZBuiltinType type : ZBuiltinType.values()) {
			for(String spelling : type.getSpellings()) {
				BUILTIN_TYPES.put(spelling, type);
				if(!isWord(spelling)) {
					symbols.add(spelling);
				}
			}
		}
		// decided by whitespace or lookahead in the lexer
		symbols.remove("^");
		symbols.remove("<");
		symbols.remove(">");
		List<String> ordered = new ArrayList<>(symbols);
		ordered.sort(Comparator.comparingInt(String::length).reversed().thenComparing(Comparator.naturalOrder()));
		SYMBOLS = Collections.unmodifiableList(ordered);

		Set<String> proseWords = new HashSet<>(PROSE_STARTERS);
		proseWords.addAll(PROSE_INDICATORS);
		proseWords.addAll(Arrays.asList("as", "at", "for", "from", "of", "on", "to", "with", "valid", "when",
				"which", "who", "where", "then", "so", "hence", "thus", "also", "only", "both", "either",
				"neither", "true", "false", "syntax"));
		PROSE_WORDS = Collections.unmodifiableSet(proseWords);
	}

	/**
	 * @return true for spellings made only of ASCII letters, digits and underscores, which the lexer reads
	 * as identifiers before looking them up
	 */
	public static boolean isWord(String spelling) {
		for(int i = 0; i < spelling.length(); i++) {
			char c = spelling.charAt(i);
			if(!((c >= 'a' && c <= 'z') || (c >= 'A' && c <= 'Z') || (c >= '0' && c <= '9') || c == '_')) {
				return false;
			}
		}
		return !spelling.isEmpty() && !Character.isDigit(spelling.charAt(0));
	}

	/**
	 * Non-word operator, delimiter and quantifier spellings ordered longest first, so that the first entry
	 * matching at a position is the longest match.
	 */
	public static List<String> symbolsLongestFirst() {
		return SYMBOLS;
	}

	public static ZOperator infix(String spelling) {
		return INFIX.get(spelling);
	}

	public static ZOperator prefix(String spelling) {
		return PREFIX.get(spelling);
	}

	public static ZOperator postfix(String spelling) {
		return POSTFIX.get(spelling);
	}

	public static boolean isOperator(String spelling) {
		return INFIX.containsKey(spelling) || PREFIX.containsKey(spelling) || POSTFIX.containsKey(spelling);
	}

	public static ZKeyword keyword(String spelling) {
		return KEYWORDS.get(spelling);
	}

	public static ZBuiltinType builtinType(String spelling) {
		return BUILTIN_TYPES.get(spelling);
	}

	public static boolean isReserved(String word) {
		return isOperator(word) || KEYWORDS.containsKey(word);
	}
}

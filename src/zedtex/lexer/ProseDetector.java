package zedtex.lexer;

import zedtex.model.z.ReservedWords;

import java.util.ArrayList;
import java.util.Collections;
import java.util.HashSet;
import java.util.List;
import java.util.Locale;
import java.util.Set;
import java.util.regex.Pattern;

/**
 * Decides whether the remainder of a line is English prose rather than mathematics.
 *
 * The decision is a bounded lookahead: the first word must be an ordinary English word (a prose starter
 * such as "the", or any non-reserved word at the start of a line), and an indicator word such as "is" or "by"
 * must follow within a few words. A line starting with a prose starter gets the full lookahead window; any
 * other word at the start of a line must be followed almost immediately by an indicator.
 *
 * The heuristic has known false positives and negatives, so both word sets are configurable.
 */
public class ProseDetector {

	static final Pattern ENGLISH_WORD = Pattern.compile("[A-Za-z][A-Za-z'\\-]*");
	static final Pattern TRAILING_PUNCTUATION = Pattern.compile("[.,;:!?)]+$");
	static final Pattern LEADING_PUNCTUATION = Pattern.compile("^[(\"']+");
	static final Pattern WHITESPACE = Pattern.compile("\\s+");

	public static final int DEFAULT_LOOKAHEAD = 6;
	static final int SHORT_LOOKAHEAD = 2;

	private final Set<String> starters;
	private final Set<String> indicators;
	private final int lookahead;

	public ProseDetector() {
		this(ReservedWords.PROSE_STARTERS, ReservedWords.PROSE_INDICATORS, DEFAULT_LOOKAHEAD);
	}

	public ProseDetector(Set<String> starters, Set<String> indicators, int lookahead) {
		if(lookahead < 1) {
			throw new IllegalArgumentException("prose lookahead must be at least 1, got " + lookahead);
		}
		this.starters = Collections.unmodifiableSet(lowerCase(starters));
		this.indicators = Collections.unmodifiableSet(lowerCase(indicators));
		this.lookahead = lookahead;
	}

	private static Set<String> lowerCase(Set<String> words) {
		Set<String> result = new HashSet<>();
		for(String word : words) {
			result.add(word.toLowerCase(Locale.ROOT));
		}
		return result;
	}

	public Set<String> getStarters() {
		return starters;
	}

	public Set<String> getIndicators() {
		return indicators;
	}

	public int getLookahead() {
		return lookahead;
	}

	public boolean isStarter(String word) {
		return starters.contains(word.toLowerCase(Locale.ROOT));
	}

	/**
	 * @param text the remainder of a line, starting at the word under consideration
	 * @param atLineStart whether the text starts at the first token of its line
	 * @return true if the whole of text should be kept as one run of prose
	 */
	public boolean isProse(String text, boolean atLineStart) {
		List<String> words = words(text);
		if(words.isEmpty()) {
			return false;
		}
		String first = words.get(0);
		if(!ENGLISH_WORD.matcher(first).matches() || ReservedWords.isReserved(first)) {
			return false;
		}
		int window;
		if(isStarter(first)) {
			window = lookahead;
		} else if(atLineStart) {
			window = SHORT_LOOKAHEAD;
		} else {
			return false;
		}
		for(int i = 1; i < words.size() && i <= window; i++) {
			if(indicators.contains(words.get(i).toLowerCase(Locale.ROOT))) {
				return true;
			}
		}
		return false;
	}

	static List<String> words(String text) {
		List<String> words = new ArrayList<>();
		for(String raw : WHITESPACE.split(text.trim())) {
			String word = TRAILING_PUNCTUATION.matcher(LEADING_PUNCTUATION.matcher(raw).replaceAll(""))
					.replaceAll("");
			if(!word.isEmpty()) {
				words.add(word);
			}
		}
		return words;
	}
}

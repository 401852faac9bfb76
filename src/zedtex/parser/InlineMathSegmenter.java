package zedtex.parser;

import zedtex.ZedTexException;
import zedtex.lexer.ProseDetector;
import zedtex.lexer.ZLexer;
import zedtex.lexer.ZToken;
import zedtex.model.z.ReservedWords;
import zedtex.model.z.ZExpression;
import zedtex.model.z.ZTextSegment;
import zedtex.util.SourceLocation;

import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Splits a paragraph of text into prose and formulas.
 *
 * Spans between dollar signs are kept verbatim. Elsewhere, a formula is a maximal run of words that are not
 * English, containing at least one mathematical symbol: "the formula p => q is simple" contains the formula
 * "p => q". A run that does not parse as an expression stays prose. References written [cite key] or
 * [cite key locator] become citations.
 */
public class InlineMathSegmenter {

	private static final Pattern CITATION = Pattern.compile("\\[cite\\s+([A-Za-z0-9_:.-]+)(?:\\s+([^\\]]+?))?\\s*\\]");
	private static final Pattern RAW_MATH = Pattern.compile("\\$([^$]+)\\$");
	private static final Pattern WORD = Pattern.compile("\\S+");
	private static final Pattern ATOM = Pattern.compile("[A-Za-z](?:[0-9_][A-Za-z0-9_]*)?'*|[0-9]+");
	private static final Pattern APPLICATION = Pattern.compile("[A-Za-z][A-Za-z0-9_]*\\(.*\\)");
	private static final Pattern TRAILING_PUNCTUATION = Pattern.compile("[.,;:!?]+$");
	private static final String SYMBOL_CHARACTERS = "=<>+*#{}|^~\\";

	private enum WordKind {
		PROSE,
		ATOM,
		CONNECTIVE,
		SYMBOLIC,
	}

	private final ProseDetector proseDetector;

	public InlineMathSegmenter(ProseDetector proseDetector) {
		this.proseDetector = proseDetector;
	}

	/**
	 * @param text the paragraph
	 * @param location where the paragraph starts; it is assumed to lie on a single line
	 */
	public List<ZTextSegment> segment(String text, SourceLocation location) {
		List<ZTextSegment> segments = new ArrayList<>();
		Matcher citation = CITATION.matcher(text);
		int position = 0;
		while(citation.find()) {
			segmentMath(text, position, citation.start(), location, segments);
			segments.add(ZTextSegment.citation(locate(location, text, citation.start(), citation.end()),
					citation.group(1), citation.group(2)));
			position = citation.end();
		}
		segmentMath(text, position, text.length(), location, segments);
		return segments;
	}

	private void segmentMath(String text, int from, int to, SourceLocation location, List<ZTextSegment> segments) {
		Matcher raw = RAW_MATH.matcher(text);
		raw.region(from, to);
		int position = from;
		while(raw.find()) {
			segmentProse(text, position, raw.start(), location, segments);
			segments.add(ZTextSegment.rawMath(locate(location, text, raw.start(), raw.end()), raw.group(1)));
			position = raw.end();
		}
		segmentProse(text, position, to, location, segments);
	}

	private void segmentProse(String text, int from, int to, SourceLocation location,
	                          List<ZTextSegment> segments) {
		List<int[]> words = new ArrayList<>();
		List<WordKind> kinds = new ArrayList<>();
		Matcher m = WORD.matcher(text);
		m.region(from, to);
		while(m.find()) {
			words.add(new int[]{m.start(), m.end()});
			kinds.add(classify(m.group()));
		}
		int proseStart = from;
		int i = 0;
		while(i < words.size()) {
			if(kinds.get(i) == WordKind.PROSE || kinds.get(i) == WordKind.CONNECTIVE) {
				++i;
				continue;
			}
			int j = i;
			boolean symbolic = false;
			while(j < words.size() && kinds.get(j) != WordKind.PROSE) {
				symbolic |= kinds.get(j) == WordKind.SYMBOLIC;
				++j;
			}
			int last = j - 1;
			while(last > i && kinds.get(last) == WordKind.CONNECTIVE) {
				--last;
			}
			int runStart = words.get(i)[0];
			int runEnd = words.get(last)[1];
			Matcher trailing = TRAILING_PUNCTUATION.matcher(text.substring(runStart, runEnd));
			if(trailing.find()) {
				runEnd -= trailing.group().length();
			}
			ZExpression formula = symbolic && runEnd > runStart ? parseFormula(text.substring(runStart, runEnd))
					: null;
			if(formula != null) {
				if(runStart > proseStart) {
					segments.add(ZTextSegment.prose(locate(location, text, proseStart, runStart),
							text.substring(proseStart, runStart)));
				}
				segments.add(ZTextSegment.math(locate(location, text, runStart, runEnd),
						text.substring(runStart, runEnd), formula));
				proseStart = runEnd;
			}
			i = j;
		}
		if(to > proseStart) {
			segments.add(ZTextSegment.prose(locate(location, text, proseStart, to), text.substring(proseStart, to)));
		}
	}

	private static WordKind classify(String word) {
		String bare = TRAILING_PUNCTUATION.matcher(word).replaceAll("");
		if(bare.isEmpty()) {
			return WordKind.PROSE;
		}
		if(ReservedWords.isOperator(bare) && ReservedWords.isWord(bare)) {
			return WordKind.CONNECTIVE;
		}
		if(ReservedWords.PROSE_WORDS.contains(bare.toLowerCase(Locale.ROOT))) {
			return WordKind.PROSE;
		}
		if(ATOM.matcher(bare).matches()) {
			return WordKind.ATOM;
		}
		if(APPLICATION.matcher(bare).matches()) {
			return WordKind.SYMBOLIC;
		}
		for(int k = 0; k < bare.length(); k++) {
			char c = bare.charAt(k);
			if(SYMBOL_CHARACTERS.indexOf(c) >= 0 || Character.getType(c) == Character.MATH_SYMBOL) {
				return WordKind.SYMBOLIC;
			}
		}
		return WordKind.PROSE;
	}

	/**
	 * @return the formula, or null if the text is not a complete expression
	 */
	private ZExpression parseFormula(String formula) {
		try {
			List<ZToken> tokens = new ZLexer(formula, proseDetector, false).tokenize();
			TokenCursor cursor = new TokenCursor(tokens);
			ZExpression expression = new ZExpressionParser(cursor).parseExpression();
			cursor.skipNewLines();
			return cursor.atEnd() ? expression : null;
		} catch (ZedTexException e) {
			// not a formula after all; the words stay prose
			return null;
		}
	}

	private static SourceLocation locate(SourceLocation base, String text, int start, int end) {
		if(base.isUnknown()) {
			return base;
		}
		int startColumn = base.getStartColumn() + text.codePointCount(0, start);
		int endColumn = base.getStartColumn() + text.codePointCount(0, end);
		return new SourceLocation(base.getStartOffset() + start, base.getStartOffset() + end,
				base.getStartLine(), base.getStartLine(), startColumn, endColumn);
	}
}

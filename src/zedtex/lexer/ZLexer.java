package zedtex.lexer;

import java.util.ArrayList;
import java.util.HashSet;
import java.util.List;
import java.util.Set;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

import zedtex.model.z.ReservedWords;
import zedtex.model.z.ZKeyword;
import zedtex.model.z.ZOperator;
import zedtex.util.SourceLocation;

/**
 * Lexer for whiteboard notation.
 *
 * The input is processed a line at a time, because the document syntax is line oriented: section and
 * solution markers, part labels and block keywords are only recognised at the start of a line, and lines in
 * PROOF:, EQUIV:, ARGUE:, INFRULE: and TRUTH TABLE: blocks end with an optional bracketed justification
 * that is kept as one TEXT token. Every line ends with a NEWLINE token, unless it ends with the continuation
 * marker \\, in which case a CONTINUATION token is produced instead and the next line carries on.
 *
 * Within a line, operator and delimiter spellings are matched longest first from
 * {@link ReservedWords#symbolsLongestFirst()}; words are read as identifiers and then looked up as keywords
 * and word operators. A few characters depend on context:
 * <ul>
 *     <li>{@code ^} with whitespace before it is concatenation, otherwise a superscript;</li>
 *     <li>{@code <} starts a sequence literal when a matching {@code >} follows on the same line with no
 *     spacing around the brackets and no logical or relational operator between them;</li>
 *     <li>{@code [[} opens a bag unless it is tight against an operand, and {@code ]]} only closes an open
 *     bag.</li>
 * </ul>
 *
 * English prose is recognised by {@link ProseDetector} and returned as a single TEXT token covering the rest
 * of the line.
 */
public class ZLexer {

	enum Mode {
		NORMAL,
		/** inside axdef/schema/gendef/zed up to end: never prose */
		BOXED,
		/** inside a line-oriented block up to the next blank line */
		LINE_BLOCK,
	}

	static final Pattern WHITESPACE = Pattern.compile("[ \\t]+");
	static final Pattern IDENT = Pattern.compile("[A-Za-z][A-Za-z0-9_]*'*(?:[?!](?!=))?");
	static final Pattern NUMBER = Pattern.compile("[0-9]+(?:\\.[0-9]+)?");
	static final Pattern CONTINUATION = Pattern.compile("\\\\\\\\[ \\t]*$");
	static final Pattern SECTION = Pattern.compile("===(.*?)===\\s*$");
	static final Pattern SOLUTION = Pattern.compile("\\*\\*(.*?)\\*\\*\\s*$");
	static final Pattern PART_LABEL = Pattern.compile("\\((?:[a-j]|i{1,3}|iv|vi{0,3}|ix|x)\\)(?=\\s|$)");
	static final Pattern BLOCK_KEYWORD = Pattern.compile("TRUTH TABLE:|[A-Z]+:|PAGEBREAK(?=\\s*$)");
	static final Pattern JUSTIFICATION = Pattern.compile("\\[(.*)\\]\\s*$");
	static final Pattern LABEL = Pattern.compile("\\[\\s*[0-9]+\\s*\\]");
	static final Pattern BOXED_START = Pattern.compile("(axdef|schema|gendef|zed)\\b");
	static final Pattern BOXED_END = Pattern.compile("end\\s*$");

	private final String source;
	private final ProseDetector proseDetector;
	private final boolean detectProse;

	private List<ZToken> tokens;
	private Mode mode;
	private int bagDepth;

	// per-line state
	private String line;
	private int lineNum;
	private int lineOffset;
	private final Set<Integer> sequenceCloses = new HashSet<>();

	public ZLexer(String source) {
		this(source, new ProseDetector(), true);
	}

	public ZLexer(String source, ProseDetector proseDetector) {
		this(source, proseDetector, true);
	}

	/**
	 * @param detectProse false to read every line as mathematics, as needed for formulas embedded in text
	 */
	public ZLexer(String source, ProseDetector proseDetector, boolean detectProse) {
		this.source = source;
		this.proseDetector = proseDetector;
		this.detectProse = detectProse;
	}

	/**
	 * @return the tokens of the whole input, terminated by an EOF token
	 * @throws ZLexerException if the lexer cannot understand part of the input
	 */
	public List<ZToken> tokenize() throws ZLexerException {
		tokens = new ArrayList<>();
		mode = Mode.NORMAL;
		bagDepth = 0;
		lineOffset = 0;
		lineNum = 0;
		int pos = 0;
		while(pos <= source.length()) {
			int next = source.indexOf('\n', pos);
			int end = next == -1 ? source.length() : next;
			String raw = source.substring(pos, end);
			line = raw.endsWith("\r") ? raw.substring(0, raw.length() - 1) : raw;
			lineOffset = pos;
			++lineNum;
			if(next == -1 && line.isEmpty() && lineNum > 1) {
				// trailing newline at end of input
				break;
			}
			readLine();
			if(next == -1) {
				break;
			}
			pos = next + 1;
		}
		tokens.add(new ZToken("", ZTokenType.EOF,
				new SourceLocation(source.length(), source.length(), lineNum, lineNum,
						columnOf(line.length()), columnOf(line.length())), true));
		return tokens;
	}

	private void readLine() {
		sequenceCloses.clear();
		String trimmed = line.trim();
		if(trimmed.isEmpty()) {
			if(mode == Mode.LINE_BLOCK) {
				mode = Mode.NORMAL;
			}
			addNewLine();
			return;
		}
		int column = indexOfNonBlank(line, 0);
		if(line.startsWith("%", column)) {
			return;
		}
		boolean lineStart = true;
		if(mode != Mode.LINE_BLOCK) {
			if(line.startsWith("===", column)) {
				readMarker(SECTION, ZKeyword.SECTION, column);
				return;
			}
			if(line.startsWith("**", column)) {
				readMarker(SOLUTION, ZKeyword.SOLUTION, column);
				return;
			}
			Matcher part = PART_LABEL.matcher(line);
			part.region(column, line.length());
			if(part.lookingAt()) {
				tokens.add(makeToken(part.group(), ZTokenType.KEYWORD, column, true));
				column = indexOfNonBlank(line, part.end());
				if(column >= line.length()) {
					addNewLine();
					return;
				}
			}
		}
		Matcher block = BLOCK_KEYWORD.matcher(line);
		block.region(column, line.length());
		if(block.lookingAt() && ReservedWords.keyword(block.group()) != null) {
			ZKeyword keyword = ReservedWords.keyword(block.group());
			tokens.add(makeToken(block.group(), ZTokenType.KEYWORD, column, true));
			column = indexOfNonBlank(line, block.end());
			if(keyword.capturesRestOfLine()) {
				if(keyword == ZKeyword.TEXT) {
					checkMathSpans(column);
				}
				if(column < line.length()) {
					tokens.add(makeToken(line.substring(column).trim(), ZTokenType.TEXT, column, true));
				}
				addNewLine();
				return;
			}
			if(keyword.isLineBlock()) {
				mode = Mode.LINE_BLOCK;
			}
			lineStart = false;
			if(column >= line.length()) {
				addNewLine();
				return;
			}
		}
		if(mode == Mode.NORMAL) {
			Matcher boxed = BOXED_START.matcher(line);
			boxed.region(column, line.length());
			if(boxed.lookingAt()) {
				mode = Mode.BOXED;
			} else if(detectProse && proseDetector.isProse(line.substring(column), true)) {
				checkMathSpans(column);
				tokens.add(makeToken(line.substring(column).trim(), ZTokenType.TEXT, column, true));
				addNewLine();
				return;
			}
		} else if(mode == Mode.BOXED) {
			Matcher end = BOXED_END.matcher(line);
			end.region(column, line.length());
			if(end.lookingAt()) {
				mode = Mode.NORMAL;
			}
		}
		readTokens(column, lineStart);
	}

	/**
	 * Text is split into prose and $...$ spans later on; a $ left open would run to the end of the paragraph.
	 */
	private void checkMathSpans(int column) {
		int open = -1;
		for(int i = line.indexOf('$', column); i >= 0; i = line.indexOf('$', i + 1)) {
			open = open < 0 ? i : -1;
		}
		if(open >= 0) {
			throw error("unclosed '$' in text", open);
		}
	}

	private void readMarker(Pattern pattern, ZKeyword keyword, int column) {
		String delimiter = keyword.getCanonicalSpelling();
		Matcher m = pattern.matcher(line);
		m.region(column, line.length());
		if(!m.lookingAt()) {
			throw error("expected closing '" + delimiter + "'", line.length());
		}
		tokens.add(makeToken(delimiter, ZTokenType.KEYWORD, column, true));
		int textStart = indexOfNonBlank(line, m.start(1));
		tokens.add(makeToken(m.group(1).trim(), ZTokenType.TEXT, Integer.min(textStart, m.end(1)), true));
		addNewLine();
	}

	private void readTokens(int column, boolean atLineStart) {
		boolean firstOnLine = atLineStart;
		while(column < line.length()) {
			Matcher m = WHITESPACE.matcher(line);
			m.region(column, line.length());
			if(m.lookingAt()) {
				column = m.end();
				continue;
			}
			boolean spaceBefore = column == 0 || Character.isWhitespace(line.charAt(column - 1));

			m = CONTINUATION.matcher(line);
			m.region(column, line.length());
			if(m.lookingAt()) {
				tokens.add(makeToken("\\\\", ZTokenType.CONTINUATION, column, spaceBefore));
				return;
			}

			if(mode == Mode.LINE_BLOCK && line.charAt(column) == '[' && !firstOnLine) {
				m = JUSTIFICATION.matcher(line);
				m.region(column, line.length());
				if(m.lookingAt() && spaceBefore && !LABEL.matcher(m.group()).matches()) {
					tokens.add(makeToken(m.group(1).trim(), ZTokenType.TEXT, column, true));
					column = line.length();
					continue;
				}
			}

			int next = readBrackets(column, spaceBefore);
			if(next == -1) {
				next = readSymbol(column, spaceBefore);
			}
			if(next == -1) {
				next = readNumber(column, spaceBefore);
			}
			if(next == -1) {
				next = readWord(column, spaceBefore);
			}
			if(next == -1) {
				throw error("unexpected character '" + new String(Character.toChars(line.codePointAt(column)))
						+ "'", column);
			}
			column = next;
			firstOnLine = false;
		}
		addNewLine();
	}

	/**
	 * Handles the characters whose meaning depends on their surroundings: ^, sequence brackets and bag
	 * brackets.
	 */
	private int readBrackets(int column, boolean spaceBefore) {
		char c = line.charAt(column);
		if(c == '^') {
			ZTokenType type = spaceBefore ? ZTokenType.OPERATOR : ZTokenType.DELIMITER;
			tokens.add(makeToken("^", type, column, spaceBefore));
			return column + 1;
		}
		if(c == '[' && line.startsWith("[[", column) && (spaceBefore || !isOperandEnd(line.charAt(column - 1)))) {
			++bagDepth;
			tokens.add(makeToken("[[", ZTokenType.DELIMITER, column, spaceBefore));
			return column + 2;
		}
		if(c == ']' && line.startsWith("]]", column) && bagDepth > 0) {
			--bagDepth;
			tokens.add(makeToken("]]", ZTokenType.DELIMITER, column, spaceBefore));
			return column + 2;
		}
		if(c == '>' && sequenceCloses.remove(column)) {
			tokens.add(makeToken(">", ZTokenType.DELIMITER, column, spaceBefore));
			return column + 1;
		}
		if(c == '<' && longestSymbolAt(column) == null) {
			int close = findSequenceClose(column);
			if(close != -1) {
				sequenceCloses.add(close);
				tokens.add(makeToken("<", ZTokenType.DELIMITER, column, spaceBefore));
				return column + 1;
			}
		}
		return -1;
	}

	private int readSymbol(int column, boolean spaceBefore) {
		String symbol = longestSymbolAt(column);
		if(symbol == null) {
			char c = line.charAt(column);
			if(c == '<' || c == '>') {
				symbol = String.valueOf(c);
			} else {
				return -1;
			}
		}
		ZTokenType type;
		if(ReservedWords.isOperator(symbol)) {
			type = ZTokenType.OPERATOR;
		} else if(ReservedWords.keyword(symbol) != null) {
			type = ZTokenType.KEYWORD;
		} else if(ReservedWords.builtinType(symbol) != null) {
			type = ZTokenType.IDENTIFIER;
		} else {
			type = ZTokenType.DELIMITER;
		}
		tokens.add(makeToken(symbol, type, column, spaceBefore));
		return column + symbol.length();
	}

	private int readNumber(int column, boolean spaceBefore) {
		Matcher m = NUMBER.matcher(line);
		m.region(column, line.length());
		if(!m.lookingAt()) {
			return -1;
		}
		tokens.add(makeToken(m.group(), ZTokenType.NUMBER, column, spaceBefore));
		return m.end();
	}

	private int readWord(int column, boolean spaceBefore) {
		Matcher m = IDENT.matcher(line);
		m.region(column, line.length());
		if(!m.lookingAt()) {
			return -1;
		}
		String word = m.group();
		if(mode == Mode.NORMAL && detectProse && proseDetector.isStarter(word)
				&& proseDetector.isProse(line.substring(column), false)) {
			tokens.add(makeToken(line.substring(column).trim(), ZTokenType.TEXT, column, spaceBefore));
			return line.length();
		}
		ZTokenType type;
		if(ReservedWords.keyword(word) != null) {
			type = ZTokenType.KEYWORD;
		} else if(ReservedWords.isOperator(word)) {
			type = ZTokenType.OPERATOR;
		} else {
			type = ZTokenType.IDENTIFIER;
		}
		tokens.add(makeToken(word, type, column, spaceBefore));
		return m.end();
	}

	private String longestSymbolAt(int column) {
		for(String symbol : ReservedWords.symbolsLongestFirst()) {
			if(line.startsWith(symbol, column)) {
				return symbol;
			}
		}
		return null;
	}

	/**
	 * @return the index of the '>' closing a sequence literal opened at openIndex, or -1 if the '<' is a
	 * comparison
	 */
	int findSequenceClose(int openIndex) {
		int first = openIndex + 1;
		if(first >= line.length() || Character.isWhitespace(line.charAt(first))) {
			return -1;
		}
		int depth = 1;
		int j = first;
		while(j < line.length()) {
			String symbol = longestSymbolAt(j);
			if(symbol != null && symbol.length() > 1) {
				ZOperator op = ReservedWords.infix(symbol);
				if(op != null && (op.isLogical() || op.isComparison())) {
					return -1;
				}
				j += symbol.length();
				continue;
			}
			char c = line.charAt(j);
			if(Character.isLetter(c)) {
				Matcher m = IDENT.matcher(line);
				m.region(j, line.length());
				if(m.lookingAt()) {
					ZOperator op = ReservedWords.infix(m.group());
					if(op != null && (op.isLogical() || op.isComparison())) {
						return -1;
					}
					j = m.end();
					continue;
				}
			}
			if(c == '<' && j + 1 < line.length() && !Character.isWhitespace(line.charAt(j + 1))) {
				++depth;
			} else if(c == '>') {
				if(Character.isWhitespace(line.charAt(j - 1))) {
					return -1;
				}
				--depth;
				if(depth == 0) {
					return j;
				}
			} else if(c == '<' || c == '=') {
				return -1;
			}
			++j;
		}
		return -1;
	}

	private static boolean isOperandEnd(char c) {
		return Character.isLetterOrDigit(c) || c == ']' || c == ')' || c == '_' || c == '\'';
	}

	private static int indexOfNonBlank(String s, int from) {
		int i = from;
		while(i < s.length() && (s.charAt(i) == ' ' || s.charAt(i) == '\t')) {
			++i;
		}
		return i;
	}

	private int columnOf(int index) {
		return line.codePointCount(0, Integer.min(index, line.length())) + 1;
	}

	private void addNewLine() {
		tokens.add(new ZToken("\n", ZTokenType.NEWLINE,
				new SourceLocation(lineOffset + line.length(), lineOffset + line.length(), lineNum, lineNum,
						columnOf(line.length()), columnOf(line.length()) + 1), false));
	}

	private ZToken makeToken(String value, ZTokenType type, int index, boolean spaceBefore) {
		int startColumn = columnOf(index);
		int endColumn = startColumn + value.codePointCount(0, value.length());
		int startOffset = lineOffset + index;
		return new ZToken(value, type,
				new SourceLocation(startOffset, startOffset + value.length(), lineNum, lineNum, startColumn,
						endColumn), spaceBefore);
	}

	private ZLexerException error(String msg, int index) {
		int column = columnOf(index);
		return new ZLexerException(msg,
				new SourceLocation(lineOffset + index, lineOffset + index, lineNum, lineNum, column, column), line);
	}
}

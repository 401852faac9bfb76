package zedtex.parser;

import zedtex.lexer.ProseDetector;
import zedtex.lexer.ZToken;
import zedtex.lexer.ZTokenType;
import zedtex.model.z.*;
import zedtex.util.SourceLocation;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Locale;
import java.util.regex.Pattern;

/**
 * Parses a whole document: a sequence of items, each a line or a block of lines.
 *
 * Items are recognised by their first token: section and solution markers, part labels, block keywords
 * (TEXT:, PROOF:, EQUIV: and so on), the boxed paragraphs axdef, schema, gendef and zed, given types, free
 * types and abbreviations. Any other line is an expression or predicate displayed on its own. There is no
 * error recovery; the first problem rejects the document.
 */
public class ZDocumentParser {

	private final TokenCursor cursor;
	private final ZExpressionParser expressions;
	private final InlineMathSegmenter segmenter;

	private String title;
	private String author;
	private String date;

	private ZDocumentParser(List<ZToken> tokens, ProseDetector proseDetector) {
		this.cursor = new TokenCursor(tokens);
		this.expressions = new ZExpressionParser(cursor);
		this.segmenter = new InlineMathSegmenter(proseDetector);
	}

	public static ZDocument parse(List<ZToken> tokens) {
		return parse(tokens, new ProseDetector());
	}

	/**
	 * @param proseDetector used to lex the formulas found inside text paragraphs
	 */
	public static ZDocument parse(List<ZToken> tokens, ProseDetector proseDetector) {
		return new ZDocumentParser(tokens, proseDetector).parseDocument();
	}

	private ZDocument parseDocument() {
		SourceLocation start = cursor.peek().getLocation();
		List<ZDocumentItem> items = new ArrayList<>();
		cursor.skipNewLines();
		while(!cursor.atEnd()) {
			ZDocumentItem item = parseItem();
			if(item != null) {
				items.add(item);
			}
			cursor.skipNewLines();
		}
		return new ZDocument(start.combine(cursor.peek().getLocation()), items, title, author, date);
	}

	private ZDocumentItem parseItem() {
		ZToken token = cursor.peek();
		if(token.getType() == ZTokenType.TEXT) {
			cursor.advance();
			ZTextBlock block = new ZTextBlock(token.getLocation(),
					segmenter.segment(token.getValue(), token.getLocation()));
			cursor.expectLineEnd();
			return block;
		}
		if(token.getType() == ZTokenType.KEYWORD) {
			ZKeyword keyword = ReservedWords.keyword(token.getValue());
			if(keyword == null || keyword == ZKeyword.PART) {
				// part labels other than (a) are not in the keyword table
				cursor.advance();
				String label = token.getValue();
				return new ZPart(token.getLocation(), label.substring(1, label.length() - 1));
			}
			switch(keyword) {
				case SECTION:
					return new ZSection(token.getLocation(), readLineText());
				case SOLUTION:
					return new ZSolution(token.getLocation(), readLineText());
				case TEXT: {
					cursor.advance();
					ZToken text = cursor.check(ZTokenType.TEXT) ? cursor.advance() : null;
					cursor.expectLineEnd();
					if(text == null) {
						return new ZTextBlock(token.getLocation(), Collections.emptyList());
					}
					return new ZTextBlock(token.getLocation(), segmenter.segment(text.getValue(), text.getLocation()));
				}
				case PURETEXT:
					return new ZPureText(token.getLocation(), readLineText());
				case LATEX:
					return new ZLatexBlock(token.getLocation(), readLineText());
				case PAGEBREAK:
					cursor.advance();
					cursor.expectLineEnd();
					return new ZPageBreak(token.getLocation());
				case TITLE:
					title = readLineText();
					return null;
				case AUTHOR:
					author = readLineText();
					return null;
				case DATE:
					date = readLineText();
					return null;
				case TRUTH_TABLE:
					return parseTruthTable();
				case EQUIV:
				case ARGUE:
					return parseEquivChain(keyword == ZKeyword.ARGUE);
				case PROOF:
					return parseProof();
				case INFRULE:
					return parseInferenceRule();
				case AXDEF:
				case SCHEMA:
				case GENDEF:
					return parseBoxedBlock(keyword);
				case ZED:
					return parseZedBlock();
				default:
					break;
			}
		}
		ZDocumentItem definition = parseDefinition();
		if(definition != null) {
			cursor.expectLineEnd();
			return definition;
		}
		return parseExpressionLine();
	}

	/**
	 * Consumes a keyword and the TEXT token captured after it on the same line.
	 */
	private String readLineText() {
		cursor.advance();
		String text = "";
		if(cursor.check(ZTokenType.TEXT)) {
			text = cursor.advance().getValue();
		}
		cursor.expectLineEnd();
		return text;
	}

	private ZDocumentItem parseExpressionLine() {
		ZExpression expression = expressions.parseExpression();
		if(cursor.check(ZTokenType.TEXT)) {
			// a formula followed by prose, as in "x > 0 for every x we consider"
			ZToken prose = cursor.advance();
			cursor.expectLineEnd();
			List<ZTextSegment> segments = new ArrayList<>();
			segments.add(ZTextSegment.math(expression.getLocation(), expression.toString(), expression));
			segments.add(ZTextSegment.prose(prose.getLocation(), " " + prose.getValue()));
			return new ZTextBlock(expression.getLocation(), segments);
		}
		cursor.expectLineEnd();
		return new ZDisplayExpression(expression.getLocation(), expression);
	}

	/**
	 * Given types, free types and abbreviations, which may appear on their own or inside a zed block.
	 *
	 * @return null, without consuming anything, if the line is not a definition
	 */
	private ZDocumentItem parseDefinition() {
		ZToken start = cursor.peek();
		if(start.is(ZTokenType.KEYWORD, "given")) {
			cursor.advance();
			List<String> names = new ArrayList<>();
			do {
				names.add(cursor.expectType(ZTokenType.IDENTIFIER, "type name").getValue());
			} while(cursor.matchDelimiter(","));
			return new ZGivenType(spanFrom(start), names);
		}
		if(start.is(ZTokenType.DELIMITER, "[")) {
			int after = skipGenericParameters(0);
			if(after == -1) {
				return null;
			}
			ZToken next = cursor.peek(after);
			if(next.getType() == ZTokenType.NEWLINE || next.getType() == ZTokenType.EOF) {
				// [A, B] on its own line introduces given sets
				return new ZGivenType(spanFrom(start), parseGenericParameters());
			}
			if(next.getType() == ZTokenType.IDENTIFIER && cursor.peek(after + 1).is(ZTokenType.DELIMITER, "==")) {
				List<String> parameters = parseGenericParameters();
				String name = cursor.advance().getValue();
				cursor.advance();
				ZExpression body = expressions.parseTypeExpression();
				return new ZAbbreviation(spanFrom(start), name, parameters, body);
			}
			return null;
		}
		if(start.getType() != ZTokenType.IDENTIFIER) {
			return null;
		}
		ZToken next = cursor.peek(1);
		if(next.is(ZTokenType.DELIMITER, "::=")) {
			return parseFreeType();
		}
		if(next.is(ZTokenType.DELIMITER, "==")) {
			cursor.advance();
			cursor.advance();
			ZExpression body = expressions.parseTypeExpression();
			return new ZAbbreviation(spanFrom(start), start.getValue(), Collections.emptyList(), body);
		}
		if(next.is(ZTokenType.DELIMITER, "[") && !next.hasSpaceBefore()) {
			int after = skipGenericParameters(1);
			if(after != -1 && cursor.peek(after).is(ZTokenType.DELIMITER, "==")) {
				cursor.advance();
				List<String> parameters = parseGenericParameters();
				cursor.advance();
				ZExpression body = expressions.parseTypeExpression();
				return new ZAbbreviation(spanFrom(start), start.getValue(), parameters, body);
			}
		}
		return null;
	}

	/**
	 * Looks ahead over a list of generic parameters [X, Y] without consuming it.
	 *
	 * @param offset the offset of the opening bracket from the current token
	 * @return the offset of the token after the closing bracket, or -1 if there is no such list
	 */
	private int skipGenericParameters(int offset) {
		int i = offset + 1;
		if(cursor.peek(i).getType() != ZTokenType.IDENTIFIER) {
			return -1;
		}
		++i;
		while(cursor.peek(i).is(ZTokenType.DELIMITER, ",")) {
			if(cursor.peek(i + 1).getType() != ZTokenType.IDENTIFIER) {
				return -1;
			}
			i += 2;
		}
		return cursor.peek(i).is(ZTokenType.DELIMITER, "]") ? i + 1 : -1;
	}

	private SourceLocation spanFrom(ZToken start) {
		return start.getLocation().combine(cursor.previous().getLocation());
	}

	private List<String> parseGenericParameters() {
		cursor.expectDelimiter("[");
		List<String> parameters = new ArrayList<>();
		do {
			parameters.add(cursor.expectType(ZTokenType.IDENTIFIER, "generic parameter").getValue());
		} while(cursor.matchDelimiter(","));
		cursor.expect(ZTokenType.DELIMITER, "]", "',' or ']'");
		return parameters;
	}

	private ZFreeType parseFreeType() {
		ZToken name = cursor.advance();
		cursor.advance();
		List<ZFreeTypeBranch> branches = new ArrayList<>();
		do {
			skipContinuations();
			ZToken constructor = cursor.expectType(ZTokenType.IDENTIFIER, "constructor name");
			ZExpression parameter = null;
			if(cursor.checkDelimiter("<") || cursor.checkDelimiter("⟨")) {
				String close = cursor.advance().getValue().equals("<") ? ">" : "⟩";
				parameter = expressions.parseTypeExpression();
				cursor.expect(ZTokenType.DELIMITER, close, "'" + close + "'");
			} else if(cursor.checkDelimiter("(") && !cursor.peek().hasSpaceBefore()) {
				cursor.advance();
				parameter = expressions.parseTypeExpression();
				cursor.expectDelimiter(")");
			}
			branches.add(new ZFreeTypeBranch(spanFrom(constructor), constructor.getValue(), parameter));
			skipContinuations();
		} while(cursor.matchDelimiter("|"));
		return new ZFreeType(spanFrom(name), name.getValue(), branches);
	}

	private void skipContinuations() {
		while(cursor.check(ZTokenType.CONTINUATION)) {
			cursor.advance();
		}
	}

	private ZTruthTable parseTruthTable() {
		ZToken start = cursor.advance();
		cursor.expectLineEnd();
		List<ZExpression> header = new ArrayList<>();
		do {
			header.add(expressions.parseExpression());
		} while(cursor.matchDelimiter("|"));
		cursor.expectLineEnd();
		List<List<String>> rows = new ArrayList<>();
		while(!cursor.atLineEnd()) {
			ZToken rowStart = cursor.peek();
			List<String> row = new ArrayList<>();
			StringBuilder cell = new StringBuilder();
			while(!cursor.atLineEnd()) {
				ZToken token = cursor.advance();
				if(token.is(ZTokenType.DELIMITER, "|")) {
					row.add(cell.toString());
					cell.setLength(0);
					continue;
				}
				if(cell.length() > 0 && token.hasSpaceBefore()) {
					cell.append(' ');
				}
				cell.append(token.getValue());
			}
			row.add(cell.toString());
			if(row.size() != header.size()) {
				throw cursor.errorAt(rowStart, "truth table row has " + row.size() + " cells but the header has "
						+ header.size(), header.size() + " cells");
			}
			rows.add(row);
			cursor.expectLineEnd();
		}
		return new ZTruthTable(spanFrom(start), header, rows);
	}

	private ZEquivChain parseEquivChain(boolean argue) {
		ZToken start = cursor.advance();
		cursor.expectLineEnd();
		List<ZEquivStep> steps = new ArrayList<>();
		while(!cursor.atLineEnd()) {
			ZToken lineStart = cursor.peek();
			ZOperator connective = null;
			if(lineStart.getType() == ZTokenType.OPERATOR) {
				ZOperator op = ReservedWords.infix(lineStart.getValue());
				if(op == ZOperator.IFF || op == ZOperator.IMPLIES) {
					if(steps.isEmpty()) {
						throw cursor.errorAt(lineStart, "the first step of a chain has no connective",
								"expression");
					}
					cursor.advance();
					connective = op;
				}
			}
			if(connective == null && !steps.isEmpty()) {
				connective = ZOperator.IFF;
			}
			ZExpression expression = expressions.parseExpression();
			String justification = null;
			if(cursor.check(ZTokenType.TEXT)) {
				justification = cursor.advance().getValue();
			}
			steps.add(new ZEquivStep(spanFrom(lineStart), connective, expression, justification));
			cursor.expectLineEnd();
		}
		if(steps.isEmpty()) {
			throw cursor.error("a step of the chain");
		}
		return new ZEquivChain(spanFrom(start), argue, steps);
	}

	private static final Pattern LABEL = Pattern.compile("[0-9]{1,9}");

	private int parseLabel(ZToken token) {
		if(!LABEL.matcher(token.getValue()).matches()) {
			throw cursor.errorAt(token, "assumption label");
		}
		return Integer.parseInt(token.getValue());
	}

	private ZProofTree parseProof() {
		ZToken start = cursor.advance();
		cursor.expectLineEnd();
		List<ProofTreeReducer.ProofLine> lines = new ArrayList<>();
		while(!cursor.atLineEnd()) {
			ZToken first = cursor.peek();
			ProofTreeReducer.LineKind kind = ProofTreeReducer.LineKind.NODE;
			Integer label = null;
			ZExpression expression;
			if(cursor.matchDelimiter("::")) {
				kind = ProofTreeReducer.LineKind.SIBLING;
				expression = expressions.parseExpression();
			} else if(cursor.check(ZTokenType.KEYWORD, "case")) {
				cursor.advance();
				kind = ProofTreeReducer.LineKind.CASE;
				expression = expressions.parseExpression();
				cursor.expectDelimiter(":");
			} else {
				if(cursor.checkDelimiter("[") && cursor.peek(1).getType() == ZTokenType.NUMBER
						&& cursor.peek(2).is(ZTokenType.DELIMITER, "]")) {
					cursor.advance();
					label = parseLabel(cursor.advance());
					cursor.advance();
					kind = ProofTreeReducer.LineKind.ASSUMPTION;
				}
				expression = expressions.parseExpression();
			}
			String justification = null;
			if(cursor.check(ZTokenType.TEXT)) {
				justification = cursor.advance().getValue();
				if(kind == ProofTreeReducer.LineKind.NODE
						&& justification.toLowerCase(Locale.ROOT).equals("assumption")) {
					kind = ProofTreeReducer.LineKind.ASSUMPTION;
				}
			}
			cursor.expectLineEnd();
			lines.add(new ProofTreeReducer.ProofLine(kind, first.getColumn() - 1, expression, justification, label,
					first));
		}
		ZProofNode root = new ProofTreeReducer(cursor).reduce(lines);
		return new ZProofTree(spanFrom(start), root);
	}

	private ZInferenceRule parseInferenceRule() {
		ZToken start = cursor.advance();
		String label = null;
		if(cursor.check(ZTokenType.TEXT)) {
			label = cursor.advance().getValue();
		}
		cursor.expectLineEnd();
		List<ZExpression> premises = new ArrayList<>();
		while(!isRuleLine()) {
			if(cursor.atLineEnd()) {
				throw cursor.error("a premise or a line of dashes");
			}
			do {
				premises.add(expressions.parseExpression());
			} while(cursor.matchDelimiter(","));
			cursor.expectLineEnd();
		}
		while(cursor.check(ZTokenType.OPERATOR, "-")) {
			cursor.advance();
		}
		cursor.expectLineEnd();
		ZExpression conclusion = expressions.parseExpression();
		if(cursor.check(ZTokenType.TEXT)) {
			String justification = cursor.advance().getValue();
			if(label == null) {
				label = justification;
			}
		}
		cursor.expectLineEnd();
		return new ZInferenceRule(spanFrom(start), premises, conclusion, label);
	}

	private boolean isRuleLine() {
		return cursor.check(ZTokenType.OPERATOR, "-") && cursor.peek(1).is(ZTokenType.OPERATOR, "-")
				&& cursor.peek(2).is(ZTokenType.OPERATOR, "-");
	}

	private ZBoxedBlock parseBoxedBlock(ZKeyword keyword) {
		ZToken start = cursor.advance();
		ZBoxedBlock.Kind kind;
		switch(keyword) {
			case AXDEF:
				kind = ZBoxedBlock.Kind.AXDEF;
				break;
			case SCHEMA:
				kind = ZBoxedBlock.Kind.SCHEMA;
				break;
			default:
				kind = ZBoxedBlock.Kind.GENDEF;
		}
		String name = null;
		if(kind == ZBoxedBlock.Kind.SCHEMA) {
			name = cursor.expectType(ZTokenType.IDENTIFIER, "schema name").getValue();
		}
		List<String> parameters = Collections.emptyList();
		if(cursor.checkDelimiter("[")) {
			parameters = parseGenericParameters();
		}
		cursor.expectLineEnd();

		List<ZDeclaration> declarations = new ArrayList<>();
		while(true) {
			cursor.skipNewLines();
			if(cursor.check(ZTokenType.KEYWORD, "where") || cursor.check(ZTokenType.KEYWORD, "end")) {
				break;
			}
			if(cursor.atEnd()) {
				throw cursor.error("'where' or 'end'");
			}
			parseDeclarationLine(declarations);
		}

		List<List<ZExpression>> groups = new ArrayList<>();
		if(cursor.match(ZTokenType.KEYWORD, "where")) {
			cursor.expectLineEnd();
			List<ZExpression> group = new ArrayList<>();
			while(!cursor.check(ZTokenType.KEYWORD, "end")) {
				if(cursor.check(ZTokenType.NEWLINE)) {
					// a blank line separates groups of predicates
					cursor.advance();
					if(!group.isEmpty()) {
						groups.add(group);
						group = new ArrayList<>();
					}
					continue;
				}
				if(cursor.atEnd()) {
					throw cursor.error("'end'");
				}
				do {
					group.add(expressions.parseExpression());
				} while(cursor.matchDelimiter(";"));
				cursor.expectLineEnd();
			}
			if(!group.isEmpty()) {
				groups.add(group);
			}
		}
		cursor.expect(ZTokenType.KEYWORD, "end", "'end'");
		cursor.expectLineEnd();
		return new ZBoxedBlock(spanFrom(start), kind, name, parameters, declarations, groups);
	}

	/**
	 * x, y : T; z : U on one line, or a schema name on its own for inclusion.
	 */
	private void parseDeclarationLine(List<ZDeclaration> declarations) {
		do {
			ZToken start = cursor.peek();
			List<ZIdentifier> names = new ArrayList<>();
			do {
				ZToken name = cursor.expectType(ZTokenType.IDENTIFIER, "declared name");
				names.add(new ZIdentifier(name.getLocation(), name.getValue()));
			} while(cursor.matchDelimiter(","));
			ZExpression type = null;
			if(cursor.matchDelimiter(":")) {
				type = expressions.parseTypeExpression();
			} else if(names.size() > 1 || !(cursor.atLineEnd() || cursor.checkDelimiter(";"))) {
				throw cursor.error("':'");
			}
			declarations.add(new ZDeclaration(spanFrom(start), names, type));
		} while(cursor.matchDelimiter(";"));
		cursor.expectLineEnd();
	}

	private ZZedBlock parseZedBlock() {
		ZToken start = cursor.advance();
		cursor.expectLineEnd();
		List<ZDocumentItem> items = new ArrayList<>();
		while(true) {
			cursor.skipNewLines();
			if(cursor.check(ZTokenType.KEYWORD, "end")) {
				break;
			}
			if(cursor.atEnd()) {
				throw cursor.error("'end'");
			}
			ZDocumentItem definition = parseDefinition();
			if(definition != null) {
				cursor.expectLineEnd();
				items.add(definition);
			} else {
				ZExpression predicate = expressions.parseExpression();
				cursor.expectLineEnd();
				items.add(new ZDisplayExpression(predicate.getLocation(), predicate));
			}
		}
		cursor.advance();
		cursor.expectLineEnd();
		return new ZZedBlock(spanFrom(start), items);
	}
}

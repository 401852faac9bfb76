package zedtex.parser;

import zedtex.lexer.ZToken;
import zedtex.lexer.ZTokenType;
import zedtex.model.z.*;
import zedtex.util.SourceLocation;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collections;
import java.util.HashSet;
import java.util.List;
import java.util.Set;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Recursive descent parser for expressions and predicates, by precedence climbing over the binding powers in
 * {@link ZOperator}.
 *
 * From loosest to tightest: conditional, iff, implies, or, and, not, comparison chains, function and relation
 * types, maplet, relational operators, range, additive, multiplicative, prefix operators, postfix forms, atoms.
 * Conditionals and binders are atoms that extend as far to the right as possible.
 *
 * The parser tracks whether it is reading a type (a declaration type, a binding domain, a generic parameter
 * or a free type constructor parameter), because there a spaced identifier x is the Cartesian product.
 */
public class ZExpressionParser {

	private static final Pattern SUBSCRIPTED = Pattern.compile("([A-Za-z])_([A-Za-z0-9]+)");
	private static final Set<String> BULLETS = Collections.unmodifiableSet(new HashSet<>(Arrays.asList(
			".", "•", "@")));
	private static final int COMPARISON_PRECEDENCE = 6;

	private final TokenCursor cursor;
	private boolean typeContext;

	public ZExpressionParser(TokenCursor cursor) {
		this.cursor = cursor;
		this.typeContext = false;
	}

	/**
	 * Parses an expression or predicate, stopping at the first token that cannot continue it.
	 */
	public ZExpression parseExpression() {
		return parseInContext(false);
	}

	/**
	 * Parses an expression in which a spaced identifier x stands for the Cartesian product.
	 */
	public ZExpression parseTypeExpression() {
		return parseInContext(true);
	}

	private ZExpression parseInContext(boolean inType) {
		boolean saved = typeContext;
		typeContext = inType;
		try {
			return parseBinary(1);
		} finally {
			typeContext = saved;
		}
	}

	public static boolean isBullet(ZToken token) {
		return token.getType() == ZTokenType.DELIMITER && BULLETS.contains(token.getValue())
				&& (!token.getValue().equals(".") || token.hasSpaceBefore());
	}

	private SourceLocation spanFrom(SourceLocation start) {
		return start.combine(cursor.previous().getLocation());
	}

	/**
	 * @return the infix operator the token stands for at this position, or null if it does not continue an
	 * infix expression
	 */
	private ZOperator infixAt(ZToken token) {
		if(token.getType() == ZTokenType.OPERATOR) {
			return ReservedWords.infix(token.getValue());
		}
		if(isTypeCross(token)) {
			return ZOperator.CROSS;
		}
		return null;
	}

	private boolean isTypeCross(ZToken token) {
		return typeContext && token.is(ZTokenType.IDENTIFIER, "x") && token.hasSpaceBefore();
	}

	private ZExpression parseBinary(int minPrecedence) {
		ZExpression lhs = parseUnary();
		while(true) {
			ZToken token = cursor.peek();
			boolean continued = false;
			if(token.getType() == ZTokenType.CONTINUATION) {
				// a break before an operator is kept as a break after it
				ZOperator next = infixAt(cursor.peek(1));
				if(next == null || next.getPrecedence() < minPrecedence) {
					return lhs;
				}
				cursor.advance();
				continued = true;
				token = cursor.peek();
			}
			ZOperator op = infixAt(token);
			if(op == null || op.getPrecedence() < minPrecedence) {
				return lhs;
			}
			if(op.isComparison()) {
				lhs = parseComparisons(lhs, continued);
				continue;
			}
			cursor.advance();
			boolean lineBreak = continued;
			if(cursor.check(ZTokenType.CONTINUATION)) {
				cursor.advance();
				lineBreak = true;
			}
			if(op == ZOperator.UPTO) {
				ZExpression to = parseBinary(op.getPrecedence() + 1);
				lhs = new ZRange(lhs.getLocation().combine(to.getLocation()), lhs, to);
				continue;
			}
			int nextMin = op.getAssociativity() == ZOperator.Associativity.RIGHT
					? op.getPrecedence() : op.getPrecedence() + 1;
			ZExpression rhs = parseBinary(nextMin);
			lhs = new ZBinOp(lhs.getLocation().combine(rhs.getLocation()), token.getValue(), op, lhs, rhs,
					lineBreak);
		}
	}

	/**
	 * a = b is a plain binary operation; a < b <= c is a chain meaning a < b and b <= c.
	 */
	private ZExpression parseComparisons(ZExpression first, boolean continued) {
		List<ZExpression> operands = new ArrayList<>();
		List<String> surfaces = new ArrayList<>();
		List<ZOperator> operators = new ArrayList<>();
		List<Boolean> lineBreaks = new ArrayList<>();
		operands.add(first);
		boolean lineBreak = continued;
		while(true) {
			ZToken token = cursor.peek();
			if(!operators.isEmpty() && token.getType() == ZTokenType.CONTINUATION) {
				ZOperator next = infixAt(cursor.peek(1));
				if(next == null || !next.isComparison()) {
					break;
				}
				cursor.advance();
				lineBreak = true;
				token = cursor.peek();
			}
			ZOperator op = infixAt(token);
			if(op == null || !op.isComparison()) {
				break;
			}
			cursor.advance();
			if(cursor.check(ZTokenType.CONTINUATION)) {
				cursor.advance();
				lineBreak = true;
			}
			operators.add(op);
			surfaces.add(token.getValue());
			lineBreaks.add(lineBreak);
			lineBreak = false;
			operands.add(parseBinary(COMPARISON_PRECEDENCE + 1));
		}
		SourceLocation location = first.getLocation().combine(operands.get(operands.size() - 1).getLocation());
		if(operators.size() == 1) {
			return new ZBinOp(location, surfaces.get(0), operators.get(0), first, operands.get(1),
					lineBreaks.get(0));
		}
		return new ZRelationChain(location, operands, surfaces, operators, lineBreaks);
	}

	private ZExpression parseUnary() {
		ZToken token = cursor.peek();
		if(token.getType() == ZTokenType.OPERATOR) {
			ZOperator prefix = ReservedWords.prefix(token.getValue());
			if(prefix == ZOperator.NOT) {
				cursor.advance();
				ZExpression operand = parseBinary(COMPARISON_PRECEDENCE);
				return new ZUnary(token.getLocation().combine(operand.getLocation()), token.getValue(), prefix,
						operand);
			}
			// a word operator with nothing to apply to, as in seq[X], is a name
			if(prefix != null && (!prefix.isWordPrefix() || OperandStart.isOperandStart(cursor.peek(1)))) {
				cursor.advance();
				ZExpression operand = parseUnary();
				return new ZUnary(token.getLocation().combine(operand.getLocation()), token.getValue(), prefix,
						operand);
			}
		}
		return parsePostfix(parsePrimary(), true);
	}

	private ZExpression parsePostfix(ZExpression expr, boolean allowJuxtaposition) {
		while(true) {
			ZToken token = cursor.peek();
			if(token.getType() == ZTokenType.DELIMITER) {
				String value = token.getValue();
				if(value.equals("(") && !token.hasSpaceBefore()) {
					cursor.advance();
					List<ZExpression> arguments = parseExpressionList(")", false);
					expr = new ZFunctionCall(spanFrom(expr.getLocation()), expr, arguments);
					continue;
				}
				if(value.equals("(|")) {
					cursor.advance();
					ZExpression set = parseExpression();
					cursor.expectDelimiter("|)");
					expr = new ZRelationalImage(spanFrom(expr.getLocation()), expr, set);
					continue;
				}
				if(value.equals("[") && !token.hasSpaceBefore()) {
					cursor.advance();
					List<ZExpression> parameters = parseExpressionList("]", true);
					expr = new ZGenericInstantiation(spanFrom(expr.getLocation()), expr, parameters);
					continue;
				}
				if(value.equals(".") && !token.hasSpaceBefore() && isProjectionField(cursor.peek(1))) {
					cursor.advance();
					ZToken field = cursor.advance();
					expr = new ZProjection(spanFrom(expr.getLocation()), expr, field.getValue());
					continue;
				}
				if(value.equals("^")) {
					cursor.advance();
					ZExpression exponent = parseScript();
					expr = new ZSuperscript(spanFrom(expr.getLocation()), expr, exponent);
					continue;
				}
			}
			if(token.getType() == ZTokenType.OPERATOR) {
				ZOperator postfix = ReservedWords.postfix(token.getValue());
				if(postfix == ZOperator.INVERSE || (postfix != null && isClosure(token))) {
					cursor.advance();
					expr = new ZUnary(spanFrom(expr.getLocation()), token.getValue(), postfix, expr);
					continue;
				}
			}
			if(allowJuxtaposition && isApplicable(expr) && token.hasSpaceBefore()
					&& OperandStart.isOperandStart(token) && !isTypeCross(token)) {
				ZExpression argument;
				if(token.getType() == ZTokenType.OPERATOR) {
					argument = parseUnary();
				} else {
					argument = parsePostfix(parsePrimary(), false);
				}
				expr = new ZApplication(expr.getLocation().combine(argument.getLocation()), expr, argument);
				continue;
			}
			return expr;
		}
	}

	/**
	 * R+ and R* are closures when the symbol is tight against R and is not tight against a following operand.
	 */
	private boolean isClosure(ZToken token) {
		if(token.hasSpaceBefore()) {
			return false;
		}
		ZToken next = cursor.peek(1);
		return next.hasSpaceBefore() || !OperandStart.isOperandStart(next);
	}

	private static boolean isProjectionField(ZToken token) {
		return !token.hasSpaceBefore()
				&& (token.getType() == ZTokenType.IDENTIFIER || token.getType() == ZTokenType.NUMBER);
	}

	private static boolean isApplicable(ZExpression expr) {
		if(expr instanceof ZUnary) {
			return ((ZUnary) expr).isPostfix();
		}
		return expr instanceof ZIdentifier || expr instanceof ZApplication || expr instanceof ZFunctionCall
				|| expr instanceof ZGenericInstantiation || expr instanceof ZSubscript
				|| expr instanceof ZParenthesized;
	}

	private ZExpression parseScript() {
		if(cursor.checkDelimiter("{") && !cursor.peek().hasSpaceBefore()) {
			cursor.advance();
			ZExpression script = parseExpression();
			cursor.expectDelimiter("}");
			return script;
		}
		return parsePrimary();
	}

	private ZExpression parsePrimary() {
		ZToken token = cursor.peek();
		switch(token.getType()) {
			case IDENTIFIER:
				cursor.advance();
				return identifier(token);
			case NUMBER:
				cursor.advance();
				return new ZNumber(token.getLocation(), token.getValue());
			case OPERATOR:
				if(ReservedWords.prefix(token.getValue()) != null
						&& ReservedWords.prefix(token.getValue()).isWordPrefix()) {
					cursor.advance();
					return new ZIdentifier(token.getLocation(), token.getValue());
				}
				break;
			case KEYWORD: {
				ZKeyword keyword = ReservedWords.keyword(token.getValue());
				if(keyword != null && keyword.isQuantifier()) {
					return parseQuantifier();
				}
				if(keyword == ZKeyword.IF) {
					return parseConditional();
				}
				break;
			}
			case DELIMITER:
				switch(token.getValue()) {
					case "(":
						return parseParenthesized();
					case "{":
						return parseBraces();
					case "<":
					case "⟨":
						return parseBracketed(ZSequenceLiteral.class);
					case "[[":
					case "⟦":
						return parseBracketed(ZBagLiteral.class);
					default:
						break;
				}
				break;
			default:
				break;
		}
		throw cursor.error("expression");
	}

	/**
	 * x_1 is x subscripted by 1 when the base is a single letter; longer names keep their underscores.
	 */
	private static ZExpression identifier(ZToken token) {
		Matcher m = SUBSCRIPTED.matcher(token.getValue());
		if(m.matches()) {
			ZIdentifier base = new ZIdentifier(token.getLocation(), m.group(1));
			String index = m.group(2);
			ZExpression indexExpr = index.matches("[0-9]+")
					? new ZNumber(token.getLocation(), index)
					: new ZIdentifier(token.getLocation(), index);
			return new ZSubscript(token.getLocation(), base, indexExpr);
		}
		return new ZIdentifier(token.getLocation(), token.getValue());
	}

	private ZExpression parseParenthesized() {
		ZToken open = cursor.advance();
		ZExpression first = parseBinary(1);
		if(cursor.checkDelimiter(",")) {
			List<ZExpression> elements = new ArrayList<>();
			elements.add(first);
			while(cursor.matchDelimiter(",")) {
				elements.add(parseBinary(1));
			}
			cursor.expectDelimiter(")");
			return new ZTuple(spanFrom(open.getLocation()), elements);
		}
		cursor.expectDelimiter(")");
		if(isAtomic(first)) {
			return first;
		}
		return new ZParenthesized(spanFrom(open.getLocation()), first);
	}

	private static boolean isAtomic(ZExpression expr) {
		return expr instanceof ZIdentifier || expr instanceof ZNumber || expr instanceof ZSetLiteral
				|| expr instanceof ZSequenceLiteral || expr instanceof ZBagLiteral || expr instanceof ZTuple
				|| expr instanceof ZSetComprehension || expr instanceof ZParenthesized;
	}

	private ZExpression parseBraces() {
		ZToken open = cursor.advance();
		if(isComprehensionStart()) {
			List<ZBindingGroup> bindings = new ArrayList<>();
			parseBindingGroups(bindings);
			ZExpression predicate = null;
			ZExpression result = null;
			if(cursor.matchDelimiter("|")) {
				predicate = parseExpression();
			}
			if(isBullet(cursor.peek())) {
				cursor.advance();
				result = parseExpression();
			}
			cursor.expect(ZTokenType.DELIMITER, "}", "'}'");
			return new ZSetComprehension(spanFrom(open.getLocation()), bindings, predicate, result);
		}
		List<ZExpression> elements = parseExpressionList("}", false);
		return new ZSetLiteral(spanFrom(open.getLocation()), elements);
	}

	/**
	 * A brace starts a comprehension when it is followed by a list of names and then ':' or '|'.
	 */
	private boolean isComprehensionStart() {
		int i = 0;
		if(cursor.peek(i).getType() != ZTokenType.IDENTIFIER) {
			return false;
		}
		while(cursor.peek(i + 1).is(ZTokenType.DELIMITER, ",")
				&& cursor.peek(i + 2).getType() == ZTokenType.IDENTIFIER) {
			i += 2;
		}
		ZToken after = cursor.peek(i + 1);
		return after.is(ZTokenType.DELIMITER, ":") || after.is(ZTokenType.DELIMITER, "|");
	}

	private ZExpression parseBracketed(Class<? extends ZExpression> kind) {
		ZToken open = cursor.advance();
		String close;
		switch(open.getValue()) {
			case "<":
				close = ">";
				break;
			case "⟨":
				close = "⟩";
				break;
			case "[[":
				close = "]]";
				break;
			default:
				close = "⟧";
		}
		List<ZExpression> elements = parseExpressionList(close, false);
		if(kind == ZSequenceLiteral.class) {
			return new ZSequenceLiteral(spanFrom(open.getLocation()), elements);
		}
		return new ZBagLiteral(spanFrom(open.getLocation()), elements);
	}

	/**
	 * Parses comma separated expressions up to and including the closing delimiter; the list may be empty.
	 */
	private List<ZExpression> parseExpressionList(String close, boolean inType) {
		List<ZExpression> elements = new ArrayList<>();
		if(cursor.matchDelimiter(close)) {
			return elements;
		}
		do {
			elements.add(parseInContext(inType));
		} while(cursor.matchDelimiter(","));
		cursor.expect(ZTokenType.DELIMITER, close, "',' or '" + close + "'");
		return elements;
	}

	private ZExpression parseConditional() {
		ZToken start = cursor.advance();
		ZExpression condition = parseExpression();
		boolean breakBeforeThen = matchContinuation();
		cursor.expect(ZTokenType.KEYWORD, "then", "'then'");
		ZExpression thenBranch = parseExpression();
		boolean breakBeforeElse = matchContinuation();
		cursor.expect(ZTokenType.KEYWORD, "else", "'else'");
		ZExpression elseBranch = parseExpression();
		return new ZConditional(start.getLocation().combine(elseBranch.getLocation()), condition, thenBranch,
				elseBranch, breakBeforeThen, breakBeforeElse);
	}

	private boolean matchContinuation() {
		if(cursor.check(ZTokenType.CONTINUATION)) {
			cursor.advance();
			return true;
		}
		return false;
	}

	private ZExpression parseQuantifier() {
		ZToken start = cursor.advance();
		ZQuantifier.Kind kind = ReservedWords.keyword(start.getValue()).toQuantifierKind();
		List<ZBindingGroup> bindings = new ArrayList<>();
		String separator = parseBindingGroups(bindings);
		ZExpression predicate = null;
		ZExpression result = null;
		if(cursor.matchDelimiter("|")) {
			predicate = parseExpression();
			if(isBullet(cursor.peek())) {
				cursor.advance();
				result = parseExpression();
			}
		} else if(isBullet(cursor.peek())) {
			cursor.advance();
			ZExpression body = parseExpression();
			if(kind == ZQuantifier.Kind.MU || kind == ZQuantifier.Kind.LAMBDA) {
				result = body;
			} else {
				predicate = body;
			}
		} else {
			throw cursor.error("'|' or '.'");
		}
		return new ZQuantifier(spanFrom(start.getLocation()), kind, bindings, separator, predicate, result);
	}

	/**
	 * Parses binding groups such as x, y : N; z : Z into groups. A new group starts after ';', or after ','
	 * once the previous group has a domain.
	 *
	 * @return the separator written between groups, ";" when there is only one group
	 */
	public String parseBindingGroups(List<ZBindingGroup> groups) {
		String separator = null;
		while(true) {
			ZToken start = cursor.peek();
			List<ZIdentifier> names = new ArrayList<>();
			names.add(parseName());
			while(cursor.checkDelimiter(",") && cursor.peek(1).getType() == ZTokenType.IDENTIFIER) {
				cursor.advance();
				names.add(parseName());
			}
			ZExpression domain = null;
			if(cursor.matchDelimiter(":")) {
				domain = parseTypeExpression();
			}
			groups.add(new ZBindingGroup(spanFrom(start.getLocation()), names, domain));
			if(cursor.checkDelimiter(";")
					|| (domain != null && cursor.checkDelimiter(",")
					&& cursor.peek(1).getType() == ZTokenType.IDENTIFIER)) {
				if(separator == null) {
					separator = cursor.peek().getValue();
				}
				cursor.advance();
				continue;
			}
			return separator == null ? ";" : separator;
		}
	}

	private ZIdentifier parseName() {
		ZToken token = cursor.expectType(ZTokenType.IDENTIFIER, "identifier");
		return new ZIdentifier(token.getLocation(), token.getValue());
	}
}

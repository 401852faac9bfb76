package zedtex.trans.passes.codegen.latex;

import zedtex.model.z.*;

/**
 * Decides where the generator writes parentheses that the tree does not hold explicitly.
 *
 * Two rules apply. An operand is enclosed when it binds more loosely than its parent, or equally on the side
 * the parent does not associate to. Binders (quantifiers, lambda, mu and conditionals) extend as far to the
 * right as they can: they are enclosed when something follows them, and fuzz wants them enclosed wherever they
 * are nested inside another expression. The body of a binder and the contents of explicit parentheses are
 * never enclosed again.
 */
public class Parenthesizer {

	/**
	 * Where a node sits within its parent.
	 */
	public enum Position {
		/** left operand of an infix operator, or a non-final operand of a chain or range */
		LEFT,
		RIGHT,
		/** operand of a prefix operator */
		OPERAND,
		/** the applied function, projected tuple, instantiated generic, scripted base or closed relation */
		BASE,
		/** argument of an application written by juxtaposition */
		ARGUMENT,
		/** element of a bracketed list, an argument list, a declared type or a branch of a conditional */
		ENCLOSED,
		/** body or constraint of a binder, or the contents of explicit parentheses */
		BODY,
	}

	private static class Shape {
		final int precedence;
		final ZOperator.Associativity associativity;
		final ZOperator operator;
		final boolean application;
		final boolean script;

		Shape(int precedence, ZOperator.Associativity associativity, ZOperator operator, boolean application,
		      boolean script) {
			this.precedence = precedence;
			this.associativity = associativity;
			this.operator = operator;
			this.application = application;
			this.script = script;
		}

		static Shape of(int precedence) {
			return new Shape(precedence, ZOperator.Associativity.NONE, null, false, false);
		}
	}

	private static final Shape ATOM = Shape.of(ZOperator.ATOM_PRECEDENCE);
	private static final Shape BINDER = Shape.of(ZOperator.BINDER_PRECEDENCE);
	private static final Shape APPLICATION = new Shape(ZOperator.POSTFIX_PRECEDENCE, ZOperator.Associativity.LEFT,
			null, true, false);
	private static final Shape SCRIPT = new Shape(ZOperator.POSTFIX_PRECEDENCE, ZOperator.Associativity.NONE,
			null, false, true);
	private static final Shape POSTFIX = Shape.of(ZOperator.POSTFIX_PRECEDENCE);
	private static final Shape COMPARISON = Shape.of(ZOperator.EQUALS.getPrecedence());
	private static final Shape RANGE = Shape.of(ZOperator.UPTO.getPrecedence());

	private static final ZExpressionVisitor<Shape, RuntimeException> SHAPE =
			new ZExpressionVisitor<Shape, RuntimeException>() {
		@Override
		public Shape visit(ZIdentifier zIdentifier) {
			return ATOM;
		}

		@Override
		public Shape visit(ZNumber zNumber) {
			return ATOM;
		}

		@Override
		public Shape visit(ZUnary zUnary) {
			ZOperator operator = zUnary.getOperator();
			if(zUnary.isPostfix()) {
				return new Shape(operator.getPrecedence(), ZOperator.Associativity.NONE, operator, false, true);
			}
			return new Shape(operator.getPrecedence(), ZOperator.Associativity.NONE, operator, false, false);
		}

		@Override
		public Shape visit(ZBinOp zBinOp) {
			ZOperator operator = zBinOp.getOperator();
			return new Shape(operator.getPrecedence(), operator.getAssociativity(), operator, false, false);
		}

		@Override
		public Shape visit(ZRelationChain zRelationChain) {
			return COMPARISON;
		}

		@Override
		public Shape visit(ZQuantifier zQuantifier) {
			return BINDER;
		}

		@Override
		public Shape visit(ZSetComprehension zSetComprehension) {
			return ATOM;
		}

		@Override
		public Shape visit(ZSetLiteral zSetLiteral) {
			return ATOM;
		}

		@Override
		public Shape visit(ZSequenceLiteral zSequenceLiteral) {
			return ATOM;
		}

		@Override
		public Shape visit(ZBagLiteral zBagLiteral) {
			return ATOM;
		}

		@Override
		public Shape visit(ZTuple zTuple) {
			return ATOM;
		}

		@Override
		public Shape visit(ZProjection zProjection) {
			return POSTFIX;
		}

		@Override
		public Shape visit(ZRange zRange) {
			return RANGE;
		}

		@Override
		public Shape visit(ZConditional zConditional) {
			return BINDER;
		}

		@Override
		public Shape visit(ZFunctionCall zFunctionCall) {
			return APPLICATION;
		}

		@Override
		public Shape visit(ZApplication zApplication) {
			return APPLICATION;
		}

		@Override
		public Shape visit(ZGenericInstantiation zGenericInstantiation) {
			return POSTFIX;
		}

		@Override
		public Shape visit(ZRelationalImage zRelationalImage) {
			return POSTFIX;
		}

		@Override
		public Shape visit(ZSuperscript zSuperscript) {
			return SCRIPT;
		}

		@Override
		public Shape visit(ZSubscript zSubscript) {
			return SCRIPT;
		}

		@Override
		public Shape visit(ZParenthesized zParenthesized) {
			return ATOM;
		}
	};

	private final DialectSymbols symbols;

	public Parenthesizer(DialectSymbols symbols) {
		this.symbols = symbols;
	}

	/**
	 * @param node the expression about to be written
	 * @param parent its syntactic parent, or null at the top of a predicate
	 * @param position where node sits within parent
	 * @param trailing whether nothing follows node before the end of the innermost enclosing bracket
	 */
	public boolean needsParentheses(ZExpression node, ZExpression parent, Position position, boolean trailing) {
		if(parent == null || position == Position.BODY) {
			return false;
		}
		Shape inner = node.accept(SHAPE);
		if(inner == BINDER) {
			return symbols.parenthesizeNestedBinders() || !trailing;
		}
		Shape outer = parent.accept(SHAPE);
		switch(position) {
			case LEFT:
				return inner.precedence < outer.precedence || (inner.precedence == outer.precedence
						&& outer.associativity != ZOperator.Associativity.LEFT);
			case RIGHT:
				return inner.precedence < outer.precedence || (inner.precedence == outer.precedence
						&& outer.associativity != ZOperator.Associativity.RIGHT);
			case OPERAND:
				if(inner.application && outer.operator != ZOperator.NOT && symbols.parenthesizeApplicationOperand()) {
					return true;
				}
				return inner.precedence < outer.precedence;
			case BASE:
				// x^{2}^{3} is a double superscript to TeX
				return inner.precedence < ZOperator.POSTFIX_PRECEDENCE || (inner.script && outer.script);
			case ARGUMENT:
				return inner.precedence <= ZOperator.POSTFIX_PRECEDENCE;
			default:
				return false;
		}
	}
}

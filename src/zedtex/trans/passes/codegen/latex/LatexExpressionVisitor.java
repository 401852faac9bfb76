package zedtex.trans.passes.codegen.latex;

import zedtex.Unreachable;
import zedtex.formatters.FormattingTools;
import zedtex.formatters.IndentingWriter;
import zedtex.model.z.*;
import zedtex.trans.passes.codegen.latex.Parenthesizer.Position;

import java.io.IOException;
import java.io.StringWriter;
import java.util.List;

/**
 * Writes an expression as LaTeX math.
 *
 * A visitor is created for each node with the node's syntactic parent and its position within it, so that
 * parentheses can be decided without the tree knowing its parents. The top of a predicate has no parent.
 */
public class LatexExpressionVisitor extends ZExpressionVisitor<Void, IOException> {

	private interface Body {
		/**
		 * @param trailing whether the last operand written is followed by nothing up to a closing bracket
		 */
		void write(boolean trailing) throws IOException;
	}

	private final IndentingWriter out;
	private final DialectSymbols symbols;
	private final Parenthesizer parenthesizer;
	private final DialectSymbols.Context context;
	private final boolean lineBreaks;
	private final ZExpression parent;
	private final Position position;
	private final boolean trailing;

	/**
	 * @param lineBreaks whether the breaks marked in the source are written; they are only allowed inside
	 *                   environments that accept \\
	 */
	public LatexExpressionVisitor(IndentingWriter out, DialectSymbols symbols, DialectSymbols.Context context,
	                              boolean lineBreaks) {
		this(out, symbols, new Parenthesizer(symbols), context, lineBreaks, null, Position.BODY, true);
	}

	private LatexExpressionVisitor(IndentingWriter out, DialectSymbols symbols, Parenthesizer parenthesizer,
	                               DialectSymbols.Context context, boolean lineBreaks, ZExpression parent,
	                               Position position, boolean trailing) {
		this.out = out;
		this.symbols = symbols;
		this.parenthesizer = parenthesizer;
		this.context = context;
		this.lineBreaks = lineBreaks;
		this.parent = parent;
		this.position = position;
		this.trailing = trailing;
	}

	/**
	 * Renders an expression on a single line.
	 */
	public static String render(ZExpression expression, DialectSymbols symbols, DialectSymbols.Context context) {
		StringWriter sw = new StringWriter();
		try {
			expression.accept(new LatexExpressionVisitor(new IndentingWriter(sw), symbols, context, false));
		} catch (IOException e) {
			throw new Unreachable(e);
		}
		return sw.toString();
	}

	private Void enclose(ZExpression node, Body body) throws IOException {
		boolean parens = parenthesizer.needsParentheses(node, parent, position, trailing);
		if(parens) {
			out.write("(");
		}
		body.write(parens || trailing);
		if(parens) {
			out.write(")");
		}
		return null;
	}

	private void lineBreak(boolean marked) throws IOException {
		if(lineBreaks && marked) {
			out.write(" \\\\");
			out.newLine();
			out.write(symbols.continuationIndent());
		}
	}

	private void child(ZExpression child, ZExpression self, Position childPosition, boolean childTrailing)
			throws IOException {
		child.accept(new LatexExpressionVisitor(out, symbols, parenthesizer, context, lineBreaks, self,
				childPosition, childTrailing));
	}

	private void enclosedList(List<ZExpression> elements, ZExpression self) throws IOException {
		FormattingTools.writeCommaSeparated(out, elements, e -> child(e, self, Position.ENCLOSED, true));
	}

	private void bindings(List<ZBindingGroup> groups, ZExpression self) throws IOException {
		FormattingTools.writeSeparated(out, "; ", groups, group -> {
			FormattingTools.writeCommaSeparated(out, group.getNames(),
					name -> out.write(symbols.identifier(name.getName())));
			if(group.getDomain() != null) {
				out.write(" ");
				out.write(symbols.bindingColon());
				out.write(" ");
				child(group.getDomain(), self, Position.ENCLOSED, true);
			}
		});
	}

	@Override
	public Void visit(ZIdentifier zIdentifier) throws IOException {
		out.write(symbols.identifier(zIdentifier.getName()));
		return null;
	}

	@Override
	public Void visit(ZNumber zNumber) throws IOException {
		out.write(zNumber.getValue());
		return null;
	}

	@Override
	public Void visit(ZUnary zUnary) throws IOException {
		ZOperator operator = zUnary.getOperator();
		String symbol = symbols.operator(operator, context);
		return enclose(zUnary, t -> {
			if(zUnary.isPostfix()) {
				child(zUnary.getOperand(), zUnary, Position.BASE, false);
				out.write(symbol);
			} else {
				out.write(symbol);
				out.write(symbols.prefixSeparator(operator));
				child(zUnary.getOperand(), zUnary, Position.OPERAND, t);
			}
		});
	}

	@Override
	public Void visit(ZBinOp zBinOp) throws IOException {
		return enclose(zBinOp, t -> {
			child(zBinOp.getLHS(), zBinOp, Position.LEFT, false);
			out.write(" ");
			out.write(symbols.operator(zBinOp.getOperator(), context));
			lineBreak(zBinOp.isLineBreakAfter());
			out.write(" ");
			child(zBinOp.getRHS(), zBinOp, Position.RIGHT, t);
		});
	}

	@Override
	public Void visit(ZRelationChain zRelationChain) throws IOException {
		return enclose(zRelationChain, t -> {
			List<ZExpression> operands = zRelationChain.getOperands();
			List<ZOperator> operators = zRelationChain.getOperators();
			child(operands.get(0), zRelationChain, Position.LEFT, false);
			for(int i = 0; i < operators.size(); i++) {
				out.write(" ");
				out.write(symbols.operator(operators.get(i), context));
				lineBreak(zRelationChain.isLineBreakAfter(i));
				out.write(" ");
				boolean last = i == operators.size() - 1;
				child(operands.get(i + 1), zRelationChain, last ? Position.RIGHT : Position.LEFT, last && t);
			}
		});
	}

	@Override
	public Void visit(ZQuantifier zQuantifier) throws IOException {
		return enclose(zQuantifier, t -> {
			out.write(symbols.quantifier(zQuantifier.getKind()));
			out.write(" ");
			bindings(zQuantifier.getBindings(), zQuantifier);
			ZExpression predicate = zQuantifier.getPredicate();
			ZExpression result = zQuantifier.getResult();
			boolean logical = zQuantifier.getKind() != ZQuantifier.Kind.MU
					&& zQuantifier.getKind() != ZQuantifier.Kind.LAMBDA;
			if(logical && result == null) {
				// forall x : T @ p
				out.write(" ");
				out.write(symbols.bullet());
				out.write(" ");
				child(predicate, zQuantifier, Position.BODY, t);
				return;
			}
			if(predicate != null) {
				out.write(" ");
				out.write(symbols.suchThat());
				out.write(" ");
				child(predicate, zQuantifier, Position.BODY, result == null && t);
			}
			if(result != null) {
				out.write(" ");
				out.write(symbols.bullet());
				out.write(" ");
				child(result, zQuantifier, Position.BODY, t);
			}
		});
	}

	@Override
	public Void visit(ZSetComprehension zSetComprehension) throws IOException {
		return enclose(zSetComprehension, t -> {
			out.write("\\{ ");
			bindings(zSetComprehension.getBindings(), zSetComprehension);
			if(zSetComprehension.getPredicate() != null) {
				out.write(" ");
				out.write(symbols.suchThat());
				out.write(" ");
				child(zSetComprehension.getPredicate(), zSetComprehension, Position.BODY, true);
			}
			if(zSetComprehension.getResult() != null) {
				out.write(" ");
				out.write(symbols.bullet());
				out.write(" ");
				child(zSetComprehension.getResult(), zSetComprehension, Position.BODY, true);
			}
			out.write(" \\}");
		});
	}

	@Override
	public Void visit(ZSetLiteral zSetLiteral) throws IOException {
		return enclose(zSetLiteral, t -> {
			if(zSetLiteral.getElements().isEmpty()) {
				out.write("\\{\\}");
				return;
			}
			out.write("\\{ ");
			enclosedList(zSetLiteral.getElements(), zSetLiteral);
			out.write(" \\}");
		});
	}

	@Override
	public Void visit(ZSequenceLiteral zSequenceLiteral) throws IOException {
		return enclose(zSequenceLiteral, t -> {
			if(zSequenceLiteral.getElements().isEmpty()) {
				out.write("\\langle\\rangle");
				return;
			}
			out.write("\\langle ");
			enclosedList(zSequenceLiteral.getElements(), zSequenceLiteral);
			out.write(" \\rangle");
		});
	}

	@Override
	public Void visit(ZBagLiteral zBagLiteral) throws IOException {
		return enclose(zBagLiteral, t -> {
			if(zBagLiteral.getElements().isEmpty()) {
				out.write("\\lbag\\rbag");
				return;
			}
			out.write("\\lbag ");
			enclosedList(zBagLiteral.getElements(), zBagLiteral);
			out.write(" \\rbag");
		});
	}

	@Override
	public Void visit(ZTuple zTuple) throws IOException {
		return enclose(zTuple, t -> {
			out.write("(");
			enclosedList(zTuple.getElements(), zTuple);
			out.write(")");
		});
	}

	@Override
	public Void visit(ZProjection zProjection) throws IOException {
		return enclose(zProjection, t -> {
			child(zProjection.getTarget(), zProjection, Position.BASE, false);
			out.write(".");
			out.write(symbols.identifier(zProjection.getField()));
		});
	}

	@Override
	public Void visit(ZRange zRange) throws IOException {
		return enclose(zRange, t -> {
			child(zRange.getFrom(), zRange, Position.LEFT, false);
			out.write(" ");
			out.write(symbols.operator(ZOperator.UPTO, context));
			out.write(" ");
			child(zRange.getTo(), zRange, Position.RIGHT, t);
		});
	}

	@Override
	public Void visit(ZConditional zConditional) throws IOException {
		return enclose(zConditional, t -> {
			out.write(symbols.conditionalIf());
			out.write(" ");
			child(zConditional.getCondition(), zConditional, Position.ENCLOSED, false);
			lineBreak(zConditional.isLineBreakBeforeThen());
			out.write(" ");
			out.write(symbols.conditionalThen());
			out.write(" ");
			child(zConditional.getThen(), zConditional, Position.ENCLOSED, false);
			lineBreak(zConditional.isLineBreakBeforeElse());
			out.write(" ");
			out.write(symbols.conditionalElse());
			out.write(" ");
			child(zConditional.getElse(), zConditional, Position.ENCLOSED, t);
		});
	}

	@Override
	public Void visit(ZFunctionCall zFunctionCall) throws IOException {
		return enclose(zFunctionCall, t -> {
			child(zFunctionCall.getTarget(), zFunctionCall, Position.BASE, false);
			out.write("(");
			enclosedList(zFunctionCall.getArguments(), zFunctionCall);
			out.write(")");
		});
	}

	@Override
	public Void visit(ZApplication zApplication) throws IOException {
		return enclose(zApplication, t -> {
			child(zApplication.getFunction(), zApplication, Position.BASE, false);
			out.write("~");
			child(zApplication.getArgument(), zApplication, Position.ARGUMENT, t);
		});
	}

	@Override
	public Void visit(ZGenericInstantiation zGenericInstantiation) throws IOException {
		return enclose(zGenericInstantiation, t -> {
			child(zGenericInstantiation.getBase(), zGenericInstantiation, Position.BASE, false);
			out.write("[");
			enclosedList(zGenericInstantiation.getParameters(), zGenericInstantiation);
			out.write("]");
		});
	}

	@Override
	public Void visit(ZRelationalImage zRelationalImage) throws IOException {
		return enclose(zRelationalImage, t -> {
			child(zRelationalImage.getRelation(), zRelationalImage, Position.BASE, false);
			out.write(" \\limg ");
			child(zRelationalImage.getSet(), zRelationalImage, Position.ENCLOSED, true);
			out.write(" \\rimg");
		});
	}

	@Override
	public Void visit(ZSuperscript zSuperscript) throws IOException {
		return enclose(zSuperscript, t -> {
			child(zSuperscript.getBase(), zSuperscript, Position.BASE, false);
			out.write("^{");
			child(zSuperscript.getExponent(), zSuperscript, Position.ENCLOSED, true);
			out.write("}");
		});
	}

	@Override
	public Void visit(ZSubscript zSubscript) throws IOException {
		return enclose(zSubscript, t -> {
			child(zSubscript.getBase(), zSubscript, Position.BASE, false);
			out.write("_{");
			child(zSubscript.getIndex(), zSubscript, Position.ENCLOSED, true);
			out.write("}");
		});
	}

	@Override
	public Void visit(ZParenthesized zParenthesized) throws IOException {
		return enclose(zParenthesized, t -> {
			out.write("(");
			child(zParenthesized.getInner(), zParenthesized, Position.BODY, true);
			out.write(")");
		});
	}
}

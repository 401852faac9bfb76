package zedtex.formatters;

import zedtex.model.z.*;

import java.io.IOException;
import java.util.List;

/**
 * Writes an expression back in whiteboard notation, fully parenthesised, using canonical operator
 * spellings. Used for toString() and for node descriptions in error messages.
 */
public class ZExpressionFormattingVisitor extends ZExpressionVisitor<Void, IOException> {

	private final IndentingWriter out;

	public ZExpressionFormattingVisitor(IndentingWriter out) {
		this.out = out;
	}

	private void writeList(List<ZExpression> expressions) throws IOException {
		FormattingTools.writeCommaSeparated(out, expressions, e -> e.accept(this));
	}

	private void writeBindings(List<ZBindingGroup> bindings) throws IOException {
		FormattingTools.writeSeparated(out, "; ", bindings, group -> {
			FormattingTools.writeCommaSeparated(out, group.getNames(), name -> name.accept(this));
			if(group.getDomain() != null) {
				out.write(" : ");
				group.getDomain().accept(this);
			}
		});
	}

	@Override
	public Void visit(ZIdentifier zIdentifier) throws IOException {
		out.write(zIdentifier.getName());
		return null;
	}

	@Override
	public Void visit(ZNumber zNumber) throws IOException {
		out.write(zNumber.getValue());
		return null;
	}

	@Override
	public Void visit(ZUnary zUnary) throws IOException {
		out.write("(");
		if(zUnary.isPostfix()) {
			zUnary.getOperand().accept(this);
			out.write(zUnary.getOperator().getCanonicalSpelling());
		} else {
			out.write(zUnary.getOperator().getCanonicalSpelling());
			out.write(" ");
			zUnary.getOperand().accept(this);
		}
		out.write(")");
		return null;
	}

	@Override
	public Void visit(ZBinOp zBinOp) throws IOException {
		out.write("(");
		zBinOp.getLHS().accept(this);
		out.write(" ");
		out.write(zBinOp.getOperator().getCanonicalSpelling());
		out.write(" ");
		zBinOp.getRHS().accept(this);
		out.write(")");
		return null;
	}

	@Override
	public Void visit(ZRelationChain zRelationChain) throws IOException {
		out.write("(");
		zRelationChain.getOperands().get(0).accept(this);
		for(int i = 0; i < zRelationChain.getOperators().size(); i++) {
			out.write(" ");
			out.write(zRelationChain.getOperators().get(i).getCanonicalSpelling());
			out.write(" ");
			zRelationChain.getOperands().get(i + 1).accept(this);
		}
		out.write(")");
		return null;
	}

	@Override
	public Void visit(ZQuantifier zQuantifier) throws IOException {
		out.write("(");
		out.write(zQuantifier.getKind().name().toLowerCase());
		out.write(" ");
		writeBindings(zQuantifier.getBindings());
		if(zQuantifier.getPredicate() != null) {
			out.write(" | ");
			zQuantifier.getPredicate().accept(this);
		}
		if(zQuantifier.getResult() != null) {
			out.write(" . ");
			zQuantifier.getResult().accept(this);
		}
		out.write(")");
		return null;
	}

	@Override
	public Void visit(ZSetComprehension zSetComprehension) throws IOException {
		out.write("{ ");
		writeBindings(zSetComprehension.getBindings());
		if(zSetComprehension.getPredicate() != null) {
			out.write(" | ");
			zSetComprehension.getPredicate().accept(this);
		}
		if(zSetComprehension.getResult() != null) {
			out.write(" . ");
			zSetComprehension.getResult().accept(this);
		}
		out.write(" }");
		return null;
	}

	@Override
	public Void visit(ZSetLiteral zSetLiteral) throws IOException {
		out.write("{");
		writeList(zSetLiteral.getElements());
		out.write("}");
		return null;
	}

	@Override
	public Void visit(ZSequenceLiteral zSequenceLiteral) throws IOException {
		out.write("<");
		writeList(zSequenceLiteral.getElements());
		out.write(">");
		return null;
	}

	@Override
	public Void visit(ZBagLiteral zBagLiteral) throws IOException {
		out.write("[[");
		writeList(zBagLiteral.getElements());
		out.write("]]");
		return null;
	}

	@Override
	public Void visit(ZTuple zTuple) throws IOException {
		out.write("(");
		writeList(zTuple.getElements());
		out.write(")");
		return null;
	}

	@Override
	public Void visit(ZProjection zProjection) throws IOException {
		zProjection.getTarget().accept(this);
		out.write(".");
		out.write(zProjection.getField());
		return null;
	}

	@Override
	public Void visit(ZRange zRange) throws IOException {
		out.write("(");
		zRange.getFrom().accept(this);
		out.write(" .. ");
		zRange.getTo().accept(this);
		out.write(")");
		return null;
	}

	@Override
	public Void visit(ZConditional zConditional) throws IOException {
		out.write("(if ");
		zConditional.getCondition().accept(this);
		out.write(" then ");
		zConditional.getThen().accept(this);
		out.write(" else ");
		zConditional.getElse().accept(this);
		out.write(")");
		return null;
	}

	@Override
	public Void visit(ZFunctionCall zFunctionCall) throws IOException {
		zFunctionCall.getTarget().accept(this);
		out.write("(");
		writeList(zFunctionCall.getArguments());
		out.write(")");
		return null;
	}

	@Override
	public Void visit(ZApplication zApplication) throws IOException {
		out.write("(");
		zApplication.getFunction().accept(this);
		out.write(" ");
		zApplication.getArgument().accept(this);
		out.write(")");
		return null;
	}

	@Override
	public Void visit(ZGenericInstantiation zGenericInstantiation) throws IOException {
		zGenericInstantiation.getBase().accept(this);
		out.write("[");
		writeList(zGenericInstantiation.getParameters());
		out.write("]");
		return null;
	}

	@Override
	public Void visit(ZRelationalImage zRelationalImage) throws IOException {
		zRelationalImage.getRelation().accept(this);
		out.write("(| ");
		zRelationalImage.getSet().accept(this);
		out.write(" |)");
		return null;
	}

	@Override
	public Void visit(ZSuperscript zSuperscript) throws IOException {
		zSuperscript.getBase().accept(this);
		out.write("^");
		zSuperscript.getExponent().accept(this);
		return null;
	}

	@Override
	public Void visit(ZSubscript zSubscript) throws IOException {
		zSubscript.getBase().accept(this);
		out.write("_");
		zSubscript.getIndex().accept(this);
		return null;
	}

	@Override
	public Void visit(ZParenthesized zParenthesized) throws IOException {
		zParenthesized.getInner().accept(this);
		return null;
	}
}

package zedtex.model.z;

public abstract class ZExpressionVisitor<T, E extends Throwable> {
	public abstract T visit(ZIdentifier zIdentifier) throws E;
	public abstract T visit(ZNumber zNumber) throws E;
	public abstract T visit(ZUnary zUnary) throws E;
	public abstract T visit(ZBinOp zBinOp) throws E;
	public abstract T visit(ZRelationChain zRelationChain) throws E;
	public abstract T visit(ZQuantifier zQuantifier) throws E;
	public abstract T visit(ZSetComprehension zSetComprehension) throws E;
	public abstract T visit(ZSetLiteral zSetLiteral) throws E;
	public abstract T visit(ZSequenceLiteral zSequenceLiteral) throws E;
	public abstract T visit(ZBagLiteral zBagLiteral) throws E;
	public abstract T visit(ZTuple zTuple) throws E;
	public abstract T visit(ZProjection zProjection) throws E;
	public abstract T visit(ZRange zRange) throws E;
	public abstract T visit(ZConditional zConditional) throws E;
	public abstract T visit(ZFunctionCall zFunctionCall) throws E;
	public abstract T visit(ZApplication zApplication) throws E;
	public abstract T visit(ZGenericInstantiation zGenericInstantiation) throws E;
	public abstract T visit(ZRelationalImage zRelationalImage) throws E;
	public abstract T visit(ZSuperscript zSuperscript) throws E;
	public abstract T visit(ZSubscript zSubscript) throws E;
	public abstract T visit(ZParenthesized zParenthesized) throws E;
}

package zedtex.model.z;

public abstract class ZDocumentItemVisitor<T, E extends Throwable> {
	public abstract T visit(ZSection zSection) throws E;
	public abstract T visit(ZSolution zSolution) throws E;
	public abstract T visit(ZPart zPart) throws E;
	public abstract T visit(ZTruthTable zTruthTable) throws E;
	public abstract T visit(ZEquivChain zEquivChain) throws E;
	public abstract T visit(ZProofTree zProofTree) throws E;
	public abstract T visit(ZGivenType zGivenType) throws E;
	public abstract T visit(ZFreeType zFreeType) throws E;
	public abstract T visit(ZAbbreviation zAbbreviation) throws E;
	public abstract T visit(ZBoxedBlock zBoxedBlock) throws E;
	public abstract T visit(ZZedBlock zZedBlock) throws E;
	public abstract T visit(ZTextBlock zTextBlock) throws E;
	public abstract T visit(ZPureText zPureText) throws E;
	public abstract T visit(ZLatexBlock zLatexBlock) throws E;
	public abstract T visit(ZPageBreak zPageBreak) throws E;
	public abstract T visit(ZInferenceRule zInferenceRule) throws E;
	public abstract T visit(ZDisplayExpression zDisplayExpression) throws E;
}

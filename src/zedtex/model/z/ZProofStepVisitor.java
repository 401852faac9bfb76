package zedtex.model.z;

public abstract class ZProofStepVisitor<T, E extends Throwable> {
	public abstract T visit(ZProofNode zProofNode) throws E;
	public abstract T visit(ZProofCase zProofCase) throws E;
}

package zedtex.trans.passes.codegen.latex;

import zedtex.ZedTexException;
import zedtex.model.z.ZNode;

/**
 * A node that has no rendering in the requested dialect.
 */
public class GenerationException extends ZedTexException {
	private final String nodeDescription;

	public GenerationException(String msg) {
		super("Generation error", msg);
		this.nodeDescription = null;
	}

	public GenerationException(String msg, ZNode node) {
		super("Generation error", msg + ": " + node, node.getLocation(), null);
		this.nodeDescription = node.toString();
	}

	/**
	 * @return the offending node in whiteboard notation, or null if the error is not about a single node
	 */
	public String getNodeDescription() {
		return nodeDescription;
	}
}

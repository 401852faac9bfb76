package zedtex.trans;

import java.util.Collections;
import java.util.List;

/**
 * The markup generated for a document together with the advisory warnings raised while generating it.
 */
public class GenerationResult {
	private final String output;
	private final List<String> warnings;

	public GenerationResult(String output, List<String> warnings) {
		this.output = output;
		this.warnings = Collections.unmodifiableList(warnings);
	}

	public String getOutput() {
		return output;
	}

	public List<String> getWarnings() {
		return warnings;
	}

	public boolean hasWarnings() {
		return !warnings.isEmpty();
	}
}

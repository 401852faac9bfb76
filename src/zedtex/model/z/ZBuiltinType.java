package zedtex.model.z;

import java.util.Arrays;
import java.util.Collections;
import java.util.List;

/**
 * Identifiers with a dedicated symbol in the Z toolkit.
 */
public enum ZBuiltinType {
	NAT("\\nat", "\\mathbb{N}", "N", "ℕ"),
	NAT1("\\nat_1", "\\mathbb{N}_1", "N1", "ℕ₁"),
	INT("\\num", "\\mathbb{Z}", "Z", "ℤ"),
	REAL("\\real", "\\mathbb{R}", "ℝ"),
	EMPTY_SET("\\emptyset", "\\emptyset", "emptyset", "∅");

	private final String fuzzSymbol;
	private final String zedCmSymbol;
	private final List<String> spellings;

	ZBuiltinType(String fuzzSymbol, String zedCmSymbol, String... spellings) {
		this.fuzzSymbol = fuzzSymbol;
		this.zedCmSymbol = zedCmSymbol;
		this.spellings = Collections.unmodifiableList(Arrays.asList(spellings));
	}

	public String getFuzzSymbol() {
		return fuzzSymbol;
	}

	public String getZedCmSymbol() {
		return zedCmSymbol;
	}

	public List<String> getSpellings() {
		return spellings;
	}
}

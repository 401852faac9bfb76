package zedtex.model.z;

import java.util.Arrays;
import java.util.Collections;
import java.util.List;

/**
 * Reserved words and markers that structure expressions and documents. Block keywords that end in a colon
 * include the colon in their spelling.
 */
public enum ZKeyword {
	FORALL("forall", "∀"),
	EXISTS("exists", "∃"),
	EXISTS1("exists1", "∃₁", "∃!"),
	MU("mu", "μ"),
	LAMBDA("lambda", "λ"),
	IF("if"),
	THEN("then"),
	ELSE("else"),
	GIVEN("given"),
	AXDEF("axdef"),
	SCHEMA("schema"),
	GENDEF("gendef"),
	ZED("zed"),
	WHERE("where"),
	END("end"),
	CASE("case"),

	SECTION("==="),
	SOLUTION("**"),
	PART("(a)"),
	TEXT("TEXT:"),
	PURETEXT("PURETEXT:"),
	LATEX("LATEX:"),
	PAGEBREAK("PAGEBREAK"),
	TITLE("TITLE:"),
	AUTHOR("AUTHOR:"),
	DATE("DATE:"),
	PROOF("PROOF:"),
	EQUIV("EQUIV:"),
	ARGUE("ARGUE:"),
	INFRULE("INFRULE:"),
	TRUTH_TABLE("TRUTH TABLE:");

	private final List<String> spellings;

	ZKeyword(String... spellings) {
		this.spellings = Collections.unmodifiableList(Arrays.asList(spellings));
	}

	public String getCanonicalSpelling() {
		return spellings.get(0);
	}

	public List<String> getSpellings() {
		return spellings;
	}

	public boolean isQuantifier() {
		return this == FORALL || this == EXISTS || this == EXISTS1 || this == MU || this == LAMBDA;
	}

	public ZQuantifier.Kind toQuantifierKind() {
		switch(this) {
			case FORALL:
				return ZQuantifier.Kind.FORALL;
			case EXISTS:
				return ZQuantifier.Kind.EXISTS;
			case EXISTS1:
				return ZQuantifier.Kind.EXISTS1;
			case MU:
				return ZQuantifier.Kind.MU;
			case LAMBDA:
				return ZQuantifier.Kind.LAMBDA;
			default:
				throw new IllegalStateException("not a quantifier: " + this);
		}
	}

	/**
	 * @return true for keywords that introduce a block whose lines follow until a blank line
	 */
	public boolean isLineBlock() {
		return this == PROOF || this == EQUIV || this == ARGUE || this == INFRULE || this == TRUTH_TABLE;
	}

	/**
	 * @return true for keywords whose payload is the rest of their line, captured verbatim
	 */
	public boolean capturesRestOfLine() {
		return this == TEXT || this == PURETEXT || this == LATEX || this == TITLE || this == AUTHOR || this == DATE;
	}
}

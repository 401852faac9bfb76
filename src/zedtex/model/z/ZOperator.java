package zedtex.model.z;

import java.util.Arrays;
import java.util.Collections;
import java.util.List;

/**
 * The operator table shared by the lexer, the parser and the LaTeX generator.
 *
 * Each entry lists its surface spellings (the first one is canonical), its fixity, its binding power and
 * associativity, and its LaTeX symbol in the fuzz and zed-cm macro sets. Higher precedence binds tighter.
 */
public enum ZOperator {
	IFF(Fixity.INFIX, 1, Associativity.LEFT, "\\iff", "\\Leftrightarrow", "<=>", "⇔"),
	IMPLIES(Fixity.INFIX, 2, Associativity.RIGHT, "\\implies", "\\Rightarrow", "=>", "⇒"),
	OR(Fixity.INFIX, 3, Associativity.LEFT, "\\lor", "\\lor", "or", "lor", "∨"),
	AND(Fixity.INFIX, 4, Associativity.LEFT, "\\land", "\\land", "and", "land", "∧"),
	NOT(Fixity.PREFIX, 5, Associativity.NONE, "\\lnot", "\\lnot", "not", "lnot", "¬"),

	EQUALS(Fixity.INFIX, 6, Associativity.NONE, "=", "=", "="),
	NOT_EQUALS(Fixity.INFIX, 6, Associativity.NONE, "\\neq", "\\neq", "!=", "/=", "≠"),
	LESS(Fixity.INFIX, 6, Associativity.NONE, "<", "<", "<"),
	GREATER(Fixity.INFIX, 6, Associativity.NONE, ">", ">", ">"),
	LESS_EQ(Fixity.INFIX, 6, Associativity.NONE, "\\leq", "\\leq", "<=", "≤"),
	GREATER_EQ(Fixity.INFIX, 6, Associativity.NONE, "\\geq", "\\geq", ">=", "≥"),
	IN(Fixity.INFIX, 6, Associativity.NONE, "\\in", "\\in", "in", "elem", "∈"),
	NOT_IN(Fixity.INFIX, 6, Associativity.NONE, "\\notin", "\\notin", "notin", "∉"),
	SUBSET_EQ(Fixity.INFIX, 6, Associativity.NONE, "\\subseteq", "\\subseteq", "subseteq", "subset", "⊆"),
	PROPER_SUBSET(Fixity.INFIX, 6, Associativity.NONE, "\\subset", "\\subset", "psubset", "⊂"),

	REL(Fixity.INFIX, 7, Associativity.RIGHT, "\\rel", "\\rel", "<->", "↔"),
	FUN(Fixity.INFIX, 7, Associativity.RIGHT, "\\fun", "\\fun", "->", "→"),
	PFUN(Fixity.INFIX, 7, Associativity.RIGHT, "\\pfun", "\\pfun", "+->", "⇸"),
	INJ(Fixity.INFIX, 7, Associativity.RIGHT, "\\inj", "\\inj", ">->", "↣"),
	PINJ(Fixity.INFIX, 7, Associativity.RIGHT, "\\pinj", "\\pinj", ">+>", "⤔"),
	SURJ(Fixity.INFIX, 7, Associativity.RIGHT, "\\surj", "\\surj", "-->>", "↠"),
	PSURJ(Fixity.INFIX, 7, Associativity.RIGHT, "\\psurj", "\\psurj", "+->>", "⤀"),
	BIJ(Fixity.INFIX, 7, Associativity.RIGHT, "\\bij", "\\bij", ">->>", "⤖"),
	FFUN(Fixity.INFIX, 7, Associativity.RIGHT, "\\ffun", "\\ffun", "77->", "⇻"),
	FINJ(Fixity.INFIX, 7, Associativity.RIGHT, "\\finj", "\\finj", ">7->"),

	MAPLET(Fixity.INFIX, 8, Associativity.LEFT, "\\mapsto", "\\mapsto", "|->", "↦"),

	DRES(Fixity.INFIX, 9, Associativity.LEFT, "\\dres", "\\dres", "<|", "◁"),
	RRES(Fixity.INFIX, 9, Associativity.LEFT, "\\rres", "\\rres", "|>", "▷"),
	NDRES(Fixity.INFIX, 9, Associativity.LEFT, "\\ndres", "\\ndres", "<<|", "⩤"),
	NRRES(Fixity.INFIX, 9, Associativity.LEFT, "\\nrres", "\\nrres", "|>>", "⩥"),
	CIRC(Fixity.INFIX, 9, Associativity.LEFT, "\\circ", "\\circ", "o9", "⨾"),
	COMP(Fixity.INFIX, 9, Associativity.LEFT, "\\comp", "\\comp", "comp"),
	OVERRIDE(Fixity.INFIX, 9, Associativity.LEFT, "\\oplus", "\\oplus", "++", "⊕"),
	FILTER(Fixity.INFIX, 9, Associativity.LEFT, "\\filter", "\\filter", "filter", "↾"),

	UPTO(Fixity.INFIX, 10, Associativity.NONE, "\\upto", "\\upto", ".."),

	PLUS(Fixity.INFIX, 11, Associativity.LEFT, "+", "+", "+"),
	MINUS(Fixity.INFIX, 11, Associativity.LEFT, "-", "-", "-"),
	UNION(Fixity.INFIX, 11, Associativity.LEFT, "\\cup", "\\cup", "union", "∪"),
	SET_MINUS(Fixity.INFIX, 11, Associativity.LEFT, "\\setminus", "\\setminus", "\\", "∖"),
	BAG_UNION(Fixity.INFIX, 11, Associativity.LEFT, "\\uplus", "\\uplus", "bag_union", "⊎"),
	CAT(Fixity.INFIX, 11, Associativity.LEFT, "\\cat", "\\cat", "^", "⁀"),

	TIMES(Fixity.INFIX, 12, Associativity.LEFT, "*", "*", "*"),
	DIV(Fixity.INFIX, 12, Associativity.LEFT, "\\div", "\\div", "div"),
	MOD(Fixity.INFIX, 12, Associativity.LEFT, "\\mod", "\\mod", "mod"),
	INTERSECT(Fixity.INFIX, 12, Associativity.LEFT, "\\cap", "\\cap", "intersect", "∩"),
	CROSS(Fixity.INFIX, 12, Associativity.LEFT, "\\cross", "\\cross", "cross", "×"),

	NEGATE(Fixity.PREFIX, 13, Associativity.NONE, "-", "-", "-"),
	CARD(Fixity.PREFIX, 13, Associativity.NONE, "\\#", "\\#", "#"),
	DOM(Fixity.PREFIX, 13, Associativity.NONE, "\\dom", "\\dom", "dom"),
	RAN(Fixity.PREFIX, 13, Associativity.NONE, "\\ran", "\\ran", "ran"),
	POWER(Fixity.PREFIX, 13, Associativity.NONE, "\\power", "\\power", "P", "℘", "ℙ"),
	POWER1(Fixity.PREFIX, 13, Associativity.NONE, "\\power_1", "\\power_1", "P1"),
	FINSET(Fixity.PREFIX, 13, Associativity.NONE, "\\finset", "\\finset", "F", "𝔽"),
	FINSET1(Fixity.PREFIX, 13, Associativity.NONE, "\\finset_1", "\\finset_1", "F1"),
	SEQ(Fixity.PREFIX, 13, Associativity.NONE, "\\seq", "\\seq", "seq"),
	SEQ1(Fixity.PREFIX, 13, Associativity.NONE, "\\seq_1", "\\seq_1", "seq1"),
	ISEQ(Fixity.PREFIX, 13, Associativity.NONE, "\\iseq", "\\iseq", "iseq"),
	BAG(Fixity.PREFIX, 13, Associativity.NONE, "\\bag", "\\bag", "bag"),
	ID(Fixity.PREFIX, 13, Associativity.NONE, "\\id", "\\id", "id"),
	INV(Fixity.PREFIX, 13, Associativity.NONE, "\\inv", "\\inv", "inv"),
	HEAD(Fixity.PREFIX, 13, Associativity.NONE, "head", "head", "head"),
	TAIL(Fixity.PREFIX, 13, Associativity.NONE, "tail", "tail", "tail"),
	LAST(Fixity.PREFIX, 13, Associativity.NONE, "last", "last", "last"),
	FRONT(Fixity.PREFIX, 13, Associativity.NONE, "front", "front", "front"),
	REV(Fixity.PREFIX, 13, Associativity.NONE, "rev", "rev", "rev"),
	BIGCUP(Fixity.PREFIX, 13, Associativity.NONE, "\\bigcup", "\\bigcup", "bigcup", "⋃"),
	BIGCAP(Fixity.PREFIX, 13, Associativity.NONE, "\\bigcap", "\\bigcap", "bigcap", "⋂"),

	INVERSE(Fixity.POSTFIX, 14, Associativity.NONE, "\\inv", "^{-1}", "~", "⁻¹"),
	TRANSITIVE_CLOSURE(Fixity.POSTFIX, 14, Associativity.NONE, "\\plus", "^{+}", "+"),
	REFLEXIVE_CLOSURE(Fixity.POSTFIX, 14, Associativity.NONE, "\\star", "^{*}", "*");

	public enum Fixity {
		PREFIX,
		INFIX,
		POSTFIX,
	}

	public enum Associativity {
		LEFT,
		RIGHT,
		NONE,
	}

	/** Binding power of prefix operators such as dom and #. */
	public static final int PREFIX_PRECEDENCE = 13;
	/** Binding power of postfix forms: application, projection, instantiation, scripts and closures. */
	public static final int POSTFIX_PRECEDENCE = 14;
	/** Binding power of atoms, which never need parentheses. */
	public static final int ATOM_PRECEDENCE = 15;
	/** Binding power of conditionals and binders, which extend as far right as possible. */
	public static final int BINDER_PRECEDENCE = 0;

	private final Fixity fixity;
	private final int precedence;
	private final Associativity associativity;
	private final String fuzzSymbol;
	private final String zedCmSymbol;
	private final List<String> spellings;

	ZOperator(Fixity fixity, int precedence, Associativity associativity, String fuzzSymbol, String zedCmSymbol,
	          String... spellings) {
		this.fixity = fixity;
		this.precedence = precedence;
		this.associativity = associativity;
		this.fuzzSymbol = fuzzSymbol;
		this.zedCmSymbol = zedCmSymbol;
		this.spellings = Collections.unmodifiableList(Arrays.asList(spellings));
	}

	public Fixity getFixity() {
		return fixity;
	}

	public int getPrecedence() {
		return precedence;
	}

	public Associativity getAssociativity() {
		return associativity;
	}

	public String getFuzzSymbol() {
		return fuzzSymbol;
	}

	public String getZedCmSymbol() {
		return zedCmSymbol;
	}

	public String getCanonicalSpelling() {
		return spellings.get(0);
	}

	public List<String> getSpellings() {
		return spellings;
	}

	public boolean isComparison() {
		return fixity == Fixity.INFIX && precedence == 6;
	}

	public boolean isLogical() {
		return this == IFF || this == IMPLIES || this == OR || this == AND || this == NOT;
	}

	/**
	 * Prefix operators that build a set of types from a type, rendered as generic prefixes (\seq~X).
	 */
	public boolean isGenericPrefix() {
		switch(this) {
			case POWER:
			case POWER1:
			case FINSET:
			case FINSET1:
			case SEQ:
			case SEQ1:
			case ISEQ:
			case BAG:
			case ID:
				return true;
			default:
				return false;
		}
	}

	/**
	 * Prefix operators spelt as words, which the generator separates from their operand with a hard space.
	 */
	public boolean isWordPrefix() {
		return fixity == Fixity.PREFIX && this != NEGATE && this != CARD && this != NOT;
	}
}

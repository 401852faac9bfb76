package zedtex.trans.passes.codegen.latex;

import zedtex.model.z.ReservedWords;
import zedtex.model.z.ZBuiltinType;
import zedtex.model.z.ZOperator;
import zedtex.model.z.ZQuantifier;

import java.util.Arrays;
import java.util.Collections;
import java.util.List;

/**
 * Every choice that differs between the fuzz and zed-cm macro sets. No other class of the generator looks at
 * the dialect.
 */
public class DialectSymbols {

	/**
	 * Where a connective appears: inside a predicate, or between the steps of a chain or a proof, where both
	 * dialects use arrows.
	 */
	public enum Context {
		PREDICATE,
		CHAIN,
	}

	private final Dialect dialect;

	public DialectSymbols(Dialect dialect) {
		this.dialect = dialect;
	}

	public Dialect getDialect() {
		return dialect;
	}

	private boolean fuzz() {
		return dialect == Dialect.FUZZ;
	}

	public String operator(ZOperator operator, Context context) {
		if(context == Context.CHAIN) {
			if(operator == ZOperator.IFF) {
				return "\\Leftrightarrow";
			}
			if(operator == ZOperator.IMPLIES) {
				return "\\Rightarrow";
			}
		}
		return fuzz() ? operator.getFuzzSymbol() : operator.getZedCmSymbol();
	}

	/**
	 * What separates a prefix operator from its operand: nothing for symbols, a space for the set-forming
	 * generics, a hard space for the other words in zed-cm.
	 */
	public String prefixSeparator(ZOperator operator) {
		if(operator == ZOperator.NEGATE) {
			return "";
		}
		if(fuzz() || !operator.isWordPrefix() || operator == ZOperator.POWER || operator == ZOperator.POWER1
				|| operator == ZOperator.FINSET || operator == ZOperator.FINSET1) {
			return " ";
		}
		return "~";
	}

	/**
	 * fuzz reads "\# s(i)" as "(\# s)(i)", so an application under a prefix operator needs parentheses there.
	 */
	public boolean parenthesizeApplicationOperand() {
		return fuzz();
	}

	/**
	 * Whether a binder nested inside an expression is always enclosed in parentheses, as fuzz requires.
	 */
	public boolean parenthesizeNestedBinders() {
		return fuzz();
	}

	public String builtin(ZBuiltinType type) {
		return fuzz() ? type.getFuzzSymbol() : type.getZedCmSymbol();
	}

	/**
	 * Renders a name: toolkit names become their symbol (single letters such as F stay names), and
	 * underscores are escaped. zed-cm sets names made of several words in \mathit so that they are spaced
	 * as one word rather than as a product.
	 */
	public String identifier(String name) {
		ZBuiltinType builtin = ReservedWords.builtinType(name);
		if(builtin != null) {
			return builtin(builtin);
		}
		ZOperator prefix = ReservedWords.prefix(name);
		if(prefix != null && prefix.isWordPrefix() && name.length() > 1) {
			return operator(prefix, Context.PREDICATE);
		}
		if(!name.contains("_")) {
			return name;
		}
		String escaped = name.replace("_", "\\_");
		return fuzz() ? escaped : "\\mathit{" + escaped + "}";
	}

	public String quantifier(ZQuantifier.Kind kind) {
		switch(kind) {
			case FORALL:
				return "\\forall";
			case EXISTS:
				return "\\exists";
			case EXISTS1:
				return "\\exists_1";
			case MU:
				return "\\mu";
			case LAMBDA:
				return "\\lambda";
			default:
				throw new GenerationException("no symbol for quantifier " + kind);
		}
	}

	/** Between the names and the type in the declarations of a binder. */
	public String bindingColon() {
		return fuzz() ? ":" : "\\colon";
	}

	/** Before the constraint of a binder or a set comprehension. */
	public String suchThat() {
		return fuzz() ? "|" : "\\mid";
	}

	/** Before the body of a binder or the term of a set comprehension. */
	public String bullet() {
		return fuzz() ? "@" : "\\bullet";
	}

	public String conditionalIf() {
		return fuzz() ? "\\IF" : "\\mathbf{if}";
	}

	public String conditionalThen() {
		return fuzz() ? "\\THEN" : "\\mathbf{then}";
	}

	public String conditionalElse() {
		return fuzz() ? "\\ELSE" : "\\mathbf{else}";
	}

	/** Written at the start of the line that continues a broken predicate. */
	public String continuationIndent() {
		return fuzz() ? "\\t1" : "\\quad";
	}

	public List<String> packages() {
		if(fuzz()) {
			return Collections.singletonList("fuzz");
		}
		return Arrays.asList("zed-cm", "zed-maths");
	}
}

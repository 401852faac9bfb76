package zedtex.trans.passes.codegen.latex;

import zedtex.model.z.ReservedWords;
import zedtex.model.z.ZKeyword;
import zedtex.model.z.ZOperator;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Formats the justification of a proof step or chain step: "=> intro from 1" becomes
 * \mbox{$\Rightarrow$ intro}^{1}. Connectives written as words or symbols are shown as symbols, and the labels
 * of the assumptions discharged by the step become a superscript.
 */
public class JustificationFormatter {

	private static final Pattern DISCHARGE = Pattern.compile("^(.*?)\\s*\\bfrom\\s+(\\d+(?:\\s*,\\s*\\d+)*)\\s*$");
	private static final Pattern PIECE = Pattern.compile("\\s+|\\S+");

	private final DialectSymbols symbols;

	public JustificationFormatter(DialectSymbols symbols) {
		this.symbols = symbols;
	}

	public String format(String justification) {
		Matcher discharge = DISCHARGE.matcher(justification);
		String text = justification.trim();
		List<Integer> labels = Collections.emptyList();
		if(discharge.matches()) {
			text = discharge.group(1);
			labels = dischargedLabels(justification);
		}
		StringBuilder result = new StringBuilder();
		if(!text.isEmpty()) {
			result.append("\\mbox{").append(symbolize(text)).append("}");
		}
		if(!labels.isEmpty()) {
			result.append("^{");
			for(int i = 0; i < labels.size(); i++) {
				if(i > 0) {
					result.append(",");
				}
				result.append(labels.get(i));
			}
			result.append("}");
		}
		return result.toString();
	}

	/**
	 * @return the labels after a trailing "from", as in "=> intro from 1, 2"; empty if there are none
	 */
	public static List<Integer> dischargedLabels(String justification) {
		Matcher discharge = DISCHARGE.matcher(justification);
		if(!discharge.matches()) {
			return Collections.emptyList();
		}
		List<Integer> labels = new ArrayList<>();
		for(String label : discharge.group(2).split("\\s*,\\s*")) {
			labels.add(Integer.parseInt(label));
		}
		return labels;
	}

	private String symbolize(String text) {
		StringBuilder result = new StringBuilder();
		Matcher piece = PIECE.matcher(text);
		while(piece.find()) {
			String word = piece.group();
			String symbol = symbolFor(word);
			if(symbol != null) {
				result.append('$').append(symbol).append('$');
			} else {
				result.append(LatexText.escape(word));
			}
		}
		return result.toString();
	}

	private String symbolFor(String word) {
		ZOperator operator = ReservedWords.infix(word);
		if(operator == null) {
			operator = ReservedWords.prefix(word);
		}
		if(operator != null && operator.isLogical()) {
			return symbols.operator(operator, DialectSymbols.Context.CHAIN);
		}
		ZKeyword keyword = ReservedWords.keyword(word);
		if(keyword != null && keyword.isQuantifier()) {
			return symbols.quantifier(keyword.toQuantifierKind());
		}
		return null;
	}
}

package zedtex.trans.passes.codegen.latex;

/**
 * Escaping for text written outside math mode.
 */
public class LatexText {
	private LatexText() {}

	public static String escape(String text) {
		StringBuilder result = new StringBuilder(text.length());
		for(int i = 0; i < text.length(); i++) {
			char c = text.charAt(i);
			switch(c) {
				case '\\':
					result.append("\\textbackslash{}");
					break;
				case '_':
				case '&':
				case '%':
				case '#':
				case '$':
				case '{':
				case '}':
					result.append('\\').append(c);
					break;
				case '^':
					result.append("\\^{}");
					break;
				case '~':
					result.append("\\~{}");
					break;
				default:
					result.append(c);
			}
		}
		return result.toString();
	}
}

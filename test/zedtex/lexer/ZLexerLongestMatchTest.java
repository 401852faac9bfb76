package zedtex.lexer;

import static org.hamcrest.CoreMatchers.is;
import static org.junit.Assert.assertThat;

import java.util.Arrays;
import java.util.List;

import org.junit.Test;
import org.junit.runner.RunWith;
import org.junit.runners.Parameterized;
import org.junit.runners.Parameterized.Parameters;

/**
 * Operators whose spelling starts with a shorter operator must be read whole.
 */
@RunWith(Parameterized.class)
public class ZLexerLongestMatchTest {

	@Parameters
	public static List<Object[]> data() {
		return Arrays.asList(new Object[][] {
				{"f : A -->> B", "-->>"},
				{"f : A +->> B", "+->>"},
				{"f : A >->> B", ">->>"},
				{"f : A >7-> B", ">7->"},
				{"f : A 77-> B", "77->"},
				{"f : A +-> B", "+->"},
				{"f : A >-> B", ">->"},
				{"f : A >+> B", ">+>"},
				{"f : A <-> B", "<->"},
				{"f : A -> B", "->"},
				{"p <=> q", "<=>"},
				{"S <<| R", "<<|"},
				{"R |>> S", "|>>"},
				{"a |-> b", "|->"},
				{"x <= y", "<="},
				{"R ++ S", "++"},
		});
	}

	private final String source;
	private final String operator;

	public ZLexerLongestMatchTest(String source, String operator) {
		this.source = source;
		this.operator = operator;
	}

	@Test
	public void test() {
		List<ZToken> tokens = new ZLexer(source, new ProseDetector(), false).tokenize();
		ZToken found = null;
		for(ZToken token : tokens) {
			if(token.getType() == ZTokenType.OPERATOR) {
				found = token;
				break;
			}
		}
		assertThat(found == null ? null : found.getValue(), is(operator));
	}
}

package zedtex.parser;

import org.junit.Test;
import org.junit.runner.RunWith;
import org.junit.runners.Parameterized;
import zedtex.lexer.ZLexer;
import zedtex.lexer.ZToken;
import zedtex.lexer.ZTokenType;

import java.util.Arrays;
import java.util.List;

import static org.hamcrest.CoreMatchers.is;
import static org.junit.Assert.*;

@RunWith(Parameterized.class)
public class ZParseErrorTest {

	@Parameterized.Parameters(name = "{0}")
	public static List<Object[]> data() {
		return Arrays.asList(new Object[][]{
				{"p and", "expression", ZTokenType.NEWLINE, 1},
				{"f(x", "',' or ')'", ZTokenType.NEWLINE, 1},
				{"schema S\n  x : N\n", "'where' or 'end'", ZTokenType.EOF, 3},
				{"axdef\n  x : N\nwhere\n  x > 0\n", "'end'", ZTokenType.EOF, 5},
				{"TRUTH TABLE:\np | q\nT\n", "2 cells", ZTokenType.IDENTIFIER, 3},
				{"EQUIV:\n<=> p", "expression", ZTokenType.OPERATOR, 2},
				{"PROOF:\n:: p", "conclusion", ZTokenType.DELIMITER, 2},
				{"PROOF:\np\nq", "indented proof line", ZTokenType.IDENTIFIER, 3},
				{"PROOF:\np => q [=> intro from 1]\n  [1.5] p [assumption]", "assumption label", ZTokenType.NUMBER, 3},
				{"PROOF:\np => q [=> intro from 1]\n  [99999999999] p", "assumption label", ZTokenType.NUMBER, 3},
		});
	}

	private final String source;
	private final String expected;
	private final ZTokenType foundType;
	private final int line;

	public ZParseErrorTest(String source, String expected, ZTokenType foundType, int line) {
		this.source = source;
		this.expected = expected;
		this.foundType = foundType;
		this.line = line;
	}

	@Test
	public void test() {
		List<ZToken> tokens = new ZLexer(source).tokenize();
		try {
			ZDocumentParser.parse(tokens);
			fail("no parse error for " + source);
		} catch (ZParseException e) {
			assertThat(e.getExpected(), is(expected));
			assertThat(e.getFound().getType(), is(foundType));
			assertThat(e.getLine(), is(line));
			boolean fromInput = false;
			for(ZToken token : tokens) {
				fromInput |= token == e.getFound();
			}
			assertTrue("the reported token is one of the input tokens", fromInput);
		}
	}
}

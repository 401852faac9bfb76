package zedtex.lexer;

import static org.hamcrest.CoreMatchers.is;
import static org.junit.Assert.assertThat;
import static org.junit.Assert.fail;

import org.junit.Test;

public class ZLexerErrorTest {

	@Test
	public void unexpectedCharacter() {
		try {
			new ZLexer("x = y $").tokenize();
			fail("expected a ZLexerException");
		} catch (ZLexerException e) {
			assertThat(e.getLine(), is(1));
			assertThat(e.getColumn(), is(7));
			assertThat(e.getSnippet(), is("x = y $"));
			assertThat(e.getMsg(), is("unexpected character '$'"));
		}
	}

	@Test
	public void errorOnLaterLine() {
		try {
			new ZLexer("p\nq and $").tokenize();
			fail("expected a ZLexerException");
		} catch (ZLexerException e) {
			assertThat(e.getLine(), is(2));
			assertThat(e.getColumn(), is(7));
		}
	}

	@Test
	public void unterminatedSectionHeader() {
		try {
			new ZLexer("=== Sets").tokenize();
			fail("expected a ZLexerException");
		} catch (ZLexerException e) {
			assertThat(e.getLine(), is(1));
			assertThat(e.getMsg(), is("expected closing '==='"));
		}
	}

	@Test
	public void prettyStringPointsAtTheColumnAndHints() {
		try {
			new ZLexer("x = y $").tokenize();
			fail("expected a ZLexerException");
		} catch (ZLexerException e) {
			String[] lines = e.prettyString().split("\n");
			assertThat(lines[lines.length - 2].indexOf('^'), is(4 + 6));
			assertThat(lines[lines.length - 1],
					is("Hint: This character is not valid in whiteboard notation"));
		}
	}

	@Test
	public void unclosedMathInText() {
		try {
			new ZLexer("TEXT: take $\\alpha$ and $x").tokenize();
			fail("expected a ZLexerException");
		} catch (ZLexerException e) {
			assertThat(e.getLine(), is(1));
			assertThat(e.getColumn(), is(25));
			assertThat(e.getMsg(), is("unclosed '$' in text"));
			String[] lines = e.prettyString().split("\n");
			assertThat(lines[lines.length - 1], is("Hint: Formulas in text are written between two $ signs"));
		}
	}

	@Test
	public void balancedMathInTextIsAccepted() {
		new ZLexer("TEXT: take $\\alpha$ and $x$").tokenize();
	}
}

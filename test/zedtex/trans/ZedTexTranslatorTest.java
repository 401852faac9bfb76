package zedtex.trans;

import org.junit.Test;
import zedtex.ZedTexOptions;
import zedtex.lexer.ZLexerException;
import zedtex.lexer.ZToken;
import zedtex.model.z.ZDocument;
import zedtex.parser.ZParseException;
import zedtex.trans.passes.codegen.latex.Dialect;

import java.util.List;

import static org.hamcrest.CoreMatchers.is;
import static org.hamcrest.CoreMatchers.startsWith;
import static org.junit.Assert.assertThat;
import static org.junit.Assert.fail;
import static zedtex.model.z.ZBuilder.*;

public class ZedTexTranslatorTest {

	private final ZedTexTranslator fragments = new ZedTexTranslator(ZedTexOptions.fromJSON("{\"preamble\": false}"));

	@Test
	public void stagesCanBeRunSeparately() {
		List<ZToken> tokens = fragments.tokenize("p and q => r");
		ZDocument document = fragments.parse(tokens);
		assertThat(document, is(document(display(implies(and(id("p"), id("q")), id("r"))))));
		assertThat(fragments.generate(document).getOutput(), is("\\noindent\n$p \\land q \\implies r$\n"));
		assertThat(fragments.generate(document, Dialect.ZED_CM).getOutput(),
				is("\\noindent\n$p \\land q \\Rightarrow r$\n"));
	}

	@Test
	public void configuredDialectIsTheDefault() {
		ZedTexTranslator zedCm = new ZedTexTranslator(
				ZedTexOptions.fromJSON("{\"preamble\": false, \"dialect\": \"zed-cm\"}"));
		assertThat(zedCm.translate("forall x : N | x > 0").getOutput(),
				is("\\noindent\n$\\forall x \\colon \\mathbb{N} \\bullet x > 0$\n"));
	}

	@Test
	public void generationIsRepeatable() {
		String source = "=== Sets ===\nschema S\n  x : N\nwhere\n  x > 0\nend\n";
		ZedTexTranslator translator = new ZedTexTranslator();
		ZDocument document = translator.parse(translator.tokenize(source));
		for(Dialect dialect : Dialect.values()) {
			assertThat(translator.generate(document, dialect).getOutput(),
					is(translator.generate(document, dialect).getOutput()));
			assertThat(translator.translate(source, dialect).getOutput(),
					is(translator.generate(document, dialect).getOutput()));
		}
	}

	@Test
	public void warningsDoNotChangeTheOutput() {
		String source = "axdef\n  f : N -> N -> N\nend";
		ZedTexTranslator narrow = new ZedTexTranslator(
				ZedTexOptions.fromJSON("{\"preamble\": false, \"maxLineLength\": 20}"));
		GenerationResult warned = narrow.translate(source);
		GenerationResult quiet = fragments.translate(source);
		assertThat(warned.hasWarnings(), is(true));
		assertThat(warned.getWarnings().size(), is(1));
		assertThat(warned.getWarnings().get(0), startsWith("line in axdef exceeds 20 characters"));
		assertThat(quiet.hasWarnings(), is(false));
		assertThat(warned.getOutput(), is(quiet.getOutput()));
	}

	@Test
	public void lexerErrorsReachTheCaller() {
		try {
			fragments.translate("x = y $");
			fail("expected a lexer error");
		} catch (ZLexerException e) {
			assertThat(e.getLine(), is(1));
			assertThat(e.getColumn(), is(7));
		}
	}

	@Test
	public void parseErrorsReachTheCaller() {
		try {
			fragments.translate("p\nq and\n");
			fail("expected a parse error");
		} catch (ZParseException e) {
			assertThat(e.getLine(), is(2));
			assertThat(e.getExpected(), is("expression"));
		}
	}
}

package zedtex;

import org.apache.commons.io.FileUtils;
import org.junit.Rule;
import org.junit.Test;
import org.junit.rules.TemporaryFolder;
import zedtex.lexer.ProseDetector;
import zedtex.model.z.ReservedWords;
import zedtex.trans.passes.codegen.latex.Dialect;

import java.io.File;
import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.util.Arrays;
import java.util.LinkedHashSet;
import java.util.Set;

import static org.hamcrest.CoreMatchers.containsString;
import static org.hamcrest.CoreMatchers.is;
import static org.junit.Assert.assertThat;
import static org.junit.Assert.fail;

public class ZedTexOptionsTest {

	@Rule
	public TemporaryFolder folder = new TemporaryFolder();

	@Test
	public void defaults() {
		ZedTexOptions options = ZedTexOptions.defaults();
		assertThat(options.dialect, is(Dialect.FUZZ));
		assertThat(options.maxLineLength, is(80));
		assertThat(options.proseLookahead, is(6));
		assertThat(options.preamble, is(true));
		assertThat(options.proseIndicators, is(ReservedWords.PROSE_INDICATORS));
		assertThat(options.proseStarters, is(ReservedWords.PROSE_STARTERS));
	}

	@Test
	public void overridesKeepTheOtherDefaults() {
		ZedTexOptions options = ZedTexOptions.fromJSON(
				"{\"dialect\": \"zed-cm\", \"proseIndicators\": [\"is\", \"holds\"], \"proseLookahead\": 3}");
		assertThat(options.dialect, is(Dialect.ZED_CM));
		Set<String> indicators = new LinkedHashSet<>(Arrays.asList("is", "holds"));
		assertThat(options.proseIndicators, is(indicators));
		assertThat(options.proseLookahead, is(3));
		assertThat(options.maxLineLength, is(80));
		assertThat(options.preamble, is(true));

		ProseDetector detector = options.proseDetector();
		assertThat(detector.isProse("the invariant holds", true), is(true));
		assertThat(detector.isProse("the value are five", true), is(false));
	}

	@Test
	public void dialectNamesIgnoreCase() {
		assertThat(ZedTexOptions.fromJSON("{\"dialect\": \"ZED-CM\"}").dialect, is(Dialect.ZED_CM));
	}

	@Test
	public void withDialectCopies() {
		ZedTexOptions options = ZedTexOptions.fromJSON("{\"maxLineLength\": 40}");
		ZedTexOptions copy = options.withDialect(Dialect.ZED_CM);
		assertThat(copy.dialect, is(Dialect.ZED_CM));
		assertThat(copy.maxLineLength, is(40));
		assertThat(options.dialect, is(Dialect.FUZZ));
	}

	@Test
	public void fromFile() throws IOException {
		File config = folder.newFile("zedtex.json");
		FileUtils.writeStringToFile(config, "{\"preamble\": false}", StandardCharsets.UTF_8);
		assertThat(ZedTexOptions.fromFile(config).preamble, is(false));
	}

	private static void assertRejected(String json, String message) {
		try {
			ZedTexOptions.fromJSON(json);
			fail("accepted " + json);
		} catch (ZedTexOptionException e) {
			assertThat(e.getMsg(), containsString(message));
		}
	}

	@Test
	public void invalidConfigurations() {
		assertRejected("{\"dialect\": \"latex2e\"}", "unknown dialect \"latex2e\"");
		assertRejected("{\"maxLineLength\": 0}", "maxLineLength must be positive");
		assertRejected("{\"proseLookahead\": -1}", "proseLookahead must be positive");
		assertRejected("{\"preamble\": \"sometimes\"}", "configuration is invalid");
		assertRejected("{\"dialect\": ", "parsing error");
	}

	@Test
	public void missingFile() {
		File missing = new File(folder.getRoot(), "absent.json");
		try {
			ZedTexOptions.fromFile(missing);
			fail("read a missing file");
		} catch (ZedTexOptionException e) {
			assertThat(e.getMsg(), containsString("Error reading configuration file"));
		}
	}
}

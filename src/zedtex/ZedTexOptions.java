package zedtex;

import org.apache.commons.io.FileUtils;
import org.apache.commons.io.IOUtils;
import org.json.JSONArray;
import org.json.JSONException;
import org.json.JSONObject;
import zedtex.lexer.ProseDetector;
import zedtex.model.z.ReservedWords;
import zedtex.trans.passes.codegen.latex.Dialect;

import java.io.File;
import java.io.IOException;
import java.io.InputStream;
import java.nio.charset.StandardCharsets;
import java.util.Collections;
import java.util.LinkedHashSet;
import java.util.Set;

/**
 * Translation settings. The defaults come from the resource zedtex/defaults.json; a JSON configuration only
 * needs the keys it changes:
 *
 * {
 *   "dialect": "zed-cm",
 *   "maxLineLength": 100,
 *   "proseLookahead": 6,
 *   "proseIndicators": ["is", "are", "by"],
 *   "proseStarters": ["the", "a", "this"],
 *   "preamble": false
 * }
 */
public class ZedTexOptions {
	public static final String DEFAULTS_RESOURCE = "/zedtex/defaults.json";

	// keys of the JSON configuration
	public static final String DIALECT_FIELD = "dialect";
	public static final String MAX_LINE_LENGTH_FIELD = "maxLineLength";
	public static final String PROSE_LOOKAHEAD_FIELD = "proseLookahead";
	public static final String PROSE_INDICATORS_FIELD = "proseIndicators";
	public static final String PROSE_STARTERS_FIELD = "proseStarters";
	public static final String PREAMBLE_FIELD = "preamble";

	public Dialect dialect = Dialect.FUZZ;
	/** Generated lines inside boxed environments longer than this are reported. */
	public int maxLineLength;
	public int proseLookahead;
	public Set<String> proseIndicators = ReservedWords.PROSE_INDICATORS;
	public Set<String> proseStarters = ReservedWords.PROSE_STARTERS;
	/** Whether the output is a complete document rather than a fragment to include. */
	public boolean preamble;

	private ZedTexOptions() {}

	public static ZedTexOptions defaults() {
		ZedTexOptions options = new ZedTexOptions();
		options.apply(readDefaults(), DEFAULTS_RESOURCE);
		return options;
	}

	/**
	 * @param json a configuration overriding some of the defaults
	 */
	public static ZedTexOptions fromJSON(String json) {
		ZedTexOptions options = defaults();
		options.apply(parse(json, "configuration"), "configuration");
		return options;
	}

	public static ZedTexOptions fromFile(File configFile) {
		String json;
		try {
			json = FileUtils.readFileToString(configFile, StandardCharsets.UTF_8);
		} catch (IOException e) {
			throw new ZedTexOptionException("Error reading configuration file: " + e.getMessage(), e);
		}
		ZedTexOptions options = defaults();
		options.apply(parse(json, configFile.getPath()), configFile.getPath());
		return options;
	}

	private static JSONObject readDefaults() {
		try (InputStream stream = ZedTexOptions.class.getResourceAsStream(DEFAULTS_RESOURCE)) {
			if(stream == null) {
				throw new ZedTexOptionException("missing resource " + DEFAULTS_RESOURCE);
			}
			return parse(IOUtils.toString(stream, StandardCharsets.UTF_8), DEFAULTS_RESOURCE);
		} catch (IOException e) {
			throw new ZedTexOptionException("Error reading " + DEFAULTS_RESOURCE + ": " + e.getMessage(), e);
		}
	}

	private static JSONObject parse(String json, String source) {
		try {
			return new JSONObject(json);
		} catch (JSONException e) {
			throw new ZedTexOptionException(source + ": parsing error: " + e.getMessage(), e);
		}
	}

	private void apply(JSONObject config, String source) {
		try {
			if(config.has(DIALECT_FIELD)) {
				String name = config.getString(DIALECT_FIELD);
				dialect = Dialect.fromConfigName(name);
				if(dialect == null) {
					throw new ZedTexOptionException(source + ": unknown dialect \"" + name
							+ "\", expected \"fuzz\" or \"zed-cm\"");
				}
			}
			if(config.has(MAX_LINE_LENGTH_FIELD)) {
				maxLineLength = config.getInt(MAX_LINE_LENGTH_FIELD);
			}
			if(config.has(PROSE_LOOKAHEAD_FIELD)) {
				proseLookahead = config.getInt(PROSE_LOOKAHEAD_FIELD);
			}
			if(config.has(PROSE_INDICATORS_FIELD)) {
				proseIndicators = readWords(config.getJSONArray(PROSE_INDICATORS_FIELD));
			}
			if(config.has(PROSE_STARTERS_FIELD)) {
				proseStarters = readWords(config.getJSONArray(PROSE_STARTERS_FIELD));
			}
			if(config.has(PREAMBLE_FIELD)) {
				preamble = config.getBoolean(PREAMBLE_FIELD);
			}
		} catch (JSONException e) {
			throw new ZedTexOptionException(source + ": configuration is invalid: " + e.getMessage(), e);
		}
		validate(source);
	}

	private static Set<String> readWords(JSONArray words) {
		Set<String> result = new LinkedHashSet<>();
		for(int i = 0; i < words.length(); i++) {
			result.add(words.getString(i));
		}
		return Collections.unmodifiableSet(result);
	}

	private void validate(String source) {
		if(maxLineLength <= 0) {
			throw new ZedTexOptionException(source + ": " + MAX_LINE_LENGTH_FIELD + " must be positive");
		}
		if(proseLookahead <= 0) {
			throw new ZedTexOptionException(source + ": " + PROSE_LOOKAHEAD_FIELD + " must be positive");
		}
	}

	/**
	 * @return a copy of these options generating the given dialect
	 */
	public ZedTexOptions withDialect(Dialect dialect) {
		ZedTexOptions copy = new ZedTexOptions();
		copy.dialect = dialect;
		copy.maxLineLength = maxLineLength;
		copy.proseLookahead = proseLookahead;
		copy.proseIndicators = proseIndicators;
		copy.proseStarters = proseStarters;
		copy.preamble = preamble;
		return copy;
	}

	public ProseDetector proseDetector() {
		return new ProseDetector(proseStarters, proseIndicators, proseLookahead);
	}
}

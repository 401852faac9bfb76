package zedtex.trans.passes.codegen.latex;

import java.util.Locale;

/**
 * The two macro sets the generator can target.
 */
public enum Dialect {
	/** The fuzz package, whose typechecker is strict about parentheses and symbol names. */
	FUZZ("fuzz"),
	/** The zed-cm and zed-maths packages, for conventional typesetting. */
	ZED_CM("zed-cm");

	private final String configName;

	Dialect(String configName) {
		this.configName = configName;
	}

	public String getConfigName() {
		return configName;
	}

	/**
	 * @return the dialect called name in a configuration file, or null if there is none
	 */
	public static Dialect fromConfigName(String name) {
		for(Dialect dialect : values()) {
			if(dialect.configName.equals(name.toLowerCase(Locale.ROOT))) {
				return dialect;
			}
		}
		return null;
	}
}

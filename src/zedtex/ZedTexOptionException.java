package zedtex;

/**
 * Raised when the JSON configuration cannot be read or holds an invalid value.
 */
public class ZedTexOptionException extends ZedTexException {
	public ZedTexOptionException(String msg) {
		super("Configuration error", msg);
	}

	public ZedTexOptionException(String msg, Throwable cause) {
		super("Configuration error", msg);
		initCause(cause);
	}
}

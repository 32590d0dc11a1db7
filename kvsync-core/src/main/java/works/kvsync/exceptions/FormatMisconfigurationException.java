package works.kvsync.exceptions;

/**
 * A format does not fit the type it is applied to,
 * or two parts of an object would be stored under the same key.
 */
public class FormatMisconfigurationException extends IllegalArgumentException {
	public FormatMisconfigurationException(String s) {
		super(s);
	}

	public FormatMisconfigurationException(String message, Throwable cause) {
		super(message, cause);
	}
}

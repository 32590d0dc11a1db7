package works.kvsync.exceptions;

/**
 * A key or a list of selectors could not be resolved against an object.
 * The {@link #reason()} tells callers which way it failed without parsing messages.
 */
public class KvsPathException extends Exception {
	private final Reason reason;

	public enum Reason {
		/** A key segment matches no literal of the format or of any struct field. */
		PATH_NOT_FOUND,
		WRONG_FIELD_NAME,
		/** A struct was addressed with something other than a field name. */
		WRONG_FIELD_TYPE,
		KEY_WRONG_TYPE,
		/** The addressed object does not exist and was not created. */
		KEY_NOT_FOUND,
		/** The map entry to encode or delete does not exist. */
		OBJECT_NOT_FOUND,
		/** The path continues into an object that is stored as a single value. */
		PATH_PAST_OBJECT,
		/** The path ends before the format reaches a stored value. */
		INCOMPLETE_PATH,
		SET_NONEXISTENT,
		SET_WRONG_TYPE,
		/** The format continues past a scalar. */
		SCALAR_TYPE,
		/** Arrays, collections and {@code {index}} segments are only supported as whole values. */
		NOT_IMPLEMENTED,
		/** Only map entries can be deleted. */
		NOT_MAP_INDEX,
		MALFORMED_VALUE,
		MALFORMED_KEY,
	}

	public Reason reason() {
		return reason;
	}

	public KvsPathException(Reason reason, String message) {
		super(message);
		this.reason = reason;
	}

	public KvsPathException(Reason reason, String message, Throwable cause) {
		super(message, cause);
		this.reason = reason;
	}
}

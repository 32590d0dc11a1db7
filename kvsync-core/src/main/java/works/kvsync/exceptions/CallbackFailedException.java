package works.kvsync.exceptions;

/**
 * A sync callback threw while handling an update, or a synced object's
 * format turned out not to fit its type.
 * The update has already been applied to every other synced object.
 * Failures of further callbacks for the same update are attached as
 * {@linkplain #getSuppressed() suppressed} exceptions.
 */
public class CallbackFailedException extends Exception {
	private final String key;

	public CallbackFailedException(String key, Throwable cause) {
		super("Callback failed for key \"" + key + "\"", cause);
		this.key = key;
	}

	/**
	 * @return the store key of the update being routed
	 */
	public String key() {
		return key;
	}
}

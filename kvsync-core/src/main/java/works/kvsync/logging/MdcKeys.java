package works.kvsync.logging;

/**
 * Keys kvsync puts in the SLF4J {@link org.slf4j.MDC MDC} while it runs user code,
 * so that log lines from callbacks can be traced back to the update that caused them.
 */
public final class MdcKeys {
	private MdcKeys() { }

	/**
	 * The format of the synced object being notified.
	 */
	public static final String SYNC_FORMAT = "kvsync.format";

	/**
	 * The store key of the update being routed.
	 */
	public static final String UPDATE_KEY = "kvsync.key";
}

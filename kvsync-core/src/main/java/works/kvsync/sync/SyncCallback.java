package works.kvsync.sync;

/**
 * Told about each change to a synced object.
 * Runs on the thread calling {@link ChangeRouter#next}, after the change has been applied.
 */
@FunctionalInterface
public interface SyncCallback {
	void onChange(ChangeEvent event) throws Exception;
}

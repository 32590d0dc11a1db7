package works.kvsync.kvs;

import java.io.IOException;
import java.time.Duration;
import java.util.concurrent.TimeoutException;

/**
 * A stream of changes made to a key-value store.
 *
 * <p>
 * The first calls to {@link #next} report every key that already exists, as creations.
 * After that, every write surfaces exactly once. Changes to the same key arrive
 * in the order they were made; changes to different keys may arrive in any order.
 *
 * <p>
 * Only one thread at a time should call {@link #next}.
 * Writers may run concurrently with it.
 */
public interface ChangeSource {
	/**
	 * Waits for the next change.
	 *
	 * @throws TimeoutException if nothing changed within {@code timeout}
	 * @throws InterruptedException if the calling thread was interrupted while waiting
	 */
	Update next(Duration timeout) throws IOException, InterruptedException, TimeoutException;
}

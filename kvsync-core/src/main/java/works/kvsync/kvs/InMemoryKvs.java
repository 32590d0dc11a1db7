package works.kvsync.kvs;

import java.time.Duration;
import java.util.ArrayDeque;
import java.util.Iterator;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Optional;
import java.util.Queue;
import java.util.concurrent.TimeoutException;
import java.util.concurrent.locks.Condition;
import java.util.concurrent.locks.ReentrantLock;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import works.kvsync.exceptions.NoSuchKeyException;

/**
 * A key-value store held in memory, which reports its own changes.
 * Thread-safe: any number of writers may race with the thread calling {@link #next}.
 */
public final class InMemoryKvs implements KvStore, KvReader, ChangeSource {
	private final ReentrantLock lock = new ReentrantLock();
	private final Condition updateAvailable = lock.newCondition();
	private final Map<String, String> contents = new LinkedHashMap<>();
	private final Queue<Update> queue = new ArrayDeque<>();

	public InMemoryKvs() {
	}

	/**
	 * @return a store holding {@code existing}, whose first updates report each of its keys as a creation
	 */
	public static InMemoryKvs replaying(Map<String, String> existing) {
		InMemoryKvs result = new InMemoryKvs();
		existing.forEach((k, v) -> {
			result.contents.put(k, v);
			result.queue.add(Update.creation(k, v));
		});
		return result;
	}

	@Override
	public void set(String key, String value) {
		lock.lock();
		try {
			Optional<String> previous = Optional.ofNullable(contents.put(key, value));
			enqueue(new Update(key, Optional.of(value), previous));
		} finally {
			lock.unlock();
		}
	}

	/**
	 * A key ending with a slash removes every key under it,
	 * but is reported as a single update for that key.
	 */
	@Override
	public void delete(String key) throws NoSuchKeyException {
		lock.lock();
		try {
			if (key.endsWith("/")) {
				boolean found = false;
				for (Iterator<String> iter = contents.keySet().iterator(); iter.hasNext(); ) {
					if (iter.next().startsWith(key)) {
						iter.remove();
						found = true;
					}
				}
				if (!found) {
					throw new NoSuchKeyException(key);
				}
				enqueue(Update.deletion(key, Optional.empty()));
			} else {
				String previous = contents.remove(key);
				if (previous == null) {
					throw new NoSuchKeyException(key);
				}
				enqueue(Update.deletion(key, Optional.of(previous)));
			}
		} finally {
			lock.unlock();
		}
	}

	@Override
	public Optional<String> get(String key) {
		lock.lock();
		try {
			return Optional.ofNullable(contents.get(key));
		} finally {
			lock.unlock();
		}
	}

	@Override
	public Update next(Duration timeout) throws InterruptedException, TimeoutException {
		long remainingNanos = timeout.toNanos();
		lock.lockInterruptibly();
		try {
			while (queue.isEmpty()) {
				if (remainingNanos <= 0L) {
					throw new TimeoutException("No update within " + timeout);
				}
				remainingNanos = updateAvailable.awaitNanos(remainingNanos);
			}
			Update result = queue.remove();
			LOGGER.trace("next: {}", result);
			return result;
		} finally {
			lock.unlock();
		}
	}

	/**
	 * @return a copy of everything currently stored
	 */
	public Map<String, String> snapshot() {
		lock.lock();
		try {
			return new LinkedHashMap<>(contents);
		} finally {
			lock.unlock();
		}
	}

	/**
	 * @return the number of updates not yet returned by {@link #next}
	 */
	public int pendingUpdates() {
		lock.lock();
		try {
			return queue.size();
		} finally {
			lock.unlock();
		}
	}

	private void enqueue(Update update) {
		queue.add(update);
		updateAvailable.signalAll();
	}

	@Override
	public String toString() {
		return "InMemoryKvs(" + snapshot().size() + " keys)";
	}

	private static final Logger LOGGER = LoggerFactory.getLogger(InMemoryKvs.class);
}

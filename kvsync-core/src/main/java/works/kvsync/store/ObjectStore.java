package works.kvsync.store;

import java.io.IOException;
import java.util.Map;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import works.kvsync.KvsMapper;
import works.kvsync.Location;
import works.kvsync.RootHandle;
import works.kvsync.exceptions.KvsPathException;
import works.kvsync.kvs.KvStore;

import static java.util.Objects.requireNonNull;

/**
 * Writes objects, or parts of them, to a {@link KvStore}.
 *
 * <p>
 * {@link #set} and {@link #delete} change the in-memory object under its
 * {@link RootHandle}'s lock and then write to the store after releasing it.
 * Two threads writing the same part of an object may therefore reach the
 * store in a different order than they changed the object.
 */
public final class ObjectStore {
	private final KvStore store;
	private final KvsMapper mapper;

	public ObjectStore(KvStore store) {
		this(store, new KvsMapper());
	}

	public ObjectStore(KvStore store, KvsMapper mapper) {
		this.store = requireNonNull(store);
		this.mapper = requireNonNull(mapper);
	}

	/**
	 * Writes every key of the selected part of {@code root}.
	 * Nothing is deleted, so keys of parts that no longer exist are left behind.
	 */
	public void store(Object root, String format, Object... selectors) throws KvsPathException, IOException {
		Map<String, String> pairs = mapper.encode(root, format, selectors);
		for (Map.Entry<String, String> entry : pairs.entrySet()) {
			LOGGER.trace("Storing {} = {}", entry.getKey(), entry.getValue());
			store.set(entry.getKey(), entry.getValue());
		}
		LOGGER.debug("Stored {} keys", pairs.size());
	}

	/**
	 * Sets {@code value} in the object, creating whatever is missing on the way to it,
	 * then stores it.
	 */
	public <T> void set(RootHandle<T> handle, String format, Object value, Object... selectors) throws KvsPathException, IOException {
		Object snapshot;
		try (var locked = handle.lock()) {
			Location location = mapper.setByFields(handle.get(), format, value, selectors);
			handle.replace(location.root());
			snapshot = location.root();
		}
		store(snapshot, format, selectors);
	}

	/**
	 * Removes a map entry from the object, then deletes its keys from the store.
	 * The last selector is the entry's key.
	 */
	public <T> void delete(RootHandle<T> handle, String format, Object... selectors) throws KvsPathException, IOException {
		String key;
		try (var locked = handle.lock()) {
			Location location = mapper.deleteByFields(handle.get(), format, selectors);
			handle.replace(location.root());
			key = location.key();
		}
		LOGGER.debug("Deleting {}", key);
		store.delete(key);
	}

	private static final Logger LOGGER = LoggerFactory.getLogger(ObjectStore.class);
}

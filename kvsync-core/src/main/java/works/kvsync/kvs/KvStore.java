package works.kvsync.kvs;

import java.io.IOException;

public interface KvStore {
	void set(String key, String value) throws IOException;

	/**
	 * A key ending with a slash deletes every key that starts with it.
	 *
	 * @throws works.kvsync.exceptions.NoSuchKeyException if there is nothing to delete
	 */
	void delete(String key) throws IOException;
}

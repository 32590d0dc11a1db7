package works.kvsync.kvs;

import java.util.Optional;

import static java.util.Objects.requireNonNull;

/**
 * A change to one key.
 *
 * @param value the new value, or empty if the key was deleted.
 *              Deleting a key that ends with a slash deletes everything under it.
 * @param previous the value before the change, if the store knows it
 */
public record Update(String key, Optional<String> value, Optional<String> previous) {
	public Update {
		requireNonNull(key);
		requireNonNull(value);
		requireNonNull(previous);
	}

	public static Update creation(String key, String value) {
		return new Update(key, Optional.of(value), Optional.empty());
	}

	public static Update deletion(String key, Optional<String> previous) {
		return new Update(key, Optional.empty(), previous);
	}

	public boolean isDeletion() {
		return value.isEmpty();
	}
}

package works.kvsync.kvs;

import java.io.IOException;
import java.util.Optional;

/**
 * Optional capability of a store to read single keys.
 */
public interface KvReader {
	Optional<String> get(String key) throws IOException;
}

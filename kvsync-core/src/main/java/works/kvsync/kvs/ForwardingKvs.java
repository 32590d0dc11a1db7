package works.kvsync.kvs;

import java.io.IOException;
import java.time.Duration;
import java.util.Optional;
import java.util.concurrent.TimeoutException;

/**
 * Implements every store interface by calling the same method on another object.
 * Useful for overriding one or two methods while leaving the rest unchanged.
 */
public class ForwardingKvs<D extends KvStore & KvReader & ChangeSource> implements KvStore, KvReader, ChangeSource {
	protected final D downstream;

	public ForwardingKvs(D downstream) {
		this.downstream = downstream;
	}

	@Override
	public void set(String key, String value) throws IOException {
		downstream.set(key, value);
	}

	@Override
	public void delete(String key) throws IOException {
		downstream.delete(key);
	}

	@Override
	public Optional<String> get(String key) throws IOException {
		return downstream.get(key);
	}

	@Override
	public Update next(Duration timeout) throws IOException, InterruptedException, TimeoutException {
		return downstream.next(timeout);
	}

	@Override
	public String toString() {
		return "ForwardingKvs{" +
			"downstream=" + downstream +
			'}';
	}
}

package works.kvsync.sync;

import java.io.IOException;
import java.time.Duration;
import java.util.ArrayList;
import java.util.Iterator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.NoSuchElementException;
import java.util.concurrent.TimeoutException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.slf4j.MDC;
import works.kvsync.Format;
import works.kvsync.KvsMapper;
import works.kvsync.Location;
import works.kvsync.RootHandle;
import works.kvsync.exceptions.CallbackFailedException;
import works.kvsync.exceptions.FormatMisconfigurationException;
import works.kvsync.exceptions.KvsPathException;
import works.kvsync.exceptions.OverlappingKeySpaceException;
import works.kvsync.kvs.ChangeSource;
import works.kvsync.kvs.Update;

import static java.util.Objects.requireNonNull;
import static works.kvsync.exceptions.KvsPathException.Reason.OBJECT_NOT_FOUND;
import static works.kvsync.logging.MdcKeys.SYNC_FORMAT;
import static works.kvsync.logging.MdcKeys.UPDATE_KEY;
import static works.kvsync.sync.ChangeRouterSettings.CallbackFailureMode.PROPAGATE;

/**
 * Applies changes from a {@link ChangeSource} to the objects registered with
 * {@link #syncObject}, and tells each object's callback what changed.
 *
 * <p>
 * Registered formats can't overlap, so each key belongs to at most one object.
 * Keys that belong to no object are ignored.
 *
 * <p>
 * Not thread-safe: one thread registers objects and calls {@link #next} in a loop.
 * The synced objects themselves are guarded by their {@link RootHandle}s,
 * which are locked while each change is applied and released before the callback runs.
 */
public final class ChangeRouter {
	private final ChangeSource source;
	private final KvsMapper mapper;
	private final ChangeRouterSettings settings;
	private final Map<Long, SyncObject<?>> registrations = new LinkedHashMap<>();
	private long nextID = 1;

	public ChangeRouter(ChangeSource source) {
		this(source, new KvsMapper(), ChangeRouterSettings.builder().build());
	}

	public ChangeRouter(ChangeSource source, KvsMapper mapper, ChangeRouterSettings settings) {
		this.source = requireNonNull(source);
		this.mapper = requireNonNull(mapper);
		this.settings = requireNonNull(settings);
	}

	/**
	 * @param format where in the key space the object lives, like {@code /users/}
	 * @throws OverlappingKeySpaceException if the literal start of {@code format}
	 * is a prefix of a registered one, or the other way around
	 */
	public <T> SyncObject<T> syncObject(String format, RootHandle<T> root, SyncCallback callback) {
		Format parsed = Format.parse(format);
		for (SyncObject<?> existing : registrations.values()) {
			if (parsed.overlaps(existing.parsedFormat())) {
				throw new OverlappingKeySpaceException(format, existing.format());
			}
		}
		SyncObject<T> result = new SyncObject<>(nextID++, format, parsed, requireNonNull(root), requireNonNull(callback));
		registrations.put(result.id(), result);
		LOGGER.debug("Registered {} at \"{}\"", root, format);
		return result;
	}

	/**
	 * @throws NoSuchElementException if no object is registered with exactly this format
	 */
	public void unsyncObject(String format) {
		for (Iterator<SyncObject<?>> iter = registrations.values().iterator(); iter.hasNext(); ) {
			SyncObject<?> candidate = iter.next();
			if (candidate.format().equals(format)) {
				iter.remove();
				LOGGER.debug("Unregistered \"{}\"", format);
				return;
			}
		}
		throw new NoSuchElementException("No object registered at \"" + format + "\"");
	}

	public List<SyncObject<?>> registrations() {
		return List.copyOf(registrations.values());
	}

	/**
	 * Waits for one update and routes it.
	 *
	 * <p>
	 * A deletion that removes a map entry of some object is delivered to that object only.
	 * Any other deletion is treated as setting the key to the empty string,
	 * which usually resets the field to its zero value.
	 *
	 * @throws IOException from the {@link ChangeSource}
	 * @throws InterruptedException from the {@link ChangeSource}
	 * @throws TimeoutException from the {@link ChangeSource}
	 * @throws KvsPathException with {@link KvsPathException.Reason#OBJECT_NOT_FOUND OBJECT_NOT_FOUND}
	 * if a deleted key names a map entry that was already absent
	 * @throws CallbackFailedException if a callback threw, or a registered object's format
	 * doesn't fit its type, under {@link ChangeRouterSettings.CallbackFailureMode#PROPAGATE PROPAGATE}.
	 * The update has been applied to every other matching object regardless.
	 */
	public void next(Duration timeout) throws IOException, InterruptedException, TimeoutException, KvsPathException, CallbackFailedException {
		Update update = source.next(timeout);
		LOGGER.debug("Routing {}", update);
		List<Exception> failures = new ArrayList<>();
		if (update.isDeletion() && routeDeletion(update, failures)) {
			reportFailures(update, failures);
			return;
		}

		String value = update.value().orElse("");
		int delivered = 0;
		// Callbacks may register and unregister objects
		for (SyncObject<?> registration : registrations()) {
			Location location;
			RootHandle<?> handle = registration.root();
			try (var locked = handle.lock()) {
				location = mapper.updateByKey(handle.get(), registration.format(), update.key(), value, settings.isIgnoreUnmarshalFailure());
				handle.replace(location.root());
			} catch (KvsPathException e) {
				LOGGER.trace("Skipping \"{}\" for {}: {}", registration.format(), update.key(), e.getMessage());
				continue;
			} catch (FormatMisconfigurationException e) {
				recordFailure(registration, update, e, failures);
				continue;
			}
			++delivered;
			deliver(registration, update, location, failures);
		}
		if (delivered == 0) {
			LOGGER.debug("No synced object for {}", update.key());
		}
		reportFailures(update, failures);
	}

	/**
	 * @return true if some object had a map entry removed
	 */
	private boolean routeDeletion(Update update, List<Exception> failures) throws KvsPathException {
		String key = update.key();
		if (key.endsWith("/")) {
			key = key.substring(0, key.length() - 1);
		}
		for (SyncObject<?> registration : registrations()) {
			Location location;
			RootHandle<?> handle = registration.root();
			try (var locked = handle.lock()) {
				location = mapper.deleteByKey(handle.get(), registration.format(), key);
				handle.replace(location.root());
			} catch (KvsPathException e) {
				if (e.reason() == OBJECT_NOT_FOUND) {
					throw e;
				}
				LOGGER.trace("Deletion of {} removes no entry from \"{}\": {}", key, registration.format(), e.getMessage());
				continue;
			} catch (FormatMisconfigurationException e) {
				recordFailure(registration, update, e, failures);
				continue;
			}
			LOGGER.debug("Deleted {} from \"{}\"", location.fields(), registration.format());
			deliver(registration, update, location, failures);
			return true;
		}
		return false;
	}

	private void deliver(SyncObject<?> registration, Update update, Location location, List<Exception> failures) {
		ChangeEvent event = ChangeEvent.at(mapper.descriptorTable(), update.key(), location.root(), location.fields());
		try (
			var f = MDC.putCloseable(SYNC_FORMAT, registration.format());
			var k = MDC.putCloseable(UPDATE_KEY, update.key())
		) {
			registration.callback().onChange(event);
		} catch (Exception e) {
			recordFailure(registration, update, e, failures);
		}
	}

	private void recordFailure(SyncObject<?> registration, Update update, Exception e, List<Exception> failures) {
		if (settings.getCallbackFailureMode() == PROPAGATE) {
			failures.add(e);
		} else {
			LOGGER.error("Routing {} to \"{}\" failed", update.key(), registration.format(), e);
		}
	}

	private static void reportFailures(Update update, List<Exception> failures) throws CallbackFailedException {
		if (failures.isEmpty()) {
			return;
		}
		CallbackFailedException result = new CallbackFailedException(update.key(), failures.get(0));
		for (Exception other : failures.subList(1, failures.size())) {
			result.addSuppressed(other);
		}
		throw result;
	}

	private static final Logger LOGGER = LoggerFactory.getLogger(ChangeRouter.class);
}

package works.kvsync.sync;

import java.time.Duration;
import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.NoSuchElementException;
import java.util.Optional;
import java.util.Queue;
import java.util.concurrent.TimeoutException;
import java.util.concurrent.locks.ReentrantLock;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.slf4j.MDC;
import works.kvsync.KvsMapper;
import works.kvsync.KvsNode;
import works.kvsync.RootHandle;
import works.kvsync.annotations.KeyFormat;
import works.kvsync.exceptions.CallbackFailedException;
import works.kvsync.exceptions.FormatMisconfigurationException;
import works.kvsync.exceptions.KvsPathException;
import works.kvsync.exceptions.OverlappingKeySpaceException;
import works.kvsync.kvs.InMemoryKvs;
import works.kvsync.kvs.Update;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertInstanceOf;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertSame;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;
import static works.kvsync.exceptions.KvsPathException.Reason.OBJECT_NOT_FOUND;
import static works.kvsync.logging.MdcKeys.SYNC_FORMAT;
import static works.kvsync.logging.MdcKeys.UPDATE_KEY;
import static works.kvsync.sync.ChangeRouterSettings.CallbackFailureMode.LOG;

class ChangeRouterTest {
	static final Duration TIMEOUT = Duration.ofSeconds(5);
	static final Duration SHORT = Duration.ofMillis(1);

	InMemoryKvs kvs;
	ChangeRouter router;
	RootHandle<Outer> handle;
	ChangeEvent lastEvent;

	record Inner(int a) { }

	record Outer(
		@KeyFormat("S/") Inner s,
		String b,
		@KeyFormat("map/{key}/s1/") Map<Integer, Inner> m
	) { }

	record MissingKeySegment(@KeyFormat("m/") Map<String, Integer> m) { }

	@SuppressWarnings("unused")
	static class Settings implements KvsNode {
		String name;
		int size;
	}

	@BeforeEach
	void setupRouter() {
		kvs = new InMemoryKvs();
		router = new ChangeRouter(kvs);
		handle = RootHandle.of(new Outer(new Inner(0), "", null));
		lastEvent = null;
	}

	Outer current() {
		try (var scope = handle.lock()) {
			return handle.get();
		}
	}

	@Test
	void syncAndUnsync() {
		RootHandle<Outer> other = RootHandle.of(new Outer(new Inner(0), "", null));
		router.syncObject("/test/key", handle, e -> { });
		router.syncObject("/test/key2", other, e -> { });
		assertThrows(NoSuchElementException.class, () -> router.unsyncObject("/test/key3"));
		router.unsyncObject("/test/key2");
		assertThrows(NoSuchElementException.class, () -> router.unsyncObject("/test/key2"));
		SyncObject<Outer> again = router.syncObject("/test/key2", other, e -> { });
		assertEquals(2, router.registrations().size());
		assertSame(other, again.root());
	}

	@Test
	void overlappingFormats_areRejected() {
		router.syncObject("/a/", handle, e -> { });
		OverlappingKeySpaceException e = assertThrows(OverlappingKeySpaceException.class,
			() -> router.syncObject("/a/b/", RootHandle.of(new Outer(null, "", null)), ev -> { }));
		assertEquals("/a/", e.existingFormat());
		assertThrows(OverlappingKeySpaceException.class,
			() -> router.syncObject("/", RootHandle.of(new Outer(null, "", null)), ev -> { }));
		router.syncObject("/b/", RootHandle.of(new Outer(null, "", null)), ev -> { });
		assertEquals(2, router.registrations().size());
	}

	@Test
	void basicNext() throws Exception {
		router.syncObject("/o/", handle, e -> lastEvent = e);

		kvs.set("/o/b", "nya");
		router.next(TIMEOUT);
		assertEquals("nya", lastEvent.field("b").asString());
		assertEquals("nya", current().b());
		assertEquals("/o/b", lastEvent.key());

		kvs.set("/o/S/a", "5");
		lastEvent = null;
		router.next(TIMEOUT);
		assertEquals(5, lastEvent.field("s").field("a").asInt());
		assertFalse(lastEvent.field("b").ok());

		kvs.set("/o/map/sds/s1/a", "5");
		lastEvent = null;
		router.next(TIMEOUT);
		assertNull(lastEvent, "Key that isn't an integer should produce no event");
		assertThrows(TimeoutException.class, () -> router.next(SHORT));
		assertNull(lastEvent);

		kvs.set("/o/map/123/s1/a", "6");
		router.next(TIMEOUT);
		List<Integer> keys = new ArrayList<>();
		assertEquals(6, lastEvent.field("m").mapValue(Integer.class, keys::add).field("a").asInt());
		assertEquals(List.of(123), keys);
		assertEquals(6, lastEvent.field("m").mapValue().field("a").asInt());
		assertEquals(Map.of(123, new Inner(6)), current().m());
		assertSame(current(), lastEvent.root());
	}

	@Test
	void deletedEntry_isRemovedAndReported() throws Exception {
		router.syncObject("/o/", handle, e -> lastEvent = e);
		kvs.set("/o/map/7/s1/a", "1");
		kvs.set("/o/map/8/s1/a", "2");
		router.next(TIMEOUT);
		router.next(TIMEOUT);

		kvs.delete("/o/map/7/s1/");
		router.next(TIMEOUT);
		List<Integer> keys = new ArrayList<>();
		assertTrue(lastEvent.field("m").mapValue(Integer.class, keys::add).isDeleted());
		assertEquals(List.of(7), keys);
		assertEquals(Map.of(8, new Inner(2)), current().m());
	}

	@Test
	void deletedScalar_isReset() throws Exception {
		router.syncObject("/o/", handle, e -> lastEvent = e);
		kvs.set("/o/b", "nya");
		kvs.set("/o/S/a", "5");
		router.next(TIMEOUT);
		router.next(TIMEOUT);

		kvs.delete("/o/b");
		router.next(TIMEOUT);
		assertEquals("", lastEvent.field("b").asString());
		assertEquals("", current().b());

		kvs.delete("/o/S/a");
		router.next(TIMEOUT);
		assertEquals(0, lastEvent.field("s").field("a").asInt());
	}

	@Test
	void deletedMissingEntry_throws() throws Exception {
		Queue<Update> updates = new ArrayDeque<>();
		updates.add(Update.deletion("/o/map/9/s1/", Optional.empty()));
		ChangeRouter scripted = new ChangeRouter(timeout -> updates.remove());
		scripted.syncObject("/o/", handle, e -> lastEvent = e);
		KvsPathException e = assertThrows(KvsPathException.class, () -> scripted.next(TIMEOUT));
		assertEquals(OBJECT_NOT_FOUND, e.reason());
		assertNull(lastEvent);
	}

	@Test
	void unrelatedKeys_areIgnored() throws Exception {
		router.syncObject("/o/", handle, e -> lastEvent = e);
		kvs.set("/elsewhere/b", "x");
		kvs.set("/o/nothing", "x");
		router.next(TIMEOUT);
		router.next(TIMEOUT);
		assertNull(lastEvent);
		assertEquals("", current().b());
	}

	@Test
	void keysAreRoutedToTheirOwnObject() throws Exception {
		RootHandle<Outer> other = RootHandle.of(new Outer(new Inner(0), "", null));
		List<String> seen = new ArrayList<>();
		router.syncObject("/first/", handle, e -> seen.add("first " + e.key()));
		router.syncObject("/second/", other, e -> seen.add("second " + e.key()));
		kvs.set("/second/b", "2");
		kvs.set("/first/b", "1");
		router.next(TIMEOUT);
		router.next(TIMEOUT);
		assertEquals(List.of("second /second/b", "first /first/b"), seen);
		assertEquals("1", current().b());
		try (var scope = other.lock()) {
			assertEquals("2", other.get().b());
		}
	}

	@Test
	void malformedValue_isSkippedWhenNotIgnored() throws Exception {
		ChangeRouterSettings settings = ChangeRouterSettings.builder()
			.ignoreUnmarshalFailure(false)
			.build();
		ChangeRouter strict = new ChangeRouter(kvs, new KvsMapper(), settings);
		strict.syncObject("/o/", handle, e -> lastEvent = e);
		kvs.set("/o/S/a", "5");
		kvs.set("/o/S/a", "five");
		strict.next(TIMEOUT);
		strict.next(TIMEOUT);
		assertEquals(5, lastEvent.field("s").field("a").asInt());
		assertEquals(new Inner(5), current().s());
	}

	@Test
	void malformedValue_resetsByDefault() throws Exception {
		router.syncObject("/o/", handle, e -> lastEvent = e);
		kvs.set("/o/S/a", "5");
		kvs.set("/o/S/a", "five");
		router.next(TIMEOUT);
		router.next(TIMEOUT);
		assertEquals(0, lastEvent.field("s").field("a").asInt());
	}

	@Test
	void callbackFailure_propagatesAfterApplying() throws Exception {
		IllegalStateException failure = new IllegalStateException("boom");
		router.syncObject("/o/", handle, e -> { throw failure; });
		kvs.set("/o/b", "applied");
		CallbackFailedException e = assertThrows(CallbackFailedException.class, () -> router.next(TIMEOUT));
		assertSame(failure, e.getCause());
		assertEquals("/o/b", e.key());
		assertEquals("applied", current().b());
	}

	@Test
	void callbackFailure_canBeLogged() throws Exception {
		ChangeRouterSettings settings = ChangeRouterSettings.builder()
			.callbackFailureMode(LOG)
			.build();
		ChangeRouter lenient = new ChangeRouter(kvs, new KvsMapper(), settings);
		lenient.syncObject("/o/", handle, e -> { throw new IllegalStateException("Expected failure, logged by the test"); });
		kvs.set("/o/b", "applied");
		lenient.next(TIMEOUT);
		assertEquals("applied", current().b());
	}

	@Test
	void callback_runsOutsideTheLockWithDiagnosticContext() throws Exception {
		ReentrantLock lock = new ReentrantLock();
		RootHandle<Outer> locked = RootHandle.of(new Outer(new Inner(0), "", null), lock);
		List<String> observed = new ArrayList<>();
		router.syncObject("/o/", locked, e -> {
			observed.add(String.valueOf(lock.isHeldByCurrentThread()));
			observed.add(MDC.get(SYNC_FORMAT));
			observed.add(MDC.get(UPDATE_KEY));
		});
		kvs.set("/o/b", "x");
		router.next(TIMEOUT);
		assertEquals(List.of("false", "/o/", "/o/b"), observed);
		assertNull(MDC.get(SYNC_FORMAT));
		assertNull(MDC.get(UPDATE_KEY));
	}

	@Test
	void callbackMayUnsyncItself() throws Exception {
		RootHandle<Outer> other = RootHandle.of(new Outer(new Inner(0), "", null));
		List<String> seen = new ArrayList<>();
		router.syncObject("/a/", handle, e -> {
			seen.add(e.key());
			router.unsyncObject("/a/");
		});
		router.syncObject("/b/", other, e -> seen.add(e.key()));

		kvs.set("/a/b", "first");
		router.next(TIMEOUT);
		assertEquals(1, router.registrations().size());

		kvs.set("/a/b", "second");
		kvs.set("/b/b", "third");
		router.next(TIMEOUT);
		router.next(TIMEOUT);
		assertEquals(List.of("/a/b", "/b/b"), seen);
		assertEquals("first", current().b());
		try (var scope = other.lock()) {
			assertEquals("third", other.get().b());
		}
	}

	@Test
	void callbackMaySyncAnotherObject() throws Exception {
		RootHandle<Outer> other = RootHandle.of(new Outer(new Inner(0), "", null));
		router.syncObject("/a/", handle, e -> router.syncObject("/b/", other, ev -> lastEvent = ev));
		kvs.set("/a/b", "x");
		kvs.set("/b/b", "y");
		router.next(TIMEOUT);
		router.next(TIMEOUT);
		assertEquals("/b/b", lastEvent.key());
	}

	@Test
	void nullBlobRoot_isReset() throws Exception {
		RootHandle<Inner> blob = RootHandle.of(new Inner(3));
		router.syncObject("/blob", blob, e -> lastEvent = e);
		kvs.set("/blob", "{\"a\":4}");
		router.next(TIMEOUT);
		try (var scope = blob.lock()) {
			assertEquals(new Inner(4), blob.get());
		}
		kvs.set("/blob", "null");
		router.next(TIMEOUT);
		try (var scope = blob.lock()) {
			assertEquals(new Inner(0), blob.get());
		}
		assertEquals(new Inner(0), lastEvent.root());
	}

	@Test
	void misconfiguredObject_doesNotStopRouting() throws Exception {
		RootHandle<MissingKeySegment> bad = RootHandle.of(new MissingKeySegment(null));
		router.syncObject("/bad/", bad, e -> { });
		router.syncObject("/o/", handle, e -> lastEvent = e);

		kvs.set("/bad/m/x", "1");
		CallbackFailedException e = assertThrows(CallbackFailedException.class, () -> router.next(TIMEOUT));
		assertInstanceOf(FormatMisconfigurationException.class, e.getCause());

		kvs.set("/o/b", "still routed");
		router.next(TIMEOUT);
		assertEquals("still routed", current().b());
	}

	@Test
	void misconfiguredObject_canBeLogged() throws Exception {
		ChangeRouterSettings settings = ChangeRouterSettings.builder()
			.callbackFailureMode(LOG)
			.build();
		ChangeRouter lenient = new ChangeRouter(kvs, new KvsMapper(), settings);
		lenient.syncObject("/bad/", RootHandle.of(new MissingKeySegment(null)), e -> { });
		kvs.set("/bad/m/x", "1");
		lenient.next(TIMEOUT);
	}

	@Test
	void nodeRoot_isUpdatedInPlace() throws Exception {
		Settings settings = new Settings();
		RootHandle<Settings> settingsHandle = RootHandle.of(settings);
		router.syncObject("/settings/", settingsHandle, e -> lastEvent = e);
		kvs.set("/settings/name", "main");
		kvs.set("/settings/size", "12");
		router.next(TIMEOUT);
		router.next(TIMEOUT);
		assertEquals(12, lastEvent.field("size").asInt());
		assertInstanceOf(Settings.class, lastEvent.root());
		try (var scope = settingsHandle.lock()) {
			assertSame(settings, settingsHandle.get());
			assertEquals("main", settings.name);
			assertEquals(12, settings.size);
		}
	}
}

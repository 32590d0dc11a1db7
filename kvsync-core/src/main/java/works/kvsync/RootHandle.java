package works.kvsync;

import java.util.concurrent.locks.Lock;
import java.util.concurrent.locks.ReentrantLock;

import static java.util.Objects.requireNonNull;

/**
 * Holds a root object that several threads share, along with the lock that guards it.
 *
 * <p>
 * Everyone who reads or modifies the object, including the
 * {@link works.kvsync.sync.ChangeRouter} and {@link works.kvsync.store.ObjectStore},
 * does so inside {@link #lock()}. Because modifying a record root produces a new
 * root, the current root must be fetched with {@link #get()} each time the lock is taken.
 *
 * <pre>
 * try (var scope = handle.lock()) {
 *     handle.set(mapper.setByFields(handle.get(), format, value, "name").root());
 * }
 * </pre>
 */
public final class RootHandle<T> {
	private final Lock lock;
	private T root;

	private RootHandle(T root, Lock lock) {
		this.root = requireNonNull(root);
		this.lock = requireNonNull(lock);
	}

	public static <T> RootHandle<T> of(T root) {
		return new RootHandle<>(root, new ReentrantLock());
	}

	/**
	 * @param lock the lock that other code already uses to guard {@code root}
	 */
	public static <T> RootHandle<T> of(T root, Lock lock) {
		return new RootHandle<>(root, lock);
	}

	public interface Scope extends AutoCloseable {
		@Override
		void close();
	}

	public Scope lock() {
		lock.lock();
		return lock::unlock;
	}

	public T get() {
		checkHeld();
		return root;
	}

	public void set(T newRoot) {
		checkHeld();
		this.root = requireNonNull(newRoot);
	}

	/**
	 * Same as {@link #set} for a root of unknown static type.
	 *
	 * @throws ClassCastException if {@code newRoot} is not of the same class as the current root
	 */
	@SuppressWarnings("unchecked")
	public void replace(Object newRoot) {
		checkHeld();
		if (newRoot.getClass() != root.getClass()) {
			throw new ClassCastException("Can't replace " + root.getClass().getName() + " root with " + newRoot.getClass().getName());
		}
		this.root = (T) newRoot;
	}

	private void checkHeld() {
		if (lock instanceof ReentrantLock r && !r.isHeldByCurrentThread()) {
			throw new IllegalStateException("Root must be accessed inside lock()");
		}
	}

	@Override
	public String toString() {
		return "RootHandle(" + root.getClass().getSimpleName() + ")";
	}
}

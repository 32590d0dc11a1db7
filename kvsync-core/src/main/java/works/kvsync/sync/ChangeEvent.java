package works.kvsync.sync;

import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.function.Consumer;
import java.util.function.IntConsumer;
import org.jetbrains.annotations.Nullable;
import org.pcollections.PVector;
import org.pcollections.TreePVector;
import works.kvsync.Selector;
import works.kvsync.exceptions.EventNavigationException;
import works.kvsync.types.DescriptorTable;
import works.kvsync.types.FieldDescriptor;
import works.kvsync.types.StructDescriptor;

import static works.kvsync.sync.ChangeEvent.Failure.IS_DELETED;
import static works.kvsync.sync.ChangeEvent.Failure.NIL_POINTER;
import static works.kvsync.sync.ChangeEvent.Failure.NOT_AN_INT;
import static works.kvsync.sync.ChangeEvent.Failure.NOT_A_BOOL;
import static works.kvsync.sync.ChangeEvent.Failure.NOT_A_MAP;
import static works.kvsync.sync.ChangeEvent.Failure.NOT_A_STRING;
import static works.kvsync.sync.ChangeEvent.Failure.NOT_A_STRUCT;
import static works.kvsync.sync.ChangeEvent.Failure.NOT_IMPLEMENTED;
import static works.kvsync.sync.ChangeEvent.Failure.NOT_THIS_PATH;
import static works.kvsync.sync.ChangeEvent.Failure.NO_MORE_FIELDS;
import static works.kvsync.sync.ChangeEvent.Failure.WRONG_KEY_TYPE;

/**
 * Says which part of a synced object a change touched.
 *
 * <p>
 * Navigate down the changed path with {@link #field} and {@link #mapValue},
 * then read the new value. Each step returns a new event. A step that doesn't
 * match the path fails, and every later step on the failed event fails the same way,
 * so callbacks can try the shapes they care about one after another:
 *
 * <pre>
 * if (event.field("name").ok()) {
 *     rename(event.field("name").asString());
 * } else {
 *     ChangeEvent item = event.field("items").mapValue(String.class, id -&gt; itemId = id);
 *     if (item.isDeleted()) ...
 * }
 * </pre>
 *
 * Events are immutable, but the objects they expose belong to the synced root;
 * callbacks should not retain them beyond the call.
 */
public final class ChangeEvent {
	private final DescriptorTable table;
	private final String key;
	private final Object root;
	private final @Nullable Object current;
	private final boolean present;
	private final PVector<Selector> fields;
	private final @Nullable Failure failure;

	public enum Failure {
		NO_MORE_FIELDS("No more fields to consume"),
		NOT_A_STRUCT("Object is not a struct"),
		NOT_A_MAP("Object is not a map"),
		NOT_A_STRING("Object is not a string"),
		NOT_AN_INT("Object is not an integer"),
		NOT_A_BOOL("Object is not a boolean"),
		WRONG_KEY_TYPE("Map key is not of the requested type"),
		NOT_THIS_PATH("The changed object is not on this path"),
		NOT_IMPLEMENTED("Not implemented"),
		NIL_POINTER("Reached a missing optional value"),
		IS_DELETED("Object has been deleted");

		private final String description;

		Failure(String description) {
			this.description = description;
		}

		public String description() {
			return description;
		}
	}

	private ChangeEvent(DescriptorTable table, String key, Object root, @Nullable Object current, boolean present, PVector<Selector> fields, @Nullable Failure failure) {
		this.table = table;
		this.key = key;
		this.root = root;
		this.current = current;
		this.present = present;
		this.fields = fields;
		this.failure = failure;
	}

	static ChangeEvent at(DescriptorTable table, String key, Object root, List<Selector> fields) {
		return new ChangeEvent(table, key, root, root, true, TreePVector.from(fields), null);
	}

	/**
	 * @return the store key whose change produced this event
	 */
	public String key() {
		return key;
	}

	/**
	 * @return the synced object, as it was right after the change was applied
	 */
	public Object root() {
		return root;
	}

	/**
	 * @return the selectors between the current position and the changed object
	 */
	public List<Selector> remainingFields() {
		return fields;
	}

	public Optional<Failure> failure() {
		return Optional.ofNullable(failure);
	}

	public boolean ok() {
		return failure == null;
	}

	public ChangeEvent field(String name) {
		ChangeEvent here = deref();
		if (here.failure != null) {
			return here;
		} else if (here.fields.isEmpty()) {
			return here.fail(NO_MORE_FIELDS);
		} else if (!(table.describe(here.current.getClass()) instanceof StructDescriptor struct)) {
			return here.fail(NOT_A_STRUCT);
		} else if (!(here.fields.get(0) instanceof Selector.Field f) || !f.name().equals(name)) {
			return here.fail(NOT_THIS_PATH);
		} else {
			FieldDescriptor field = struct.field(name).orElseThrow();
			return here.moveTo(field.get(here.current), true);
		}
	}

	/**
	 * Steps into a map entry without asking which one.
	 */
	public ChangeEvent mapValue() {
		return mapValue(Object.class, k -> { });
	}

	/**
	 * Steps into a map entry.
	 *
	 * @param keyReceiver is given the entry's key if the step succeeds
	 */
	public <K> ChangeEvent mapValue(Class<K> keyType, Consumer<? super K> keyReceiver) {
		ChangeEvent here = deref();
		if (here.failure != null) {
			return here;
		} else if (here.fields.isEmpty()) {
			return here.fail(NO_MORE_FIELDS);
		} else if (!(here.current instanceof Map<?, ?> map)) {
			return here.fail(NOT_A_MAP);
		} else if (!(here.fields.get(0) instanceof Selector.Key k)) {
			return here.fail(NOT_THIS_PATH);
		} else if (!keyType.isInstance(k.value())) {
			return here.fail(WRONG_KEY_TYPE);
		} else {
			keyReceiver.accept(keyType.cast(k.value()));
			return here.moveTo(map.get(k.value()), map.containsKey(k.value()));
		}
	}

	/**
	 * Sequences are only stored as single values, so this always fails.
	 */
	public ChangeEvent index(IntConsumer indexReceiver) {
		if (failure != null) {
			return this;
		}
		return fail(NOT_IMPLEMENTED);
	}

	/**
	 * @return true if the path has been followed to its end,
	 * and the object there was removed by this change
	 */
	public boolean isDeleted() {
		return failure == null && !present && fields.isEmpty();
	}

	/**
	 * @return the object at the current position
	 */
	public @Nullable Object current() throws EventNavigationException {
		if (failure != null) {
			throw new EventNavigationException(failure);
		} else if (!present) {
			throw new EventNavigationException(IS_DELETED);
		}
		return current;
	}

	public String asString() throws EventNavigationException {
		if (unwrapped() instanceof String s) {
			return s;
		}
		throw new EventNavigationException(NOT_A_STRING);
	}

	/**
	 * @throws EventNavigationException with {@link Failure#NOT_AN_INT NOT_AN_INT}
	 * if the value is not an integer or doesn't fit in an {@code int}
	 */
	public int asInt() throws EventNavigationException {
		long value = asLong();
		if (value < Integer.MIN_VALUE || value > Integer.MAX_VALUE) {
			throw new EventNavigationException(NOT_AN_INT);
		}
		return (int) value;
	}

	public long asLong() throws EventNavigationException {
		Object value = unwrapped();
		if (value instanceof Integer || value instanceof Long || value instanceof Short || value instanceof Byte) {
			return ((Number) value).longValue();
		}
		throw new EventNavigationException(NOT_AN_INT);
	}

	public boolean asBool() throws EventNavigationException {
		if (unwrapped() instanceof Boolean b) {
			return b;
		}
		throw new EventNavigationException(NOT_A_BOOL);
	}

	private Object unwrapped() throws EventNavigationException {
		ChangeEvent here = deref();
		if (here.failure != null) {
			throw new EventNavigationException(here.failure);
		}
		return here.current;
	}

	/**
	 * Sees through optionals. Fails if there's nothing to see.
	 */
	private ChangeEvent deref() {
		if (failure != null) {
			return this;
		} else if (!present) {
			return fail(IS_DELETED);
		}
		Object value = current;
		while (value instanceof Optional<?> optional) {
			value = optional.orElse(null);
		}
		if (value == null) {
			return fail(NIL_POINTER);
		}
		return (value == current) ? this : moveTo(value, true, fields);
	}

	private ChangeEvent moveTo(@Nullable Object value, boolean valuePresent) {
		return moveTo(value, valuePresent, fields.minus(0));
	}

	private ChangeEvent moveTo(@Nullable Object value, boolean valuePresent, PVector<Selector> remaining) {
		return new ChangeEvent(table, key, root, value, valuePresent, remaining, null);
	}

	private ChangeEvent fail(Failure f) {
		return new ChangeEvent(table, key, root, current, present, fields, f);
	}

	@Override
	public String toString() {
		return "ChangeEvent(" + key + " " + fields + (failure == null ? "" : " " + failure) + ")";
	}
}

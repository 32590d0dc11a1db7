package works.kvsync.types;

import java.lang.reflect.Constructor;
import java.lang.reflect.InvocationTargetException;
import java.util.List;
import java.util.Optional;
import works.kvsync.exceptions.FormatMisconfigurationException;

/**
 * A record, or a class implementing {@link works.kvsync.KvsNode}.
 *
 * <p>
 * Records can't be modified, so {@link #with} builds a new one.
 * Nodes are modified in place.
 */
public final class StructDescriptor implements TypeDescriptor {
	private final Class<?> type;
	private final List<FieldDescriptor> fields;
	private final Constructor<?> constructor;

	StructDescriptor(Class<?> type, List<FieldDescriptor> fields, Constructor<?> constructor) {
		this.type = type;
		this.fields = List.copyOf(fields);
		this.constructor = constructor;
		constructor.setAccessible(true);
	}

	@Override
	public Class<?> type() {
		return type;
	}

	public boolean isRecord() {
		return type.isRecord();
	}

	/**
	 * @return the fields in declaration order
	 */
	public List<FieldDescriptor> fields() {
		return fields;
	}

	public Optional<FieldDescriptor> field(String name) {
		return fields.stream().filter(f -> f.name().equals(name)).findFirst();
	}

	/**
	 * @return {@code instance} with {@code field} set to {@code value}.
	 * For records this is a new object.
	 */
	public Object with(Object instance, FieldDescriptor field, Object value) {
		if (isRecord()) {
			Object[] args = new Object[fields.size()];
			for (FieldDescriptor f : fields) {
				args[f.index()] = f.get(instance);
			}
			args[field.index()] = value;
			return instantiate(args);
		} else {
			field.set(instance, value);
			return instance;
		}
	}

	/**
	 * @param args the record components in order; empty for nodes
	 */
	Object instantiate(Object... args) {
		try {
			return constructor.newInstance(args);
		} catch (InvocationTargetException e) {
			throw new FormatMisconfigurationException("Constructor of " + type.getSimpleName() + " threw", e.getCause());
		} catch (InstantiationException | IllegalAccessException e) {
			throw new FormatMisconfigurationException("Unable to instantiate " + type.getSimpleName(), e);
		}
	}

	@Override
	public String toString() {
		return "StructDescriptor(" + type.getSimpleName() + fields + ")";
	}
}

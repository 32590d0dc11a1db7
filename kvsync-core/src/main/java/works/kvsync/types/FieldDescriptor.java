package works.kvsync.types;

import java.lang.reflect.Field;
import java.lang.reflect.InvocationTargetException;
import java.lang.reflect.Method;
import java.lang.reflect.Type;
import org.jetbrains.annotations.Nullable;
import works.kvsync.Format;

/**
 * One field of a struct: a record component or a field of a {@link works.kvsync.KvsNode}.
 */
public final class FieldDescriptor {
	private final String name;
	private final Format format;
	private final Type type;
	private final int index;
	private final @Nullable Method accessor;
	private final @Nullable Field field;

	private FieldDescriptor(String name, Format format, Type type, int index, @Nullable Method accessor, @Nullable Field field) {
		this.name = name;
		this.format = format;
		this.type = type;
		this.index = index;
		this.accessor = accessor;
		this.field = field;
	}

	static FieldDescriptor forComponent(String name, Format format, Type type, int index, Method accessor) {
		accessor.setAccessible(true);
		return new FieldDescriptor(name, format, type, index, accessor, null);
	}

	static FieldDescriptor forField(Format format, int index, Field field) {
		field.setAccessible(true);
		return new FieldDescriptor(field.getName(), format, field.getGenericType(), index, null, field);
	}

	public String name() {
		return name;
	}

	public Format format() {
		return format;
	}

	public Type type() {
		return type;
	}

	/**
	 * @return the position of this field in declaration order
	 */
	public int index() {
		return index;
	}

	public Object get(Object instance) {
		try {
			if (accessor != null) {
				return accessor.invoke(instance);
			} else {
				return field.get(instance);
			}
		} catch (InvocationTargetException e) {
			throw new IllegalStateException("Accessor for " + name + " threw", e.getCause());
		} catch (IllegalAccessException e) {
			throw new IllegalStateException("Unable to read " + name, e);
		}
	}

	void set(Object instance, Object value) {
		if (field == null) {
			throw new IllegalStateException("Record component " + name + " can't be set in place");
		}
		try {
			field.set(instance, value);
		} catch (IllegalAccessException e) {
			throw new IllegalStateException("Unable to write " + name, e);
		}
	}

	@Override
	public String toString() {
		return name + ":" + format;
	}
}

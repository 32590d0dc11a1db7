package works.kvsync.types;

import java.lang.reflect.Type;

/**
 * What the walker needs to know about a type to traverse and modify its values.
 * Obtained from a {@link DescriptorTable}.
 */
public sealed interface TypeDescriptor permits StructDescriptor, MapDescriptor, OptionalDescriptor, SequenceDescriptor, ScalarDescriptor {
	Type type();

	default Class<?> rawClass() {
		return TypeUtils.rawClass(type());
	}

	/**
	 * @return true if {@code value} can be stored in a slot of this type
	 */
	default boolean accepts(Object value) {
		Class<?> raw = rawClass();
		if (raw.isPrimitive()) {
			return value != null && boxed(raw).isInstance(value);
		}
		return value == null || raw.isInstance(value);
	}

	static Class<?> boxed(Class<?> primitive) {
		if (primitive == int.class) return Integer.class;
		if (primitive == long.class) return Long.class;
		if (primitive == boolean.class) return Boolean.class;
		if (primitive == double.class) return Double.class;
		if (primitive == float.class) return Float.class;
		if (primitive == short.class) return Short.class;
		if (primitive == byte.class) return Byte.class;
		if (primitive == char.class) return Character.class;
		return primitive;
	}
}

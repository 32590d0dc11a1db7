package works.kvsync.types;

import java.lang.reflect.Constructor;
import java.lang.reflect.Field;
import java.lang.reflect.RecordComponent;
import java.lang.reflect.Type;
import java.util.ArrayList;
import java.util.Collection;
import java.util.HashSet;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;
import org.jetbrains.annotations.Nullable;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import works.kvsync.Format;
import works.kvsync.KvsNode;
import works.kvsync.annotations.KeyFormat;
import works.kvsync.exceptions.FormatMisconfigurationException;
import works.kvsync.util.ReflectionHelpers;

import static java.lang.reflect.Modifier.isAbstract;
import static java.lang.reflect.Modifier.isStatic;
import static java.lang.reflect.Modifier.isTransient;
import static works.kvsync.types.TypeUtils.parameterType;
import static works.kvsync.types.TypeUtils.rawClass;

/**
 * Builds and caches a {@link TypeDescriptor} for each type it is asked about.
 * Thread-safe.
 */
public final class DescriptorTable {
	private final Map<Type, TypeDescriptor> memo = new ConcurrentHashMap<>();

	public TypeDescriptor describe(Type type) {
		TypeDescriptor existing = memo.get(type);
		if (existing != null) {
			return existing;
		}
		TypeDescriptor result = compute(type);
		TypeDescriptor raced = memo.putIfAbsent(type, result);
		return raced == null ? result : raced;
	}

	/**
	 * The value a slot of the given type holds before anything is stored in it:
	 * zero, false, the empty string, an empty {@link Optional},
	 * a struct whose fields are all zero, or null for everything else.
	 */
	public @Nullable Object zero(Type type) {
		return zero(type, new HashSet<>());
	}

	private @Nullable Object zero(Type type, Set<Type> inProgress) {
		Class<?> raw = rawClass(type);
		Object scalar = scalarZero(raw);
		if (scalar != null || raw.isPrimitive()) {
			return scalar;
		}
		TypeDescriptor descriptor = describe(type);
		if (descriptor instanceof OptionalDescriptor) {
			return Optional.empty();
		} else if (descriptor instanceof StructDescriptor struct) {
			if (!inProgress.add(type)) {
				LOGGER.trace("Type {} contains itself; its zero value is null", type);
				return null;
			}
			try {
				if (struct.isRecord()) {
					Object[] args = new Object[struct.fields().size()];
					for (FieldDescriptor f : struct.fields()) {
						args[f.index()] = zero(f.type(), inProgress);
					}
					return struct.instantiate(args);
				} else {
					return struct.instantiate();
				}
			} finally {
				inProgress.remove(type);
			}
		} else {
			return null;
		}
	}

	private static @Nullable Object scalarZero(Class<?> raw) {
		if (raw == String.class) return "";
		if (raw == int.class || raw == Integer.class) return 0;
		if (raw == long.class || raw == Long.class) return 0L;
		if (raw == boolean.class || raw == Boolean.class) return false;
		if (raw == double.class || raw == Double.class) return 0.0;
		if (raw == float.class || raw == Float.class) return 0.0f;
		if (raw == short.class || raw == Short.class) return (short) 0;
		if (raw == byte.class || raw == Byte.class) return (byte) 0;
		if (raw == char.class || raw == Character.class) return '\0';
		return null;
	}

	private TypeDescriptor compute(Type type) {
		Class<?> raw = rawClass(type);
		TypeDescriptor result;
		if (raw == Optional.class) {
			result = new OptionalDescriptor(type, parameterType(type, Optional.class, 0));
		} else if (Map.class.isAssignableFrom(raw)) {
			result = new MapDescriptor(type, parameterType(type, Map.class, 0), parameterType(type, Map.class, 1));
		} else if (raw.isArray() || Collection.class.isAssignableFrom(raw)) {
			result = new SequenceDescriptor(type);
		} else if (raw.isRecord()) {
			result = recordDescriptor(raw);
		} else if (KvsNode.class.isAssignableFrom(raw)) {
			result = nodeDescriptor(raw);
		} else {
			result = new ScalarDescriptor(type);
		}
		LOGGER.debug("Described {} as {}", type, result);
		return result;
	}

	private static StructDescriptor recordDescriptor(Class<?> raw) {
		RecordComponent[] components = raw.getRecordComponents();
		List<FieldDescriptor> fields = new ArrayList<>(components.length);
		Class<?>[] parameterTypes = new Class<?>[components.length];
		for (int i = 0; i < components.length; i++) {
			RecordComponent c = components[i];
			Format format = Format.forField(raw, c.getName(), c.getAnnotation(KeyFormat.class));
			fields.add(FieldDescriptor.forComponent(c.getName(), format, c.getGenericType(), i, c.getAccessor()));
			parameterTypes[i] = c.getType();
		}
		Constructor<?> constructor;
		try {
			constructor = raw.getDeclaredConstructor(parameterTypes);
		} catch (NoSuchMethodException e) {
			throw new FormatMisconfigurationException("Record " + raw.getSimpleName() + " has no canonical constructor", e);
		}
		return new StructDescriptor(raw, fields, constructor);
	}

	private static StructDescriptor nodeDescriptor(Class<?> raw) {
		if (raw.isInterface() || isAbstract(raw.getModifiers())) {
			throw new FormatMisconfigurationException(raw.getSimpleName() + " must be a concrete class");
		}
		List<FieldDescriptor> fields = new ArrayList<>();
		for (Field f : ReflectionHelpers.getDeclaredFieldsInOrder(raw)) {
			int modifiers = f.getModifiers();
			if (isStatic(modifiers) || isTransient(modifiers) || f.isSynthetic()) {
				continue;
			}
			Format format = Format.forField(raw, f.getName(), f.getAnnotation(KeyFormat.class));
			fields.add(FieldDescriptor.forField(format, fields.size(), f));
		}
		Constructor<?> constructor;
		try {
			constructor = raw.getDeclaredConstructor();
		} catch (NoSuchMethodException e) {
			throw new FormatMisconfigurationException(raw.getSimpleName() + " needs a no-argument constructor", e);
		}
		return new StructDescriptor(raw, fields, constructor);
	}

	private static final Logger LOGGER = LoggerFactory.getLogger(DescriptorTable.class);
}

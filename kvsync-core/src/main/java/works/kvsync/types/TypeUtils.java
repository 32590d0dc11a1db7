package works.kvsync.types;

import java.lang.reflect.GenericArrayType;
import java.lang.reflect.ParameterizedType;
import java.lang.reflect.Type;
import java.lang.reflect.TypeVariable;
import java.lang.reflect.WildcardType;
import java.util.HashMap;
import java.util.Map;

public final class TypeUtils {
	private TypeUtils() { }

	public static Class<?> rawClass(Type type) {
		if (type instanceof Class<?> c) {
			return c;
		} else if (type instanceof ParameterizedType p) {
			return (Class<?>) p.getRawType();
		} else if (type instanceof GenericArrayType) {
			return Object[].class;
		} else if (type instanceof WildcardType w) {
			return rawClass(w.getUpperBounds()[0]);
		} else if (type instanceof TypeVariable<?> v) {
			return rawClass(v.getBounds()[0]);
		} else {
			throw new IllegalArgumentException("Unexpected type: " + type);
		}
	}

	/**
	 * Resolves a type argument of {@code generic} as seen from {@code type},
	 * following superclasses and interfaces as needed.
	 * For example, the second parameter of {@code Map} as seen from
	 * {@code HashMap<String, Integer>} is {@code Integer}.
	 *
	 * @return the argument, or {@code Object} if it is not known statically
	 */
	public static Type parameterType(Type type, Class<?> generic, int index) {
		Type result = resolve(type, generic, new HashMap<>());
		if (result instanceof ParameterizedType p) {
			Type arg = p.getActualTypeArguments()[index];
			if (arg instanceof WildcardType w) {
				return w.getUpperBounds()[0];
			} else if (arg instanceof TypeVariable<?>) {
				return Object.class;
			} else {
				return arg;
			}
		}
		return Object.class;
	}

	private static Type resolve(Type type, Class<?> generic, Map<TypeVariable<?>, Type> bindings) {
		Class<?> raw = rawClass(type);
		if (!generic.isAssignableFrom(raw)) {
			return null;
		}
		Map<TypeVariable<?>, Type> here = new HashMap<>();
		if (type instanceof ParameterizedType p) {
			TypeVariable<?>[] vars = raw.getTypeParameters();
			Type[] args = p.getActualTypeArguments();
			for (int i = 0; i < vars.length; i++) {
				here.put(vars[i], substitute(args[i], bindings));
			}
		}
		if (raw == generic) {
			if (here.isEmpty()) {
				return raw;
			}
			Type[] args = new Type[raw.getTypeParameters().length];
			for (int i = 0; i < args.length; i++) {
				args[i] = here.get(raw.getTypeParameters()[i]);
			}
			return new ResolvedType(raw, args);
		}
		for (Type iface : raw.getGenericInterfaces()) {
			Type found = resolve(iface, generic, here);
			if (found != null) {
				return found;
			}
		}
		Type superclass = raw.getGenericSuperclass();
		return superclass == null ? null : resolve(superclass, generic, here);
	}

	private static Type substitute(Type arg, Map<TypeVariable<?>, Type> bindings) {
		if (arg instanceof TypeVariable<?> v) {
			return bindings.getOrDefault(v, v);
		}
		return arg;
	}

	private record ResolvedType(Class<?> rawType, Type[] actualTypeArguments) implements ParameterizedType {
		@Override
		public Type[] getActualTypeArguments() {
			return actualTypeArguments.clone();
		}

		@Override
		public Type getRawType() {
			return rawType;
		}

		@Override
		public Type getOwnerType() {
			return null;
		}
	}
}

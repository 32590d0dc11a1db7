package works.kvsync.types;

import java.lang.reflect.Type;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.NavigableMap;
import java.util.SortedMap;
import java.util.TreeMap;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ConcurrentMap;
import works.kvsync.exceptions.FormatMisconfigurationException;

import static java.lang.reflect.Modifier.isAbstract;

public record MapDescriptor(Type type, Type keyType, Type valueType) implements TypeDescriptor {

	/**
	 * @return an empty mutable map that can be stored in a slot of this type
	 */
	public Map<Object, Object> newInstance() {
		Class<?> raw = rawClass();
		if (raw.isInterface() || isAbstract(raw.getModifiers())) {
			if (raw.isAssignableFrom(LinkedHashMap.class)) {
				return new LinkedHashMap<>();
			} else if (raw == SortedMap.class || raw == NavigableMap.class) {
				return new TreeMap<>();
			} else if (raw == ConcurrentMap.class) {
				return new ConcurrentHashMap<>();
			} else {
				throw new FormatMisconfigurationException("Don't know how to create a " + raw.getName());
			}
		}
		try {
			@SuppressWarnings("unchecked")
			Map<Object, Object> result = (Map<Object, Object>) raw.getDeclaredConstructor().newInstance();
			return result;
		} catch (ReflectiveOperationException e) {
			throw new FormatMisconfigurationException("Unable to create a " + raw.getName(), e);
		}
	}

	/**
	 * Stores an entry, copying the map first if it can't be modified.
	 *
	 * @return the map holding the new entry, which the caller must store
	 * in place of {@code map} if it differs
	 */
	public Map<Object, Object> put(Map<Object, Object> map, Object key, Object value) {
		try {
			map.put(key, value);
			return map;
		} catch (UnsupportedOperationException e) {
			Map<Object, Object> copy = copyOf(map);
			copy.put(key, value);
			return copy;
		}
	}

	/**
	 * @return the map without {@code key}, which the caller must store
	 * in place of {@code map} if it differs
	 */
	public Map<Object, Object> remove(Map<Object, Object> map, Object key) {
		try {
			map.remove(key);
			return map;
		} catch (UnsupportedOperationException e) {
			Map<Object, Object> copy = copyOf(map);
			copy.remove(key);
			return copy;
		}
	}

	private Map<Object, Object> copyOf(Map<Object, Object> map) {
		Map<Object, Object> copy = newInstance();
		copy.putAll(map);
		return copy;
	}
}

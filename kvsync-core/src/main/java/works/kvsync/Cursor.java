package works.kvsync;

import java.util.ArrayList;
import java.util.List;
import org.jetbrains.annotations.Nullable;
import org.pcollections.PVector;
import org.pcollections.TreePVector;
import works.kvsync.types.TypeDescriptor;

/**
 * Where a walk currently is.
 *
 * @param value the object here; null if it doesn't exist, or if the slot holds null
 * @param present false if there is no such object, like a missing map entry.
 *                The walk carries on by type alone so errors are reported at the right depth.
 * @param keyPath the store key components consumed so far
 * @param fields the selectors that lead here from the root
 * @param format what remains of the current object's format
 */
record Cursor(
	@Nullable Object value,
	boolean present,
	TypeDescriptor descriptor,
	PVector<String> keyPath,
	PVector<Selector> fields,
	Format format
) {
	static Cursor root(Object root, TypeDescriptor descriptor, Format format) {
		return new Cursor(root, true, descriptor, TreePVector.empty(), TreePVector.empty(), format);
	}

	Cursor withValue(@Nullable Object newValue) {
		return new Cursor(newValue, present, descriptor, keyPath, fields, format);
	}

	Cursor withFormat(Format newFormat) {
		return new Cursor(value, present, descriptor, keyPath, fields, newFormat);
	}

	Cursor plusKey(String segment) {
		return new Cursor(value, present, descriptor, keyPath.plus(segment), fields, format);
	}

	/**
	 * @return a cursor for something inside this one
	 */
	Cursor child(@Nullable Object childValue, boolean childPresent, TypeDescriptor childDescriptor, Selector selector, Format childFormat) {
		return new Cursor(childValue, childPresent, childDescriptor, keyPath, fields.plus(selector), childFormat);
	}

	/**
	 * @return the store key of this object, followed by whatever remains of its format
	 */
	String key() {
		List<String> parts = new ArrayList<>(keyPath);
		for (Format.Segment segment : format.segments()) {
			parts.add(segment.toString());
		}
		return String.join("/", parts);
	}

	/**
	 * @return the store key of this object, with a trailing slash if
	 * it is stored under several keys rather than as one value
	 */
	String deletionKey() {
		String key = String.join("/", keyPath);
		return format.isEmpty() ? key : key + "/";
	}

	@Override
	public String toString() {
		return "Cursor(" + key() + " " + fields + (present ? "" : " absent") + ")";
	}
}

package works.kvsync;

import java.util.List;
import org.jetbrains.annotations.Nullable;

/**
 * Result of a {@link KvsMapper} lookup or modification.
 *
 * @param root the root object after the operation. For record roots that were
 *             modified, this is a new object; otherwise it is the one passed in.
 * @param value the object found, set, or removed
 * @param key the store key of that object. Where the object is stored under
 *            several keys, this is followed by the rest of its format,
 *            or just by a slash after a deletion.
 * @param fields the selectors leading from the root to that object
 */
public record Location(
	Object root,
	@Nullable Object value,
	String key,
	List<Selector> fields
) {
	public Location {
		fields = List.copyOf(fields);
	}
}

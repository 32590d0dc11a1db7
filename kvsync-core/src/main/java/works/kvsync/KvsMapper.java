package works.kvsync;

import java.lang.reflect.Type;
import java.util.Arrays;
import java.util.Map;
import org.pcollections.PVector;
import org.pcollections.TreePVector;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import works.kvsync.WalkOptions.Assign;
import works.kvsync.WalkOptions.Decode;
import works.kvsync.WalkOptions.RemoveEntry;
import works.kvsync.codec.ValueCodec;
import works.kvsync.exceptions.KvsPathException;
import works.kvsync.types.DescriptorTable;
import works.kvsync.types.TypeDescriptor;

import static java.util.Objects.requireNonNull;
import static works.kvsync.exceptions.KvsPathException.Reason.KEY_NOT_FOUND;
import static works.kvsync.exceptions.KvsPathException.Reason.NOT_MAP_INDEX;
import static works.kvsync.exceptions.KvsPathException.Reason.OBJECT_NOT_FOUND;

/**
 * Maps objects to and from a flat key space according to a {@link Format}.
 *
 * <p>
 * Records, and classes implementing {@link KvsNode}, are stored field by field
 * when their format ends with a slash. Maps are stored entry by entry under a
 * {@code {key}} segment. Anything else, or anything whose format doesn't
 * end with a slash, is stored as a single value by the {@link ValueCodec}.
 *
 * <p>
 * Selectors passed to these methods are {@link Selector}s, or raw objects taken
 * as field names at structs and as keys at maps.
 *
 * <p>
 * Modifying operations update node objects and mutable maps in place.
 * Records and unmodifiable maps are copied, so callers must use the returned
 * {@link Location#root() root}.
 *
 * <p>
 * Thread-safe, though the objects passed in are not protected;
 * see {@link RootHandle}.
 */
public final class KvsMapper {
	private final DescriptorTable table;
	private final ValueCodec codec;

	public KvsMapper() {
		this(new DescriptorTable(), new ValueCodec());
	}

	public KvsMapper(DescriptorTable table, ValueCodec codec) {
		this.table = requireNonNull(table);
		this.codec = requireNonNull(codec);
	}

	public DescriptorTable descriptorTable() {
		return table;
	}

	public ValueCodec codec() {
		return codec;
	}

	/**
	 * @param selectors picks the sub-object to encode; none means the whole object
	 * @return every key/value pair the selected object occupies
	 * @throws KvsPathException with {@link KvsPathException.Reason#OBJECT_NOT_FOUND OBJECT_NOT_FOUND}
	 * if the selected object doesn't exist
	 */
	public Map<String, String> encode(Object root, String format, Object... selectors) throws KvsPathException {
		Located located = fieldWalk(WalkOptions.LOOKUP).walk(start(root, format), selectors);
		if (!located.target().present()) {
			throw new KvsPathException(OBJECT_NOT_FOUND, "Nothing to encode at " + located.target());
		}
		Map<String, String> result = new Encoder(table, codec).encode(located.target());
		LOGGER.trace("Encoded {} keys from {}", result.size(), located.target());
		return result;
	}

	public Location findByFields(Object root, String format, Object... selectors) throws KvsPathException {
		Located located = fieldWalk(WalkOptions.LOOKUP).walk(start(root, format), selectors);
		return found(root, located);
	}

	/**
	 * @param keyPath a store key, which may or may not start with a slash
	 *                regardless of whether {@code format} does
	 */
	public Location findByKey(Object root, String format, String keyPath) throws KvsPathException {
		Format parsed = Format.parse(format);
		Located located = keyWalk(WalkOptions.LOOKUP).walk(Cursor.root(root, describe(root), parsed), split(parsed, keyPath));
		return found(root, located);
	}

	/**
	 * Stores {@code value}, as read from the store under {@code keyPath},
	 * creating any missing objects along the way.
	 * A value that doesn't decode resets the target to its zero value.
	 *
	 * @return where the value went; its {@link Location#fields() fields} say which part of the object changed
	 */
	public Location updateByKey(Object root, String format, String keyPath, String value) throws KvsPathException {
		return updateByKey(root, format, keyPath, value, true);
	}

	public Location updateByKey(Object root, String format, String keyPath, String value, boolean ignoreUnmarshalFailure) throws KvsPathException {
		Format parsed = Format.parse(format);
		WalkOptions options = new WalkOptions(true, new Decode(value, ignoreUnmarshalFailure), false);
		Located located = keyWalk(options).walk(Cursor.root(root, describe(root), parsed), split(parsed, keyPath));
		return modified(root, located);
	}

	/**
	 * Removes the map entry that {@code keyPath} names, or lies within.
	 *
	 * @throws KvsPathException with {@link KvsPathException.Reason#OBJECT_NOT_FOUND OBJECT_NOT_FOUND}
	 * if the key names a map entry that doesn't exist,
	 * or {@link KvsPathException.Reason#NOT_MAP_INDEX NOT_MAP_INDEX} if it names something other than a map entry
	 */
	public Location deleteByKey(Object root, String format, String keyPath) throws KvsPathException {
		Format parsed = Format.parse(format);
		WalkOptions options = new WalkOptions(false, null, true);
		Located located = keyWalk(options).walk(Cursor.root(root, describe(root), parsed), split(parsed, keyPath));
		return deleteByFields(root, format, located.target().fields().toArray());
	}

	/**
	 * Stores {@code value} at the object the selectors name, creating any missing objects along the way.
	 */
	public Location setByFields(Object root, String format, Object value, Object... selectors) throws KvsPathException {
		WalkOptions options = new WalkOptions(true, new Assign(value), false);
		Located located = fieldWalk(options).walk(start(root, format), selectors);
		return modified(root, located);
	}

	/**
	 * Removes a map entry. The last selector is the key; the others must lead to the map.
	 *
	 * @return the removed entry; its {@link Location#key() key} ends with a slash
	 * if the entry occupied several keys
	 */
	public Location deleteByFields(Object root, String format, Object... selectors) throws KvsPathException {
		if (selectors.length < 1) {
			throw new KvsPathException(NOT_MAP_INDEX, "Deleting needs at least a map key");
		}
		Object last = selectors[selectors.length - 1];
		WalkOptions options = new WalkOptions(false, new RemoveEntry(last), false);
		Located located = fieldWalk(options).walk(start(root, format), Arrays.copyOf(selectors, selectors.length - 1));
		Cursor removed = located.target();
		Object newRoot = located.changed() ? located.replacement() : root;
		LOGGER.debug("Removed {}", removed);
		return new Location(newRoot, removed.value(), removed.deletionKey(), removed.fields());
	}

	private Cursor start(Object root, String format) {
		return Cursor.root(root, describe(root), Format.parse(format));
	}

	private TypeDescriptor describe(Object root) {
		Type type = requireNonNull(root, "root").getClass();
		return table.describe(type);
	}

	/**
	 * Splits a key, adding or removing a leading empty segment
	 * so it lines up with {@code format}.
	 */
	private static PVector<String> split(Format format, String keyPath) {
		PVector<String> segments = TreePVector.from(Arrays.asList(keyPath.split("/", -1)));
		boolean formatRooted = format.startsWith(new Format.Literal(""));
		boolean keyRooted = segments.size() > 1 && segments.get(0).isEmpty();
		if (formatRooted && !keyRooted) {
			return segments.plus(0, "");
		} else if (keyRooted && !formatRooted) {
			return segments.minus(0);
		} else {
			return segments;
		}
	}

	private static Location found(Object root, Located located) throws KvsPathException {
		Cursor target = located.target();
		if (!target.present()) {
			throw new KvsPathException(KEY_NOT_FOUND, "No object at " + target);
		}
		return new Location(root, target.value(), target.key(), target.fields());
	}

	private static Location modified(Object root, Located located) {
		Cursor target = located.target();
		Object newRoot = located.changed() ? located.replacement() : root;
		return new Location(newRoot, target.value(), target.key(), target.fields());
	}

	private FieldWalk fieldWalk(WalkOptions options) {
		return new FieldWalk(table, codec, options);
	}

	private KeyWalk keyWalk(WalkOptions options) {
		return new KeyWalk(table, codec, options);
	}

	private static final Logger LOGGER = LoggerFactory.getLogger(KvsMapper.class);
}

package works.kvsync;

import java.util.Arrays;
import java.util.Map;
import org.pcollections.PVector;
import org.pcollections.TreePVector;
import works.kvsync.WalkOptions.RemoveEntry;
import works.kvsync.codec.ValueCodec;
import works.kvsync.exceptions.CodecException;
import works.kvsync.exceptions.KvsPathException;
import works.kvsync.types.DescriptorTable;
import works.kvsync.types.FieldDescriptor;
import works.kvsync.types.MapDescriptor;
import works.kvsync.types.StructDescriptor;

import static works.kvsync.exceptions.KvsPathException.Reason.KEY_WRONG_TYPE;
import static works.kvsync.exceptions.KvsPathException.Reason.MALFORMED_KEY;
import static works.kvsync.exceptions.KvsPathException.Reason.NOT_MAP_INDEX;
import static works.kvsync.exceptions.KvsPathException.Reason.OBJECT_NOT_FOUND;
import static works.kvsync.exceptions.KvsPathException.Reason.PATH_PAST_OBJECT;
import static works.kvsync.exceptions.KvsPathException.Reason.WRONG_FIELD_NAME;
import static works.kvsync.exceptions.KvsPathException.Reason.WRONG_FIELD_TYPE;

/**
 * Walks by selectors. Literal format segments are simply appended to the key,
 * which is how the key of any object can be computed from its selectors.
 *
 * <p>
 * Each selector is a {@link Selector}, or else a raw object
 * taken as a field name at a struct and as a key at a map.
 */
final class FieldWalk extends Walk<PVector<Object>> {
	FieldWalk(DescriptorTable table, ValueCodec codec, WalkOptions options) {
		super(table, codec, options);
	}

	Located walk(Cursor cursor, Object... selectors) throws KvsPathException {
		return walk(cursor, TreePVector.from(Arrays.asList(selectors)));
	}

	@Override
	Step<PVector<Object>> consumeLiterals(Cursor cursor, PVector<Object> path) {
		Format format = cursor.format();
		while (!format.isEmpty() && format.first() instanceof Format.Literal literal) {
			cursor = cursor.plusKey(literal.text());
			format = format.rest();
		}
		return new Step<>(cursor.withFormat(format), path);
	}

	@Override
	boolean hasArrived(Cursor cursor, PVector<Object> path) throws KvsPathException {
		if (path.isEmpty()) {
			return true;
		} else if (cursor.format().isEmpty()) {
			throw new KvsPathException(PATH_PAST_OBJECT, "Selectors " + path + " reach inside the value stored at " + cursor.key());
		} else {
			return false;
		}
	}

	@Override
	Located walkStruct(Cursor cursor, StructDescriptor struct, Slot slot, PVector<Object> path) throws KvsPathException {
		Object selector = path.get(0);
		String name;
		if (selector instanceof Selector.Field f) {
			name = f.name();
		} else if (selector instanceof String s) {
			name = s;
		} else {
			throw new KvsPathException(WRONG_FIELD_TYPE, "Expected a field name of " + struct.type().getSimpleName() + " but got " + selector + " at " + cursor);
		}
		FieldDescriptor field = struct.field(name).orElseThrow(() ->
			new KvsPathException(WRONG_FIELD_NAME, struct.type().getSimpleName() + " has no field \"" + name + "\" at " + cursor));
		Located result = walk(fieldCursor(cursor, slot, field), path.minus(0));
		return leaveField(cursor, struct, slot, field, result);
	}

	@Override
	Located walkMap(Cursor cursor, MapDescriptor map, Slot slot, PVector<Object> path) throws KvsPathException {
		Object key = keyFrom(cursor, map, path.get(0));
		String segment;
		try {
			segment = codec.encodeKey(key, map.keyType());
		} catch (CodecException e) {
			throw new KvsPathException(MALFORMED_KEY, "Unable to encode key " + key + " at " + cursor, e);
		}
		return walkEntry(cursor, map, slot, key, segment, path.minus(0));
	}

	private Object keyFrom(Cursor cursor, MapDescriptor map, Object selector) throws KvsPathException {
		Object key;
		if (selector instanceof Selector.Key k) {
			key = k.value();
		} else if (selector instanceof Selector.Field) {
			throw new KvsPathException(KEY_WRONG_TYPE, "Expected a map key but got field selector " + selector + " at " + cursor);
		} else {
			key = selector;
		}
		if (key == null || !table.describe(map.keyType()).accepts(key)) {
			throw new KvsPathException(KEY_WRONG_TYPE, "Key " + key + " is not a " + map.keyType().getTypeName() + " at " + cursor);
		}
		return key;
	}

	@Override
	Located arrive(Cursor cursor) throws KvsPathException {
		if (options.mutation() instanceof RemoveEntry remove) {
			return removeEntry(cursor, remove.selector());
		}
		return super.arrive(cursor);
	}

	/**
	 * The entry must exist. The returned target is the removed entry,
	 * whose key ends with a slash if anything was stored under it.
	 */
	private Located removeEntry(Cursor cursor, Object selector) throws KvsPathException {
		if (!(cursor.descriptor() instanceof MapDescriptor map)) {
			throw new KvsPathException(NOT_MAP_INDEX, "Only map entries can be deleted; got " + cursor.descriptor().type().getTypeName() + " at " + cursor);
		}
		Located entry = new FieldWalk(table, codec, WalkOptions.LOOKUP).walk(cursor, selector);
		if (!entry.target().present()) {
			throw new KvsPathException(OBJECT_NOT_FOUND, "No entry " + selector + " at " + cursor);
		}
		@SuppressWarnings("unchecked")
		Map<Object, Object> entries = (Map<Object, Object>) cursor.value();
		Object key = (selector instanceof Selector.Key k) ? k.value() : selector;
		Map<Object, Object> updated = map.remove(entries, key);
		return new Located(entry.target(), updated, updated != entries);
	}
}

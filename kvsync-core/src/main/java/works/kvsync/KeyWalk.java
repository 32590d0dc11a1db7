package works.kvsync;

import org.pcollections.PVector;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import works.kvsync.codec.ValueCodec;
import works.kvsync.exceptions.CodecException;
import works.kvsync.exceptions.KvsPathException;
import works.kvsync.types.DescriptorTable;
import works.kvsync.types.FieldDescriptor;
import works.kvsync.types.MapDescriptor;
import works.kvsync.types.StructDescriptor;

import static works.kvsync.exceptions.KvsPathException.Reason.INCOMPLETE_PATH;
import static works.kvsync.exceptions.KvsPathException.Reason.MALFORMED_KEY;
import static works.kvsync.exceptions.KvsPathException.Reason.PATH_NOT_FOUND;
import static works.kvsync.exceptions.KvsPathException.Reason.PATH_PAST_OBJECT;

/**
 * Walks by store key, split on {@code /}.
 * Literal format segments must match the key,
 * and struct fields are found by trying each field's format in turn.
 * The selectors accumulated along the way tell the caller which field the key belongs to.
 */
final class KeyWalk extends Walk<PVector<String>> {
	KeyWalk(DescriptorTable table, ValueCodec codec, WalkOptions options) {
		super(table, codec, options);
	}

	@Override
	Step<PVector<String>> consumeLiterals(Cursor cursor, PVector<String> path) throws KvsPathException {
		Format format = cursor.format();
		while (!path.isEmpty() && !format.isEmpty() && format.first() instanceof Format.Literal literal) {
			if (!literal.text().equals(path.get(0))) {
				throw new KvsPathException(PATH_NOT_FOUND, "Expected \"" + literal.text() + "\" but key has \"" + path.get(0) + "\" at " + cursor);
			}
			cursor = cursor.plusKey(path.get(0));
			path = path.minus(0);
			format = format.rest();
		}
		return new Step<>(cursor.withFormat(format), path);
	}

	@Override
	boolean hasArrived(Cursor cursor, PVector<String> path) throws KvsPathException {
		if (cursor.format().isEmpty()) {
			if (!path.isEmpty()) {
				throw new KvsPathException(PATH_PAST_OBJECT, "Key continues with " + path + " past the value stored at " + cursor.key());
			}
			return true;
		}
		if (path.isEmpty() || (path.get(0).isEmpty() && path.size() != 1)) {
			if (options.acceptPartialKey()) {
				return true;
			}
			throw new KvsPathException(INCOMPLETE_PATH, "Key ends before reaching a stored value at " + cursor.key());
		}
		return path.get(0).isEmpty();
	}

	/**
	 * The first field whose leading literals match the key wins,
	 * even if the rest of the key then fails to match it.
	 */
	@Override
	Located walkStruct(Cursor cursor, StructDescriptor struct, Slot slot, PVector<String> path) throws KvsPathException {
		for (FieldDescriptor field : struct.fields()) {
			Step<PVector<String>> step;
			try {
				step = consumeLiterals(fieldCursor(cursor, slot, field), path);
			} catch (KvsPathException e) {
				LOGGER.trace("Field {} doesn't match: {}", field, e.getMessage());
				continue;
			}
			Located result = walk(step.cursor(), step.path());
			return leaveField(cursor, struct, slot, field, result);
		}
		throw new KvsPathException(PATH_NOT_FOUND, "No field of " + struct.type().getSimpleName() + " matches " + path + " at " + cursor);
	}

	@Override
	Located walkMap(Cursor cursor, MapDescriptor map, Slot slot, PVector<String> path) throws KvsPathException {
		String segment = path.get(0);
		Object key;
		try {
			key = codec.decodeKey(segment, map.keyType());
		} catch (CodecException e) {
			throw new KvsPathException(MALFORMED_KEY, "\"" + segment + "\" is not a valid " + map.keyType().getTypeName() + " key at " + cursor, e);
		}
		return walkEntry(cursor, map, slot, key, segment, path.minus(0));
	}

	private static final Logger LOGGER = LoggerFactory.getLogger(KeyWalk.class);
}

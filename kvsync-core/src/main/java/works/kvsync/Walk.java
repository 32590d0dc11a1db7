package works.kvsync;

import java.lang.reflect.Type;
import java.util.Map;
import java.util.Optional;
import org.jetbrains.annotations.Nullable;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import works.kvsync.WalkOptions.Assign;
import works.kvsync.WalkOptions.Decode;
import works.kvsync.WalkOptions.Mutation;
import works.kvsync.WalkOptions.RemoveEntry;
import works.kvsync.codec.ValueCodec;
import works.kvsync.exceptions.CodecException;
import works.kvsync.exceptions.FormatMisconfigurationException;
import works.kvsync.exceptions.KvsPathException;
import works.kvsync.types.DescriptorTable;
import works.kvsync.types.FieldDescriptor;
import works.kvsync.types.MapDescriptor;
import works.kvsync.types.OptionalDescriptor;
import works.kvsync.types.SequenceDescriptor;
import works.kvsync.types.StructDescriptor;
import works.kvsync.types.TypeDescriptor;

import static works.kvsync.Format.Token.INDEX;
import static works.kvsync.Format.Token.KEY;
import static works.kvsync.exceptions.KvsPathException.Reason.MALFORMED_VALUE;
import static works.kvsync.exceptions.KvsPathException.Reason.NOT_IMPLEMENTED;
import static works.kvsync.exceptions.KvsPathException.Reason.SCALAR_TYPE;
import static works.kvsync.exceptions.KvsPathException.Reason.SET_NONEXISTENT;
import static works.kvsync.exceptions.KvsPathException.Reason.SET_WRONG_TYPE;

/**
 * Recursive descent from an object to one of its descendants,
 * driven either by selectors ({@link FieldWalk}) or by a store key ({@link KeyWalk}).
 *
 * <p>
 * Each level returns a {@link Located} carrying what its own slot should now hold.
 * When a descendant changes, each parent on the way back up stores the new value:
 * node fields are set in place, records are rebuilt,
 * map entries are put, and optionals are rewrapped.
 * That way a mutation reaches the root without ever holding a reference
 * into a map or record that can't be written through.
 *
 * @param <P> the remaining path: selectors or key segments
 */
abstract class Walk<P> {
	final DescriptorTable table;
	final ValueCodec codec;
	final WalkOptions options;

	Walk(DescriptorTable table, ValueCodec codec, WalkOptions options) {
		this.table = table;
		this.codec = codec;
		this.options = options;
	}

	/**
	 * The literal segments at the front of the cursor's format,
	 * matched against or appended to its key path.
	 */
	record Step<P>(Cursor cursor, P path) { }

	abstract Step<P> consumeLiterals(Cursor cursor, P path) throws KvsPathException;

	/**
	 * @return true if the walk ends here
	 */
	abstract boolean hasArrived(Cursor cursor, P path) throws KvsPathException;

	abstract Located walkStruct(Cursor cursor, StructDescriptor struct, Slot slot, P path) throws KvsPathException;

	abstract Located walkMap(Cursor cursor, MapDescriptor map, Slot slot, P path) throws KvsPathException;

	final Located walk(Cursor cursor, P path) throws KvsPathException {
		if (cursor.descriptor() instanceof OptionalDescriptor optional) {
			return walkOptional(cursor, optional, path);
		}

		Step<P> step = consumeLiterals(cursor, path);
		Cursor here = step.cursor();
		P rest = step.path();

		if (hasArrived(here, rest)) {
			return arrive(here);
		}

		TypeDescriptor descriptor = here.descriptor();
		if (here.format().startsWith(INDEX)) {
			throw new KvsPathException(NOT_IMPLEMENTED, "{index} is not supported at " + here);
		} else if (descriptor instanceof StructDescriptor struct) {
			if (!here.format().isFieldBoundary()) {
				throw new FormatMisconfigurationException("Format of " + struct.type().getSimpleName() + " must end with a slash at " + here.key());
			}
			return walkStruct(here, struct, materialize(here), rest);
		} else if (descriptor instanceof MapDescriptor map) {
			if (!here.format().startsWith(KEY)) {
				throw new FormatMisconfigurationException("Map format must contain a {key} segment at " + here.key());
			}
			return walkMap(here, map, materialize(here), rest);
		} else if (descriptor instanceof SequenceDescriptor) {
			throw new KvsPathException(NOT_IMPLEMENTED, "Arrays and collections can only be stored as a single value at " + here);
		} else {
			throw new KvsPathException(SCALAR_TYPE, descriptor.type().getTypeName() + " can't be traversed at " + here);
		}
	}

	private Located walkOptional(Cursor cursor, OptionalDescriptor optional, P path) throws KvsPathException {
		Optional<?> wrapper = (Optional<?>) cursor.value();
		Object inner = (wrapper == null) ? null : wrapper.orElse(null);
		boolean present = cursor.present() && inner != null;
		boolean created = false;
		if (!present && options.create()) {
			inner = newValue(optional.elementType());
			present = created = (inner != null);
		}
		Cursor unwrapped = new Cursor(inner, present, table.describe(optional.elementType()), cursor.keyPath(), cursor.fields(), cursor.format());
		Located result = walk(unwrapped, path);
		if (result.changed()) {
			return new Located(result.target(), Optional.ofNullable(result.replacement()), true);
		} else if (created) {
			return new Located(result.target(), Optional.of(inner), true);
		} else {
			return Located.unchanged(result.target(), cursor);
		}
	}

	/**
	 * The object a struct or map cursor points at, allocated if it's missing and we're creating.
	 */
	record Slot(@Nullable Object value, boolean present, boolean created) { }

	private Slot materialize(Cursor cursor) {
		if (cursor.value() == null && options.create()) {
			Object created = newValue(cursor.descriptor().type());
			LOGGER.trace("Created {} at {}", created, cursor);
			return new Slot(created, true, true);
		}
		return new Slot(cursor.value(), cursor.present() && cursor.value() != null, false);
	}

	/**
	 * Zero value, except that maps are empty rather than null
	 * because the caller is about to put something in them.
	 */
	final @Nullable Object newValue(Type type) {
		Object result = table.zero(type);
		if (result == null && table.describe(type) instanceof MapDescriptor map) {
			return map.newInstance();
		}
		return result;
	}

	final Cursor fieldCursor(Cursor cursor, Slot slot, FieldDescriptor field) {
		Object fieldValue = slot.present() ? field.get(slot.value()) : null;
		return cursor.child(fieldValue, slot.present(), table.describe(field.type()), Selector.field(field.name()), field.format());
	}

	/**
	 * Stores a changed field back into its struct.
	 */
	final Located leaveField(Cursor cursor, StructDescriptor struct, Slot slot, FieldDescriptor field, Located result) {
		if (result.changed()) {
			Object updated = struct.with(slot.value(), field, result.replacement());
			return new Located(result.target(), updated, slot.created() || updated != cursor.value());
		} else if (slot.created()) {
			return new Located(result.target(), slot.value(), true);
		} else {
			return Located.unchanged(result.target(), cursor);
		}
	}

	/**
	 * Descends into one map entry and stores it back if it changed.
	 *
	 * @param key the typed map key
	 * @param segment the same key as it appears in the store key
	 */
	final Located walkEntry(Cursor cursor, MapDescriptor map, Slot slot, Object key, String segment, P rest) throws KvsPathException {
		@SuppressWarnings("unchecked")
		Map<Object, Object> entries = (Map<Object, Object>) slot.value();
		boolean entryPresent = slot.present() && entries.containsKey(key);
		Object entry = entryPresent ? entries.get(key) : null;
		boolean entryCreated = false;
		if (!entryPresent && options.create()) {
			entry = newValue(map.valueType());
			entryPresent = entryCreated = true;
			LOGGER.trace("Creating entry {} at {}", key, cursor);
		}
		Cursor child = cursor
			.plusKey(segment)
			.child(entry, entryPresent, table.describe(map.valueType()), Selector.key(key), cursor.format().rest());
		Located result = walk(child, rest);
		if (result.changed() || entryCreated) {
			Object newEntry = result.changed() ? result.replacement() : entry;
			Map<Object, Object> updated = map.put(entries, key, newEntry);
			return new Located(result.target(), updated, slot.created() || updated != cursor.value());
		} else if (slot.created()) {
			return new Located(result.target(), slot.value(), true);
		} else {
			return Located.unchanged(result.target(), cursor);
		}
	}

	/**
	 * Applies the mutation, if any, to the object the walk ended at.
	 */
	Located arrive(Cursor cursor) throws KvsPathException {
		Mutation mutation = options.mutation();
		if (mutation == null) {
			return new Located(cursor, cursor.value(), false);
		}
		if (mutation instanceof RemoveEntry) {
			throw new IllegalStateException("Entry removal is only supported by selector");
		}
		if (!cursor.present()) {
			throw new KvsPathException(SET_NONEXISTENT, "Nothing to set at " + cursor);
		}
		TypeDescriptor descriptor = cursor.descriptor();
		Object newValue;
		if (mutation instanceof Decode decode) {
			newValue = decode(cursor, decode);
		} else {
			Object value = ((Assign) mutation).value();
			if (!descriptor.accepts(value)) {
				throw new KvsPathException(SET_WRONG_TYPE, "Can't store " + (value == null ? "null" : value.getClass().getSimpleName()) + " as " + descriptor.type().getTypeName() + " at " + cursor);
			}
			newValue = value;
		}
		LOGGER.trace("Setting {} to {}", cursor, newValue);
		return new Located(cursor.withValue(newValue), newValue, true);
	}

	/**
	 * A decoded null becomes the zero value wherever null can't be stored:
	 * primitives, structs, and the root itself.
	 */
	private Object decode(Cursor cursor, Decode decode) throws KvsPathException {
		TypeDescriptor descriptor = cursor.descriptor();
		Type type = descriptor.type();
		Object result;
		try {
			result = codec.decode(decode.text(), type);
		} catch (CodecException e) {
			if (decode.ignoreFailures()) {
				LOGGER.debug("Resetting {} because \"{}\" doesn't decode: {}", cursor, decode.text(), e.getMessage());
				result = table.zero(type);
			} else {
				throw new KvsPathException(MALFORMED_VALUE, "Value doesn't decode at " + cursor, e);
			}
		}
		boolean isRoot = cursor.fields().isEmpty();
		if (result == null && (isRoot || descriptor.rawClass().isPrimitive() || descriptor instanceof StructDescriptor)) {
			result = newValue(type);
			if (result == null) {
				throw new KvsPathException(MALFORMED_VALUE, "Root " + type.getTypeName() + " can't be null at " + cursor);
			}
		}
		return result;
	}

	private static final Logger LOGGER = LoggerFactory.getLogger(Walk.class);
}

package works.kvsync;

import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Optional;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
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
import static works.kvsync.exceptions.KvsPathException.Reason.MALFORMED_KEY;
import static works.kvsync.exceptions.KvsPathException.Reason.MALFORMED_VALUE;
import static works.kvsync.exceptions.KvsPathException.Reason.NOT_IMPLEMENTED;
import static works.kvsync.exceptions.KvsPathException.Reason.SCALAR_TYPE;

/**
 * Flattens an object into every key/value pair it occupies.
 * Missing objects below the starting point occupy no keys.
 */
final class Encoder {
	private final DescriptorTable table;
	private final ValueCodec codec;
	private final Map<String, String> result = new LinkedHashMap<>();

	Encoder(DescriptorTable table, ValueCodec codec) {
		this.table = table;
		this.codec = codec;
	}

	Map<String, String> encode(Cursor start) throws KvsPathException {
		flatten(start);
		return result;
	}

	private void flatten(Cursor cursor) throws KvsPathException {
		TypeDescriptor descriptor = cursor.descriptor();
		Object value = cursor.value();
		while (descriptor instanceof OptionalDescriptor optional) {
			value = (value == null) ? null : ((Optional<?>) value).orElse(null);
			descriptor = table.describe(optional.elementType());
		}

		Format format = cursor.format();
		while (!format.isEmpty() && format.first() instanceof Format.Literal literal) {
			cursor = cursor.plusKey(literal.text());
			format = format.rest();
		}
		cursor = new Cursor(value, cursor.present(), descriptor, cursor.keyPath(), cursor.fields(), format);

		if (format.isEmpty()) {
			emit(cursor);
		} else if (value == null) {
			LOGGER.trace("Nothing stored for missing object at {}", cursor);
		} else if (format.startsWith(INDEX) || descriptor instanceof SequenceDescriptor) {
			throw new KvsPathException(NOT_IMPLEMENTED, "Arrays and collections can only be stored as a single value at " + cursor);
		} else if (descriptor instanceof StructDescriptor struct) {
			if (!format.isFieldBoundary()) {
				throw new FormatMisconfigurationException("Format of " + struct.type().getSimpleName() + " must end with a slash at " + cursor.key());
			}
			for (FieldDescriptor field : struct.fields()) {
				flatten(cursor.child(field.get(value), true, table.describe(field.type()), Selector.field(field.name()), field.format()));
			}
		} else if (descriptor instanceof MapDescriptor map) {
			if (!format.startsWith(KEY)) {
				throw new FormatMisconfigurationException("Map format must contain a {key} segment at " + cursor.key());
			}
			TypeDescriptor valueDescriptor = table.describe(map.valueType());
			for (Map.Entry<?, ?> entry : ((Map<?, ?>) value).entrySet()) {
				String segment;
				try {
					segment = codec.encodeKey(entry.getKey(), map.keyType());
				} catch (CodecException e) {
					throw new KvsPathException(MALFORMED_KEY, "Unable to encode key " + entry.getKey() + " at " + cursor, e);
				}
				flatten(cursor.plusKey(segment).child(entry.getValue(), true, valueDescriptor, Selector.key(entry.getKey()), format.rest()));
			}
		} else {
			throw new KvsPathException(SCALAR_TYPE, descriptor.type().getTypeName() + " can't be traversed at " + cursor);
		}
	}

	private void emit(Cursor cursor) throws KvsPathException {
		String key = String.join("/", cursor.keyPath());
		String encoded;
		try {
			encoded = codec.encode(cursor.value(), cursor.descriptor().type());
		} catch (CodecException e) {
			throw new KvsPathException(MALFORMED_VALUE, "Unable to encode value at " + cursor, e);
		}
		String existing = result.putIfAbsent(key, encoded);
		if (existing != null) {
			throw new FormatMisconfigurationException("Key \"" + key + "\" is already used by value \"" + existing + "\"");
		}
	}

	private static final Logger LOGGER = LoggerFactory.getLogger(Encoder.class);
}

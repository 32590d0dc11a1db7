package works.kvsync.codec;

import java.lang.reflect.Type;
import org.jetbrains.annotations.Nullable;
import tools.jackson.core.JacksonException;
import tools.jackson.databind.DeserializationFeature;
import tools.jackson.databind.JavaType;
import tools.jackson.databind.ObjectMapper;
import tools.jackson.databind.cfg.CoercionAction;
import tools.jackson.databind.cfg.CoercionInputShape;
import tools.jackson.databind.json.JsonMapper;
import tools.jackson.databind.type.LogicalType;
import works.kvsync.exceptions.CodecException;

import static java.util.Objects.requireNonNull;

/**
 * Converts stored values and map keys to and from strings.
 *
 * <p>
 * Strings are stored as-is, so that keys and values stay readable.
 * Everything else is JSON.
 */
public final class ValueCodec {
	private final ObjectMapper mapper;

	public ValueCodec() {
		this(defaultMapper());
	}

	/**
	 * Values are read strictly: {@code 1.5} is not an int,
	 * and {@code "5"} is a string rather than a number or boolean.
	 */
	public static JsonMapper defaultMapper() {
		return JsonMapper.builder()
			.disable(DeserializationFeature.ACCEPT_FLOAT_AS_INT)
			.withCoercionConfig(LogicalType.Integer, c -> c
				.setCoercion(CoercionInputShape.String, CoercionAction.Fail)
				.setCoercion(CoercionInputShape.Float, CoercionAction.Fail))
			.withCoercionConfig(LogicalType.Float, c -> c.setCoercion(CoercionInputShape.String, CoercionAction.Fail))
			.withCoercionConfig(LogicalType.Boolean, c -> c.setCoercion(CoercionInputShape.String, CoercionAction.Fail))
			.build();
	}

	public ValueCodec(ObjectMapper mapper) {
		this.mapper = requireNonNull(mapper);
	}

	/**
	 * A null {@link String} encodes as the empty string; other nulls as JSON {@code null}.
	 */
	public String encode(@Nullable Object value, Type type) throws CodecException {
		if (value instanceof String s) {
			return s;
		} else if (value == null && type == String.class) {
			return "";
		}
		try {
			return mapper.writerFor(javaType(type)).writeValueAsString(value);
		} catch (JacksonException e) {
			throw new CodecException("Unable to encode " + type.getTypeName() + " value", e);
		}
	}

	public Object decode(String text, Type type) throws CodecException {
		if (type == String.class) {
			return text;
		}
		try {
			return mapper.readerFor(javaType(type)).readValue(text);
		} catch (JacksonException e) {
			throw new CodecException("Unable to decode \"" + text + "\" as " + type.getTypeName(), e);
		}
	}

	/**
	 * Map keys follow the same rules as values, so a key of {@code 123}
	 * becomes the path segment {@code 123}.
	 */
	public String encodeKey(Object key, Type keyType) throws CodecException {
		return encode(key, keyType);
	}

	public Object decodeKey(String segment, Type keyType) throws CodecException {
		Object result = decode(segment, keyType);
		if (result == null) {
			throw new CodecException("Map key \"" + segment + "\" decodes to null");
		}
		return result;
	}

	private JavaType javaType(Type type) {
		return mapper.getTypeFactory().constructType(type);
	}
}

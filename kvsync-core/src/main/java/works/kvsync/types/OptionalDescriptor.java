package works.kvsync.types;

import java.lang.reflect.Type;

/**
 * {@link java.util.Optional}, which the walker sees through to its element type.
 */
public record OptionalDescriptor(Type type, Type elementType) implements TypeDescriptor { }

package works.kvsync.types;

import java.lang.reflect.Type;

/**
 * An array or {@link java.util.Collection}.
 * These can be stored as single values, but not element by element.
 */
public record SequenceDescriptor(Type type) implements TypeDescriptor { }

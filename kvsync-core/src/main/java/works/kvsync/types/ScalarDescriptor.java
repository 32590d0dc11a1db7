package works.kvsync.types;

import java.lang.reflect.Type;

/**
 * A type with no structure of its own, always stored as a single value.
 */
public record ScalarDescriptor(Type type) implements TypeDescriptor { }

package works.kvsync;

import static java.util.Objects.requireNonNull;

/**
 * One step of a field path: either a struct field, by name, or a map entry, by key.
 * Map keys keep their Java type.
 */
public sealed interface Selector {
	record Field(String name) implements Selector {
		public Field {
			requireNonNull(name);
		}

		@Override
		public String toString() {
			return name;
		}
	}

	record Key(Object value) implements Selector {
		public Key {
			requireNonNull(value);
		}

		@Override
		public String toString() {
			return "[" + value + "]";
		}
	}

	static Selector field(String name) {
		return new Field(name);
	}

	static Selector key(Object value) {
		return new Key(value);
	}
}

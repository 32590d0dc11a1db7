package works.kvsync;

import org.jetbrains.annotations.Nullable;

/**
 * @param create allocate missing structs, maps and map entries on the way down
 * @param mutation what to do on arrival, if anything
 * @param acceptPartialKey in key mode, treat a key that ends above any stored value as naming the object it reaches
 */
record WalkOptions(boolean create, @Nullable Mutation mutation, boolean acceptPartialKey) {
	static final WalkOptions LOOKUP = new WalkOptions(false, null, false);

	sealed interface Mutation { }

	/**
	 * Decode a stored string into the target.
	 *
	 * @param ignoreFailures store the type's zero value if the text doesn't decode
	 */
	record Decode(String text, boolean ignoreFailures) implements Mutation { }

	record Assign(@Nullable Object value) implements Mutation { }

	/**
	 * The target must be a map; remove the entry selected by {@code selector}.
	 */
	record RemoveEntry(Object selector) implements Mutation { }
}

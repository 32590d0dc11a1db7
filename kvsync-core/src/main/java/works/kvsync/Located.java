package works.kvsync;

import org.jetbrains.annotations.Nullable;

/**
 * The outcome of walking from one object.
 *
 * @param target where the walk ended up
 * @param replacement what the starting object's slot should now hold
 * @param changed whether {@code replacement} must be written into that slot
 */
record Located(Cursor target, @Nullable Object replacement, boolean changed) {
	static Located unchanged(Cursor target, Cursor start) {
		return new Located(target, start.value(), false);
	}
}

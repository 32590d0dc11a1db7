package works.kvsync;

/**
 * Marks a mutable class whose fields are stored under keys of their own,
 * the way record components are.
 *
 * <p>
 * Implementations need a no-argument constructor. Their non-static, non-transient
 * declared fields are visited in declaration order, and updates are written
 * into the fields in place. Classes that neither implement this interface nor
 * are records are stored as single values.
 */
public interface KvsNode {

}

/**
 * Exceptions thrown by kvsync.
 * <p>
 * Checked exceptions report conditions a caller is expected to handle,
 * like a key that does not address any object.
 * Unchecked ones report modelling errors in the object types or their formats.
 */
package works.kvsync.exceptions;

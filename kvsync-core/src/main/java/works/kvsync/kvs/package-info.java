/**
 * Interfaces to the key-value store that objects are synced with,
 * plus an in-memory implementation.
 * <p>
 * Implementations for networked stores live outside this library.
 */
package works.kvsync.kvs;

// file: storage/src/main/java/io/diffserve/storage/ContentStore.java
package io.diffserve.storage;

import io.diffserve.core.Hash;

/**
 * Content-addressed chunk store with named, atomically advanceable refs ("datasets").
 * <p>
 * Semantics:
 *  - put() is idempotent and durable before it returns; the returned hash is
 *    {@link Hash#of(byte[])} of the chunk.
 *  - get() returns the chunk bytes, or null if the hash was never stored.
 *  - head() returns the hash a dataset points at, or null if it was never set.
 *  - compareAndSet() moves a dataset from 'expected' (null = unset) to 'next'
 *    atomically and durably; it returns false, changing nothing, when the
 *    dataset no longer points at 'expected'.
 * <p>
 * Failures to persist surface as {@link StorageException}.
 */
public interface ContentStore extends AutoCloseable {

    Hash put(byte[] chunk);

    byte[] get(Hash hash);

    default boolean has(Hash hash) {
        return get(hash) != null;
    }

    Hash head(String dataset);

    boolean compareAndSet(String dataset, Hash expected, Hash next);

    @Override
    default void close() {
    }
}

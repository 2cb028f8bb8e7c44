// file: storage/src/main/java/io/diffserve/storage/InMemoryContentStore.java
package io.diffserve.storage;

import io.diffserve.core.Hash;

import java.util.Arrays;
import java.util.Map;
import java.util.Objects;
import java.util.concurrent.ConcurrentHashMap;

/** Non-durable {@link ContentStore} for tests and throwaway servers. */
public final class InMemoryContentStore implements ContentStore {
    private final Map<Hash, byte[]> chunks = new ConcurrentHashMap<>();
    private final Map<String, Hash> refs = new ConcurrentHashMap<>();

    @Override
    public Hash put(byte[] chunk) {
        Objects.requireNonNull(chunk, "chunk");
        Hash h = Hash.of(chunk);
        chunks.putIfAbsent(h, Arrays.copyOf(chunk, chunk.length));
        return h;
    }

    @Override
    public byte[] get(Hash hash) {
        byte[] b = chunks.get(hash);
        return b == null ? null : Arrays.copyOf(b, b.length);
    }

    @Override
    public boolean has(Hash hash) {
        return chunks.containsKey(hash);
    }

    @Override
    public Hash head(String dataset) {
        return refs.get(dataset);
    }

    @Override
    public boolean compareAndSet(String dataset, Hash expected, Hash next) {
        Objects.requireNonNull(next, "next");
        if (expected == null) {
            return refs.putIfAbsent(dataset, next) == null;
        }
        return refs.replace(dataset, expected, next);
    }
}

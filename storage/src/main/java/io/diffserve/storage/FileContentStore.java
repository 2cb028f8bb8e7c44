// file: storage/src/main/java/io/diffserve/storage/FileContentStore.java
package io.diffserve.storage;

import io.diffserve.core.Hash;

import java.nio.file.Path;
import java.util.Arrays;
import java.util.Map;
import java.util.Objects;
import java.util.concurrent.ConcurrentHashMap;
import java.util.logging.Logger;

/**
 * Durable {@link ContentStore}: every chunk and every ref move is a WAL record.
 * <p>
 * Responsibilities:
 *  - Keep chunks and refs in memory for reads.
 *  - On put: skip chunks already present, otherwise append+fsync a CHUNK record,
 *    then publish the chunk.
 *  - On compareAndSet: under the dataset's map bin, check the expected value,
 *    append+fsync a REF record, then publish the new ref. If the append fails
 *    the ref is left untouched.
 *  - Segment rotation runs before a record is written, never after, so a failed
 *    rotation cannot report an error for a write that is already durable.
 *  - On startup: replay the WAL, verifying each chunk against its hash.
 * <p>
 * Datasets are independent: a ref move only contends with moves of the same dataset.
 */
public final class FileContentStore implements ContentStore {
    private static final Logger log = Logger.getLogger(FileContentStore.class.getName());

    public static final long DEFAULT_ROTATE_BYTES = 64L * 1024 * 1024;

    private final Map<Hash, byte[]> chunks = new ConcurrentHashMap<>();
    private final Map<String, Hash> refs = new ConcurrentHashMap<>();
    private final Wal wal;

    public FileContentStore(Wal wal) {
        this.wal = Objects.requireNonNull(wal, "wal");
        recover();
    }

    public static FileContentStore open(Path dir) {
        return new FileContentStore(new FileWal(dir, DEFAULT_ROTATE_BYTES));
    }

    @Override
    public Hash put(byte[] chunk) {
        Objects.requireNonNull(chunk, "chunk");
        Hash h = Hash.of(chunk);
        if (chunks.containsKey(h)) {
            return h;
        }
        byte[] copy = Arrays.copyOf(chunk, chunk.length);
        wal.rotateIfNeeded();
        wal.append(RecordCodec.encodeChunk(h, copy));
        chunks.putIfAbsent(h, copy);
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
        Objects.requireNonNull(dataset, "dataset");
        Objects.requireNonNull(next, "next");
        if (!chunks.containsKey(next)) {
            throw new StorageException("refusing to point " + dataset + " at missing chunk " + next);
        }
        wal.rotateIfNeeded();
        boolean[] moved = {false};
        refs.compute(dataset, (name, cur) -> {
            if (!Objects.equals(cur, expected)) {
                return cur;
            }
            wal.append(RecordCodec.encodeRef(name, next));
            moved[0] = true;
            return next;
        });
        return moved[0];
    }

    @Override
    public void close() {
        wal.close();
    }

    private void recover() {
        int chunkCount = 0;
        int refCount = 0;
        try (Wal.WalReader r = wal.openReader()) {
            for (byte[] payload; (payload = r.next()) != null; ) {
                RecordCodec.LogRecord rec = RecordCodec.decode(payload);
                if (rec instanceof RecordCodec.ChunkRecord c) {
                    if (!Hash.of(c.chunk()).equals(c.hash())) {
                        throw new StorageException("chunk " + c.hash() + " does not match its content");
                    }
                    chunks.put(c.hash(), c.chunk());
                    chunkCount++;
                } else if (rec instanceof RecordCodec.RefRecord ref) {
                    refs.put(ref.dataset(), ref.hash());
                    refCount++;
                }
            }
        }
        int chunksLoaded = chunkCount;
        int refsLoaded = refCount;
        log.fine(() -> "Recovered " + chunksLoaded + " chunks and " + refsLoaded + " ref moves");
    }
}

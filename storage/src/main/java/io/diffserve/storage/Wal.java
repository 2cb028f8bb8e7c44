// file: storage/src/main/java/io/diffserve/storage/Wal.java
package io.diffserve.storage;

/**
 * Write-ahead log backing a durable {@link ContentStore}.
 * <p>
 * Contract:
 *  - append() is atomic at record granularity: a partial write is treated as
 *    absent during recovery.
 *  - append() fsyncs the record before returning.
 *  - append() and rotateIfNeeded() are safe to call from multiple threads.
 */
public interface Wal extends AutoCloseable {

    /**
     * Append a single framed record and fsync it.
     *
     * @param serializedRecord header+payload bytes from RecordCodec
     * @throws StorageException if the record could not be made durable
     */
    void append(byte[] serializedRecord);

    /** Start a new segment once the current one passes the rotation threshold. */
    void rotateIfNeeded();

    /**
     * Sequential reader over every segment, oldest first. Stops at the end of
     * the newest segment or at the first corrupt or truncated record.
     */
    WalReader openReader();

    @Override
    void close();

    interface WalReader extends AutoCloseable {

        /** @return next valid payload (without header), or null when done. */
        byte[] next();

        @Override
        void close();
    }
}

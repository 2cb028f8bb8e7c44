// file: storage/src/main/java/io/diffserve/storage/RecordCodec.java
package io.diffserve.storage;

import io.diffserve.core.Hash;

import java.nio.ByteBuffer;
import java.nio.ByteOrder;
import java.nio.charset.StandardCharsets;
import java.util.zip.CRC32;

/**
 * Binary framing for content-store WAL records.
 * <p>
 *   [HEADER (11 bytes, little-endian)]
 *     - magic   (2B)  = 0xD1FF
 *     - version (1B)  = 1
 *     - length  (4B)  = payload length in bytes
 *     - crc32   (4B)  = CRC32(payload)
 * <p>
 *   [PAYLOAD]
 *     - kind: 1 byte
 *       CHUNK (1): hash (20B) | int32 len + chunk bytes
 *       REF   (2): int32 len + UTF-8 dataset name | hash (20B)
 */
final class RecordCodec {
    static final short MAGIC = (short) 0xD1FF;
    static final byte VERSION = 1;
    static final int HEADER_LEN = 2 + 1 + 4 + 4;

    static final byte KIND_CHUNK = 1;
    static final byte KIND_REF = 2;

    private RecordCodec() {
    }

    /** A stored chunk. */
    record ChunkRecord(Hash hash, byte[] chunk) implements LogRecord {}

    /** A dataset moved to a new hash. */
    record RefRecord(String dataset, Hash hash) implements LogRecord {}

    sealed interface LogRecord permits ChunkRecord, RefRecord {}

    static byte[] encodeChunk(Hash hash, byte[] chunk) {
        ByteBuffer b = ByteBuffer.allocate(1 + Hash.BYTE_LEN + 4 + chunk.length).order(ByteOrder.LITTLE_ENDIAN);
        b.put(KIND_CHUNK);
        b.put(hash.bytes());
        b.putInt(chunk.length).put(chunk);
        return frame(b.array());
    }

    static byte[] encodeRef(String dataset, Hash hash) {
        byte[] name = dataset.getBytes(StandardCharsets.UTF_8);
        ByteBuffer b = ByteBuffer.allocate(1 + 4 + name.length + Hash.BYTE_LEN).order(ByteOrder.LITTLE_ENDIAN);
        b.put(KIND_REF);
        b.putInt(name.length).put(name);
        b.put(hash.bytes());
        return frame(b.array());
    }

    /** Decode a payload (header already stripped and CRC-checked by the reader). */
    static LogRecord decode(byte[] payload) {
        ByteBuffer b = ByteBuffer.wrap(payload).order(ByteOrder.LITTLE_ENDIAN);
        byte kind = b.get();
        switch (kind) {
            case KIND_CHUNK -> {
                Hash hash = readHash(b);
                int len = b.getInt();
                byte[] chunk = new byte[len];
                b.get(chunk);
                return new ChunkRecord(hash, chunk);
            }
            case KIND_REF -> {
                int len = b.getInt();
                byte[] name = new byte[len];
                b.get(name);
                return new RefRecord(new String(name, StandardCharsets.UTF_8), readHash(b));
            }
            default -> throw new IllegalStateException("unknown record kind " + kind);
        }
    }

    static int crc32(byte[] bytes) {
        CRC32 crc = new CRC32();
        crc.update(bytes, 0, bytes.length);
        return (int) crc.getValue();
    }

    private static byte[] frame(byte[] payload) {
        ByteBuffer out = ByteBuffer.allocate(HEADER_LEN + payload.length).order(ByteOrder.LITTLE_ENDIAN);
        out.putShort(MAGIC).put(VERSION).putInt(payload.length).putInt(crc32(payload));
        out.put(payload);
        return out.array();
    }

    private static Hash readHash(ByteBuffer b) {
        byte[] h = new byte[Hash.BYTE_LEN];
        b.get(h);
        return Hash.fromBytes(h);
    }
}

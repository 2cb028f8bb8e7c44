// file: storage/src/main/java/io/diffserve/storage/FileWal.java
package io.diffserve.storage;

import java.io.IOException;
import java.nio.ByteBuffer;
import java.nio.ByteOrder;
import java.nio.channels.FileChannel;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayDeque;
import java.util.Deque;
import java.util.List;
import java.util.logging.Logger;
import java.util.stream.Stream;

import static java.nio.file.StandardOpenOption.*;

/**
 * File-backed WAL that appends framed records to numbered segment files
 * ("00000001.log", "00000002.log", ...).
 * <p>
 *  - On construction it creates the directory if needed, opens the newest segment,
 *    and truncates any torn tail left by a crash so later appends stay readable.
 *  - append() writes the bytes and calls force(true). A failed write is cut back
 *    to the previous record boundary; if even that fails the WAL refuses further
 *    appends, since anything written after garbage would be lost on replay.
 *  - rotateIfNeeded() starts a new segment once rotateBytes have been written.
 *  - The reader walks every segment in order and stops at the first corrupt or
 *    truncated record.
 */
public class FileWal implements Wal {
    private static final Logger log = Logger.getLogger(FileWal.class.getName());

    private final Path dir;
    private final long rotateBytes;
    private FileChannel ch;
    private Path current;
    private long writtenInSegment;
    private StorageException failed;

    public FileWal(Path dir, long rotateBytes) {
        if (rotateBytes <= 0) throw new IllegalArgumentException("rotateBytes must be > 0");
        this.dir = dir;
        this.rotateBytes = rotateBytes;
        try {
            Files.createDirectories(dir);
        } catch (IOException e) {
            throw new StorageException("cannot create WAL directory " + dir, e);
        }
        openNewestOrCreate();
    }

    @Override
    public synchronized void append(byte[] serializedRecord) {
        if (failed != null) {
            throw new StorageException("WAL " + dir + " is unusable after an earlier failure", failed);
        }
        long start;
        try {
            start = ch.position();
        } catch (IOException e) {
            throw new StorageException("WAL append failed in " + current, e);
        }
        try {
            ByteBuffer buf = ByteBuffer.wrap(serializedRecord);
            while (buf.hasRemaining()) {
                write(ch, buf);
            }
            ch.force(true);
            writtenInSegment += serializedRecord.length;
        } catch (IOException e) {
            StorageException err = new StorageException("WAL append failed in " + current, e);
            rollBack(start, err);
            throw err;
        }
    }

    /** Single channel write; split out so tests can inject short or failing writes. */
    int write(FileChannel channel, ByteBuffer buf) throws IOException {
        return channel.write(buf);
    }

    private void rollBack(long start, StorageException cause) {
        try {
            ch.truncate(start);
            ch.position(start);
            ch.force(true);
            log.warning(() -> "Rolled back torn WAL write in " + current + " to " + start + " bytes");
        } catch (IOException e) {
            cause.addSuppressed(e);
            failed = cause;
            log.severe(() -> "Cannot roll back torn WAL write in " + current + "; refusing further appends");
        }
    }

    @Override
    public synchronized void rotateIfNeeded() {
        if (writtenInSegment < rotateBytes) return;
        if (failed != null) {
            throw new StorageException("WAL " + dir + " is unusable after an earlier failure", failed);
        }
        try {
            ch.close();
            current = dir.resolve(segmentName(segmentIndex(current) + 1));
            ch = FileChannel.open(current, CREATE, WRITE, READ);
            writtenInSegment = 0;
        } catch (IOException e) {
            throw new StorageException("WAL rotation failed in " + dir, e);
        }
    }

    @Override
    public WalReader openReader() {
        return new Reader(segments(dir));
    }

    @Override
    public synchronized void close() {
        try {
            if (ch != null) ch.close();
        } catch (IOException e) {
            throw new StorageException("WAL close failed", e);
        }
    }

    private void openNewestOrCreate() {
        List<Path> segs = segments(dir);
        current = segs.isEmpty() ? dir.resolve(segmentName(1)) : segs.get(segs.size() - 1);
        try {
            ch = FileChannel.open(current, CREATE, WRITE, READ);
            long valid = validLength(ch);
            if (valid < ch.size()) {
                log.warning(() -> "Truncating torn WAL tail in " + current + " at " + valid + " bytes");
                ch.truncate(valid);
                ch.force(true);
            }
            writtenInSegment = valid;
            ch.position(valid);
        } catch (IOException e) {
            throw new StorageException("cannot open WAL segment " + current, e);
        }
    }

    static String segmentName(int index) {
        return String.format("%08d.log", index);
    }

    private static int segmentIndex(Path seg) {
        return Integer.parseInt(seg.getFileName().toString().replace(".log", ""));
    }

    private static List<Path> segments(Path dir) {
        try (Stream<Path> files = Files.list(dir)) {
            return files
                    .filter(p -> p.getFileName().toString().endsWith(".log"))
                    .sorted()
                    .toList();
        } catch (IOException e) {
            throw new StorageException("cannot list WAL segments in " + dir, e);
        }
    }

    /** Length of the prefix of the segment made of complete, CRC-valid records. */
    private static long validLength(FileChannel ch) throws IOException {
        long pos = 0;
        while (true) {
            byte[] payload = readRecord(ch, pos);
            if (payload == null) return pos;
            pos += RecordCodec.HEADER_LEN + payload.length;
        }
    }

    /** Read one record at pos, or null at EOF / on a torn or corrupt record. */
    private static byte[] readRecord(FileChannel ch, long pos) throws IOException {
        ByteBuffer hdr = ByteBuffer.allocate(RecordCodec.HEADER_LEN).order(ByteOrder.LITTLE_ENDIAN);
        int read = ch.read(hdr, pos);
        if (read < RecordCodec.HEADER_LEN) return null; // EOF or truncated header
        hdr.flip();
        short magic = hdr.getShort();
        byte ver = hdr.get();
        int len = hdr.getInt();
        int crc = hdr.getInt();
        if (magic != RecordCodec.MAGIC || ver != RecordCodec.VERSION || len < 0) return null;
        if (pos + RecordCodec.HEADER_LEN + len > ch.size()) return null; // truncated payload
        ByteBuffer payload = ByteBuffer.allocate(len);
        while (payload.hasRemaining()) {
            int r = ch.read(payload, pos + RecordCodec.HEADER_LEN + payload.position());
            if (r < 0) return null;
        }
        byte[] bytes = payload.array();
        if (RecordCodec.crc32(bytes) != crc) return null;
        return bytes;
    }

    private static final class Reader implements WalReader {
        private final Deque<Path> pending;
        private FileChannel ch;
        private long pos;
        private boolean done;

        Reader(List<Path> segments) {
            this.pending = new ArrayDeque<>(segments);
        }

        @Override
        public byte[] next() {
            if (done) return null;
            try {
                while (true) {
                    if (ch == null) {
                        Path seg = pending.poll();
                        if (seg == null) {
                            done = true;
                            return null;
                        }
                        ch = FileChannel.open(seg, READ);
                        pos = 0;
                    }
                    byte[] payload = readRecord(ch, pos);
                    if (payload != null) {
                        pos += RecordCodec.HEADER_LEN + payload.length;
                        return payload;
                    }
                    boolean cleanEnd = pos == ch.size();
                    ch.close();
                    ch = null;
                    if (!cleanEnd) {
                        // Corruption in the middle of history: stop rather than skip ahead.
                        done = true;
                        return null;
                    }
                }
            } catch (IOException e) {
                throw new StorageException("WAL read failed", e);
            }
        }

        @Override
        public void close() {
            try {
                if (ch != null) ch.close();
            } catch (IOException e) {
                throw new StorageException("WAL reader close failed", e);
            }
        }
    }
}

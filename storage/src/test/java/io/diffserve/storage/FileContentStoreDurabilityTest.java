// file: storage/src/test/java/io/diffserve/storage/FileContentStoreDurabilityTest.java
package io.diffserve.storage;

import io.diffserve.core.Hash;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.IOException;
import java.io.OutputStream;
import java.nio.ByteBuffer;
import java.nio.channels.FileChannel;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.concurrent.atomic.AtomicBoolean;

import static java.nio.file.StandardOpenOption.APPEND;
import static org.junit.jupiter.api.Assertions.*;

class FileContentStoreDurabilityTest {

    @TempDir Path dir;

    private static byte[] b(String s) {
        return s.getBytes(StandardCharsets.UTF_8);
    }

    @Test
    void chunks_and_refs_survive_restart() {
        Hash h1;
        Hash h2;
        try (var store = new FileContentStore(new FileWal(dir, 1L << 60))) {
            h1 = store.put(b("one"));
            h2 = store.put(b("two"));
            assertTrue(store.compareAndSet("client/c1", null, h1));
            assertTrue(store.compareAndSet("client/c1", h1, h2));
        }

        // "Crash": new instance recovers from disk
        try (var store = new FileContentStore(new FileWal(dir, 1L << 60))) {
            assertArrayEquals(b("one"), store.get(h1));
            assertArrayEquals(b("two"), store.get(h2));
            assertEquals(h2, store.head("client/c1"));
        }
    }

    @Test
    void replay_spans_rotated_segments() {
        Hash last = null;
        try (var store = new FileContentStore(new FileWal(dir, 64))) { // rotate after nearly every record
            for (int i = 0; i < 10; i++) {
                Hash h = store.put(b("chunk-" + i));
                assertTrue(store.compareAndSet("client/c", last, h));
                last = h;
            }
        }
        assertTrue(dir.resolve(FileWal.segmentName(2)).toFile().exists(), "expected more than one segment");

        try (var store = new FileContentStore(new FileWal(dir, 64))) {
            assertEquals(last, store.head("client/c"));
            for (int i = 0; i < 10; i++) {
                assertTrue(store.has(Hash.of(b("chunk-" + i))));
            }
        }
    }

    @Test
    void torn_tail_is_ignored_and_later_appends_stay_readable() throws Exception {
        Hash h1;
        try (var store = new FileContentStore(new FileWal(dir, 1L << 60))) {
            h1 = store.put(b("kept"));
            assertTrue(store.compareAndSet("client/c", null, h1));
        }

        // Simulate a crash in the middle of writing a third record.
        byte[] torn = RecordCodec.encodeChunk(Hash.of(b("lost")), b("lost"));
        try (OutputStream out = Files.newOutputStream(dir.resolve(FileWal.segmentName(1)), APPEND)) {
            out.write(torn, 0, torn.length - 3);
        }

        Hash h2;
        try (var store = new FileContentStore(new FileWal(dir, 1L << 60))) {
            assertEquals(h1, store.head("client/c"));
            assertFalse(store.has(Hash.of(b("lost"))));

            h2 = store.put(b("after-crash"));
            assertTrue(store.compareAndSet("client/c", h1, h2));
        }

        try (var store = new FileContentStore(new FileWal(dir, 1L << 60))) {
            assertEquals(h2, store.head("client/c"));
            assertArrayEquals(b("after-crash"), store.get(h2));
        }
    }

    @Test
    void compare_and_set_refuses_stale_expectation() {
        try (var store = new FileContentStore(new FileWal(dir, 1L << 60))) {
            Hash a = store.put(b("a"));
            Hash c = store.put(b("c"));

            assertTrue(store.compareAndSet("d", null, a));
            assertFalse(store.compareAndSet("d", null, c));
            assertFalse(store.compareAndSet("d", c, c));
            assertEquals(a, store.head("d"));
        }
    }

    @Test
    void ref_to_unknown_chunk_is_rejected() {
        try (var store = new FileContentStore(new FileWal(dir, 1L << 60))) {
            assertThrows(StorageException.class,
                    () -> store.compareAndSet("d", null, Hash.of(b("never stored"))));
            assertNull(store.head("d"));
        }
    }

    @Test
    void torn_write_is_rolled_back_so_later_records_survive() {
        Hash a;
        Hash c;
        var wal = new TearingWal(dir);
        try (var store = new FileContentStore(wal)) {
            a = store.put(b("record A"));
            assertTrue(store.compareAndSet("client/c", null, a));

            wal.tearNextWrite.set(true);
            assertThrows(StorageException.class, () -> store.put(b("record B")));
            assertFalse(store.has(Hash.of(b("record B"))));

            c = store.put(b("record C"));
            assertTrue(store.compareAndSet("client/c", a, c));
        }

        try (var store = new FileContentStore(new FileWal(dir, 1L << 60))) {
            assertArrayEquals(b("record A"), store.get(a));
            assertArrayEquals(b("record C"), store.get(c));
            assertFalse(store.has(Hash.of(b("record B"))));
            assertEquals(c, store.head("client/c"));
        }
    }

    /** Writes the first few bytes of the next record, then fails like a full disk. */
    private static final class TearingWal extends FileWal {
        final AtomicBoolean tearNextWrite = new AtomicBoolean();

        TearingWal(Path dir) {
            super(dir, 1L << 60);
        }

        @Override
        int write(FileChannel channel, ByteBuffer buf) throws IOException {
            if (tearNextWrite.getAndSet(false)) {
                ByteBuffer head = buf.duplicate();
                head.limit(head.position() + 5);
                channel.write(head);
                throw new IOException("No space left on device");
            }
            return super.write(channel, buf);
        }
    }
}

// file: storage/src/test/java/io/diffserve/storage/CommitLogTest.java
package io.diffserve.storage;

import com.fasterxml.jackson.databind.node.IntNode;
import com.fasterxml.jackson.databind.node.TextNode;
import io.diffserve.core.Hash;
import io.diffserve.core.Snapshot;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.nio.file.Path;
import java.util.ArrayList;
import java.util.HashSet;
import java.util.List;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicBoolean;

import static org.junit.jupiter.api.Assertions.*;

class CommitLogTest {

    private static Snapshot snap(String key, String value) {
        return Snapshot.empty().with(key, TextNode.valueOf(value));
    }

    @Test
    void fresh_log_starts_at_genesis() {
        var log = new CommitLog(new InMemoryContentStore(), "acct", "c1");

        Commit head = log.head();
        assertTrue(head.isGenesis());
        assertEquals(Commit.genesis(), head);
        assertTrue(head.snapshot().isEmpty());
        assertEquals(0, head.lastMutationID());
        assertEquals(List.of(Commit.genesis().stateID()), log.history());
        assertSame(Commit.genesis(), log.lookup(Commit.genesis().stateID()));
    }

    @Test
    void append_advances_head_and_links_parent() {
        var log = new CommitLog(new InMemoryContentStore(), "acct", "c1");
        Snapshot s1 = snap("a", "1");
        Snapshot s2 = s1.with("b", IntNode.valueOf(2));

        Commit c1 = log.append(s1, s1.checksum(), 1);
        Commit c2 = log.append(s2, s2.checksum(), 3);

        assertEquals(c2, log.head());
        assertEquals(c1.stateID(), c2.parent());
        assertEquals(Commit.genesis().stateID(), c1.parent());
        assertEquals(List.of(c2.stateID(), c1.stateID(), Commit.genesis().stateID()), log.history());

        Commit old = log.lookup(c1.stateID());
        assertEquals(s1, old.snapshot());
        assertEquals(1, old.lastMutationID());
    }

    @Test
    void identical_content_on_different_parents_gets_distinct_state_ids() {
        var log = new CommitLog(new InMemoryContentStore(), "acct", "c1");
        Snapshot s = snap("a", "1");

        Commit c1 = log.append(s, s.checksum(), 1);
        Commit c2 = log.append(s, s.checksum(), 1);

        assertNotEquals(c1.stateID(), c2.stateID());
        assertEquals(c1.checksum(), c2.checksum());
    }

    @Test
    void lookup_rejects_ids_outside_this_clients_history() {
        var store = new InMemoryContentStore();
        var mine = new CommitLog(store, "acct", "c1");
        var other = new CommitLog(store, "acct", "c2");
        Snapshot s = snap("x", "y");
        Commit foreign = other.append(s, s.checksum(), 1);

        var e = assertThrows(UnknownStateException.class, () -> mine.lookup(foreign.stateID()));
        assertEquals(foreign.stateID(), e.stateID());
        assertThrows(UnknownStateException.class, () -> mine.lookup(Hash.parse("00000000000000000000000000000000")));
    }

    @Test
    void checksum_must_match_snapshot() {
        var log = new CommitLog(new InMemoryContentStore(), "acct", "c1");
        Snapshot s = snap("a", "1");

        assertThrows(IllegalArgumentException.class,
                () -> log.append(s, snap("a", "2").checksum(), 1));
        assertTrue(log.head().isGenesis());
    }

    @Test
    void regressing_last_mutation_id_is_refused() {
        var log = new CommitLog(new InMemoryContentStore(), "acct", "c1");
        Snapshot s = snap("a", "1");
        Commit c = log.append(s, s.checksum(), 5);

        assertThrows(StaleMutationException.class, () -> log.append(s, s.checksum(), 4));
        assertEquals(c, log.head());
        // equal is fine
        assertEquals(5, log.append(s, s.checksum(), 5).lastMutationID());
    }

    @Test
    void failed_write_leaves_head_unchanged() {
        var store = new FlakyStore();
        var log = new CommitLog(store, "acct", "c1");
        Snapshot s1 = snap("a", "1");
        Commit c1 = log.append(s1, s1.checksum(), 1);

        store.failing.set(true);
        Snapshot s2 = snap("a", "2");
        assertThrows(StorageException.class, () -> log.append(s2, s2.checksum(), 2));
        assertEquals(c1, log.head());
        assertEquals(c1.stateID(), store.head("client/c1"));

        store.failing.set(false);
        Commit c2 = log.append(s2, s2.checksum(), 2);
        assertEquals(c1.stateID(), c2.parent());
    }

    @Test
    void ref_move_reported_as_failed_but_durable_still_commits() {
        var store = new FlakyStore();
        var log = new CommitLog(store, "acct", "c1");
        Snapshot s1 = snap("a", "1");

        store.failAfterRefMove.set(true);
        Commit c1 = log.append(s1, s1.checksum(), 1);

        assertEquals(c1, log.head());
        assertEquals(c1.stateID(), store.head("client/c1"));

        Snapshot s2 = snap("a", "2");
        Commit c2 = log.append(s2, s2.checksum(), 2);
        assertEquals(c1.stateID(), c2.parent());
        assertEquals(c2.stateID(), store.head("client/c1"));
    }

    @Test
    void failed_segment_rotation_leaves_log_and_store_in_step(@TempDir Path dir) {
        var wal = new RotationFailingWal(new FileWal(dir, 1));
        try (var store = new FileContentStore(wal)) {
            var log = new CommitLog(store, "acct", "c1");
            Snapshot s1 = snap("a", "1");
            Commit c1 = log.append(s1, s1.checksum(), 1);

            wal.failNextRotation.set(true);
            Snapshot s2 = snap("a", "2");
            assertThrows(StorageException.class, () -> log.append(s2, s2.checksum(), 2));
            assertEquals(c1, log.head());
            assertEquals(c1.stateID(), store.head("client/c1"));

            Commit c2 = log.append(s2, s2.checksum(), 2);
            assertEquals(c2, log.head());
            assertEquals(c2.stateID(), store.head("client/c1"));
        }
        try (var store = new FileContentStore(new FileWal(dir, 1))) {
            assertEquals(2, new CommitLog(store, "acct", "c1").head().lastMutationID());
        }
    }

    @Test
    void reopening_from_the_same_store_restores_head_and_history() {
        var store = new InMemoryContentStore();
        var log = new CommitLog(store, "acct", "c1");
        Snapshot s = Snapshot.empty();
        List<Hash> expected = new ArrayList<>();
        for (int i = 1; i <= 5; i++) {
            s = s.with("k" + i, IntNode.valueOf(i));
            expected.add(0, log.append(s, s.checksum(), i).stateID());
        }
        expected.add(Commit.genesis().stateID());

        var reopened = new CommitLog(store, "acct", "c1");
        assertEquals(log.head(), reopened.head());
        assertEquals(expected, reopened.history());
        assertEquals(3, reopened.lookup(expected.get(2)).lastMutationID());
    }

    @Test
    void concurrent_appends_form_a_single_chain() throws Exception {
        var log = new CommitLog(new InMemoryContentStore(), "acct", "c1");
        int threads = 8;
        int perThread = 25;
        ExecutorService pool = Executors.newFixedThreadPool(threads);
        CountDownLatch start = new CountDownLatch(1);
        try {
            List<Future<?>> futures = new ArrayList<>();
            for (int t = 0; t < threads; t++) {
                int id = t;
                futures.add(pool.submit(() -> {
                    start.await();
                    for (int i = 0; i < perThread; i++) {
                        Snapshot s = snap("t" + id, "v" + i);
                        log.append(s, s.checksum(), 0);
                    }
                    return null;
                }));
            }
            start.countDown();
            for (Future<?> f : futures) {
                f.get(30, TimeUnit.SECONDS);
            }
        } finally {
            pool.shutdownNow();
        }

        List<Hash> history = log.history();
        assertEquals(threads * perThread + 1, history.size());
        assertEquals(history.size(), new HashSet<>(history).size());
        for (int i = 0; i < history.size() - 1; i++) {
            assertEquals(history.get(i + 1), log.lookup(history.get(i)).parent());
        }
    }

    /**
     * Delegates to an in-memory store, but can be told to fail every write, or to
     * report a failure after a ref move has already taken effect.
     */
    private static final class FlakyStore implements ContentStore {
        final InMemoryContentStore delegate = new InMemoryContentStore();
        final AtomicBoolean failing = new AtomicBoolean();
        final AtomicBoolean failAfterRefMove = new AtomicBoolean();

        @Override
        public Hash put(byte[] chunk) {
            if (failing.get()) throw new StorageException("disk full");
            return delegate.put(chunk);
        }

        @Override
        public byte[] get(Hash hash) {
            return delegate.get(hash);
        }

        @Override
        public Hash head(String dataset) {
            return delegate.head(dataset);
        }

        @Override
        public boolean compareAndSet(String dataset, Hash expected, Hash next) {
            if (failing.get()) throw new IllegalStateException("io error");
            boolean moved = delegate.compareAndSet(dataset, expected, next);
            if (moved && failAfterRefMove.getAndSet(false)) {
                throw new StorageException("rotation failed");
            }
            return moved;
        }
    }

    /** FileWal whose next rotation can be made to fail. */
    private static final class RotationFailingWal implements Wal {
        final Wal delegate;
        final AtomicBoolean failNextRotation = new AtomicBoolean();

        RotationFailingWal(Wal delegate) {
            this.delegate = delegate;
        }

        @Override
        public void append(byte[] serializedRecord) {
            delegate.append(serializedRecord);
        }

        @Override
        public void rotateIfNeeded() {
            if (failNextRotation.getAndSet(false)) {
                throw new StorageException("rotation failed");
            }
            delegate.rotateIfNeeded();
        }

        @Override
        public WalReader openReader() {
            return delegate.openReader();
        }

        @Override
        public void close() {
            delegate.close();
        }
    }
}

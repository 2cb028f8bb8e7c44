// file: storage/src/main/java/io/diffserve/storage/CommitLog.java
package io.diffserve.storage;

import io.diffserve.core.Checksum;
import io.diffserve.core.Hash;
import io.diffserve.core.Snapshot;

import java.util.ArrayList;
import java.util.Collections;
import java.util.HashSet;
import java.util.List;
import java.util.Objects;
import java.util.Set;
import java.util.concurrent.locks.ReentrantReadWriteLock;
import java.util.logging.Logger;

/**
 * Append-only commit chain of one (accountID, clientID), stored as the dataset
 * "client/&lt;clientID&gt;" of the account's {@link ContentStore}.
 * <p>
 * Concurrency:
 *  - append() holds the write lock across read-head, write chunks, move ref;
 *  - head(), lookup() and history() hold the read lock;
 *  - logs of different clients share nothing.
 * <p>
 * Failure model: the dataset ref is moved last, with compare-and-set. If anything
 * before it fails, the head is unchanged and the orphaned chunks are harmless.
 * Once the ref has moved the commit is never revoked.
 */
public final class CommitLog {
    private static final Logger log = Logger.getLogger(CommitLog.class.getName());

    static final String DATASET_PREFIX = "client/";

    private final String accountID;
    private final String clientID;
    private final String dataset;
    private final ContentStore store;
    private final ReentrantReadWriteLock lock = new ReentrantReadWriteLock();

    // guarded by lock
    private Commit head;
    private final Set<Hash> known = new HashSet<>();
    private final List<Hash> chain = new ArrayList<>(); // oldest first

    CommitLog(ContentStore store, String accountID, String clientID) {
        this.store = Objects.requireNonNull(store, "store");
        this.accountID = Objects.requireNonNull(accountID, "accountID");
        this.clientID = Objects.requireNonNull(clientID, "clientID");
        this.dataset = DATASET_PREFIX + clientID;
        load();
    }

    public String accountID() {
        return accountID;
    }

    public String clientID() {
        return clientID;
    }

    /** Latest commit, or {@link Commit#genesis()} if this client never synced. */
    public Commit head() {
        lock.readLock().lock();
        try {
            return head;
        } finally {
            lock.readLock().unlock();
        }
    }

    /**
     * Create a commit on top of the current head and make it the new head.
     *
     * @throws IllegalArgumentException if checksum is not the snapshot's checksum
     * @throws StaleMutationException   if lastMutationID is below the head's
     * @throws StorageException         if the commit could not be recorded; the head is unchanged
     */
    public Commit append(Snapshot snapshot, Checksum checksum, long lastMutationID) {
        Objects.requireNonNull(snapshot, "snapshot");
        Objects.requireNonNull(checksum, "checksum");
        if (!checksum.equals(snapshot.checksum())) {
            throw new IllegalArgumentException("checksum " + checksum + " does not match snapshot");
        }

        lock.writeLock().lock();
        try {
            if (lastMutationID < head.lastMutationID()) {
                throw new StaleMutationException(dataset, head.lastMutationID(), lastMutationID);
            }

            Hash id;
            try {
                Hash data = store.put(snapshot.encode());
                var header = new CommitCodec.Header(head.stateID(), data, checksum, lastMutationID);
                id = store.put(CommitCodec.encode(header));
                Hash expected = head.isGenesis() ? null : head.stateID();
                if (!moveRef(expected, id)) {
                    throw new StorageException("dataset " + dataset + " of " + accountID + " moved underneath us");
                }
            } catch (StorageException e) {
                throw e;
            } catch (RuntimeException e) {
                throw new StorageException("append to " + dataset + " of " + accountID + " failed", e);
            }

            Commit c = new Commit(id, head.stateID(), snapshot, checksum, lastMutationID);
            head = c;
            known.add(id);
            chain.add(id);
            log.fine(() -> "Committed " + id + " for " + accountID + "/" + clientID
                    + " (lastMutationID=" + lastMutationID + ", keys=" + snapshot.size() + ")");
            return c;
        } finally {
            lock.writeLock().unlock();
        }
    }

    /**
     * Point the dataset ref at id. The stored ref is authoritative: if it already
     * names id, the commit is durable even when the store reported a failure or a
     * lost race, e.g. an earlier attempt whose error came after the ref record hit disk.
     */
    private boolean moveRef(Hash expected, Hash id) {
        boolean moved;
        try {
            moved = store.compareAndSet(dataset, expected, id);
        } catch (RuntimeException e) {
            if (id.equals(store.head(dataset))) {
                log.warning(() -> "Ref move of " + dataset + " reported " + e + " but the ref names " + id
                        + "; treating the commit as recorded");
                return true;
            }
            throw e;
        }
        return moved || id.equals(store.head(dataset));
    }

    /**
     * Resolve a stateID from this client's history.
     *
     * @throws UnknownStateException if the id is not in this client's history,
     *                               including ids that only exist in other clients' histories
     */
    public Commit lookup(Hash stateID) {
        Objects.requireNonNull(stateID, "stateID");
        lock.readLock().lock();
        try {
            if (stateID.equals(head.stateID())) {
                return head;
            }
            if (!known.contains(stateID)) {
                throw new UnknownStateException(dataset, stateID);
            }
            if (stateID.equals(Commit.genesis().stateID())) {
                return Commit.genesis();
            }
            return read(stateID);
        } finally {
            lock.readLock().unlock();
        }
    }

    /** stateIDs from the head back to genesis. */
    public List<Hash> history() {
        lock.readLock().lock();
        try {
            List<Hash> out = new ArrayList<>(chain);
            Collections.reverse(out);
            return out;
        } finally {
            lock.readLock().unlock();
        }
    }

    /** Walk the chain once at open time; only commit headers are decoded. */
    private void load() {
        Hash genesisId = Commit.genesis().stateID();
        Hash top = store.head(dataset);
        List<Hash> newestFirst = new ArrayList<>();
        Hash cur = top;
        while (cur != null && !cur.equals(genesisId)) {
            if (!known.add(cur)) {
                throw new StorageException("cycle in commit chain of " + dataset + " at " + cur);
            }
            newestFirst.add(cur);
            cur = readHeader(cur).parent();
        }
        known.add(genesisId);
        newestFirst.add(genesisId);
        Collections.reverse(newestFirst);
        chain.addAll(newestFirst);
        head = top == null ? Commit.genesis() : read(top);
    }

    private CommitCodec.Header readHeader(Hash id) {
        byte[] chunk = store.get(id);
        if (chunk == null) {
            throw new StorageException("missing commit chunk " + id + " in " + dataset);
        }
        return CommitCodec.decodeHeader(chunk);
    }

    private Commit read(Hash id) {
        CommitCodec.Header h = readHeader(id);
        byte[] data = store.get(h.data());
        if (data == null) {
            throw new StorageException("missing snapshot chunk " + h.data() + " for commit " + id);
        }
        Snapshot snapshot = CommitCodec.decodeSnapshot(data);
        if (!snapshot.checksum().equals(h.checksum())) {
            throw new StorageException("checksum mismatch in commit " + id + " of " + dataset);
        }
        return new Commit(id, h.parent(), snapshot, h.checksum(), h.lastMutationID());
    }
}

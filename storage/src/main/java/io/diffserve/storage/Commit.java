// file: storage/src/main/java/io/diffserve/storage/Commit.java
package io.diffserve.storage;

import io.diffserve.core.Checksum;
import io.diffserve.core.Hash;
import io.diffserve.core.Snapshot;

import java.util.Objects;

/**
 * One immutable point in a client's history.
 * <p>
 *  - stateID:        hash of the encoded commit chunk,
 *  - parent:         previous commit's stateID, null only for genesis,
 *  - snapshot:       the client view at this point,
 *  - checksum:       always equal to snapshot.checksum(),
 *  - lastMutationID: last client mutation reflected in the snapshot.
 */
public record Commit(Hash stateID, Hash parent, Snapshot snapshot, Checksum checksum, long lastMutationID) {

    private static final Commit GENESIS = CommitCodec.genesis();

    public Commit {
        Objects.requireNonNull(stateID, "stateID");
        Objects.requireNonNull(snapshot, "snapshot");
        Objects.requireNonNull(checksum, "checksum");
        if (!checksum.equals(snapshot.checksum())) {
            throw new IllegalArgumentException("checksum does not match snapshot");
        }
        if (lastMutationID < 0) {
            throw new IllegalArgumentException("lastMutationID must be >= 0");
        }
    }

    /**
     * Head of a client that never synced: empty snapshot, mutation 0, no parent.
     * Its stateID is the same for every client and it is never written to a store.
     */
    public static Commit genesis() {
        return GENESIS;
    }

    public boolean isGenesis() {
        return parent == null;
    }
}

// file: storage/src/main/java/io/diffserve/storage/CommitCodec.java
package io.diffserve.storage;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.ObjectNode;
import io.diffserve.core.CanonicalJson;
import io.diffserve.core.Checksum;
import io.diffserve.core.Hash;
import io.diffserve.core.Snapshot;

/**
 * Chunk encodings for commits.
 * <p>
 * A commit is two chunks:
 *  - data:   canonical JSON object of the snapshot, shared by equal snapshots,
 *  - commit: canonical JSON {"checksum":hex,"data":hash,"lastMutationID":n,"parent":hash|null}.
 * The commit chunk's hash is the stateID.
 */
final class CommitCodec {

    private CommitCodec() {
    }

    /** Decoded commit chunk, before its snapshot is loaded. */
    record Header(Hash parent, Hash data, Checksum checksum, long lastMutationID) {}

    static byte[] encode(Header h) {
        ObjectNode n = CanonicalJson.nodes().objectNode();
        n.put("checksum", h.checksum().toString());
        n.put("data", h.data().toString());
        n.put("lastMutationID", h.lastMutationID());
        if (h.parent() == null) {
            n.putNull("parent");
        } else {
            n.put("parent", h.parent().toString());
        }
        return CanonicalJson.encode(n);
    }

    static Header decodeHeader(byte[] chunk) {
        try {
            JsonNode n = CanonicalJson.decode(chunk);
            JsonNode parent = n.get("parent");
            return new Header(
                    parent == null || parent.isNull() ? null : Hash.parse(parent.textValue()),
                    Hash.parse(n.get("data").textValue()),
                    Checksum.parse(n.get("checksum").textValue()),
                    n.get("lastMutationID").longValue()
            );
        } catch (RuntimeException e) {
            throw new StorageException("malformed commit chunk", e);
        }
    }

    static Snapshot decodeSnapshot(byte[] chunk) {
        try {
            return Snapshot.fromJson(CanonicalJson.decode(chunk));
        } catch (RuntimeException e) {
            throw new StorageException("malformed snapshot chunk", e);
        }
    }

    static Commit genesis() {
        Snapshot empty = Snapshot.empty();
        Header h = new Header(null, Hash.of(empty.encode()), empty.checksum(), 0);
        return new Commit(Hash.of(encode(h)), null, empty, empty.checksum(), 0);
    }
}

// file: client/src/main/java/io/diffserve/client/ClientState.java
package io.diffserve.client;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.ObjectNode;
import io.diffserve.core.CanonicalJson;
import io.diffserve.core.Checksum;
import io.diffserve.core.Snapshot;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardCopyOption;
import java.util.Objects;

/**
 * What a client remembers between pulls, persisted as one JSON file:
 *
 *   {
 *     "accountID": "sandbox",
 *     "clientID": "c1",
 *     "stateID": "o4f5kd0sa2qdbi4fvm0q1jcc5ck5k4hf",
 *     "checksum": "3e6f...c1",
 *     "lastMutationID": 2,
 *     "data": { "foo": "bar" }
 *   }
 *
 * stateID is "" until the first successful pull.
 */
public record ClientState(
        String accountID,
        String clientID,
        String stateID,
        long lastMutationID,
        Snapshot data
) {
    public ClientState {
        Objects.requireNonNull(accountID, "accountID");
        Objects.requireNonNull(clientID, "clientID");
        Objects.requireNonNull(stateID, "stateID");
        Objects.requireNonNull(data, "data");
    }

    public static ClientState initial(String accountID, String clientID) {
        return new ClientState(accountID, clientID, "", 0, Snapshot.empty());
    }

    public boolean hasSynced() {
        return !stateID.isEmpty();
    }

    public Checksum checksum() {
        return data.checksum();
    }

    public boolean belongsTo(String accountID, String clientID) {
        return this.accountID.equals(accountID) && this.clientID.equals(clientID);
    }

    /** Load a state file; a missing file yields null. */
    public static ClientState load(Path file) {
        if (!Files.exists(file)) {
            return null;
        }
        try {
            JsonNode n = CanonicalJson.MAPPER.readTree(file.toFile());
            Snapshot data = Snapshot.fromJson(n.path("data"));
            String checksum = n.path("checksum").asText("");
            if (!data.checksum().toString().equals(checksum)) {
                throw new IllegalStateException("state file " + file + " is corrupt: checksum does not match data");
            }
            return new ClientState(
                    n.path("accountID").asText(""),
                    n.path("clientID").asText(""),
                    n.path("stateID").asText(""),
                    n.path("lastMutationID").asLong(0),
                    data
            );
        } catch (IOException e) {
            throw new UncheckedIOException("cannot read state file " + file, e);
        }
    }

    public void save(Path file) {
        ObjectNode n = CanonicalJson.nodes().objectNode();
        n.put("accountID", accountID);
        n.put("clientID", clientID);
        n.put("stateID", stateID);
        n.put("checksum", checksum().toString());
        n.put("lastMutationID", lastMutationID);
        n.set("data", data.toJson());
        try {
            Path tmp = file.resolveSibling(file.getFileName() + ".tmp");
            CanonicalJson.MAPPER.writerWithDefaultPrettyPrinter().writeValue(tmp.toFile(), n);
            Files.move(tmp, file, StandardCopyOption.REPLACE_EXISTING, StandardCopyOption.ATOMIC_MOVE);
        } catch (IOException e) {
            throw new UncheckedIOException("cannot write state file " + file, e);
        }
    }
}

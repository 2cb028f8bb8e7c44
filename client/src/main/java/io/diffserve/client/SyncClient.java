// file: client/src/main/java/io/diffserve/client/SyncClient.java
package io.diffserve.client;

import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.ObjectNode;
import io.diffserve.core.CanonicalJson;
import io.diffserve.core.Snapshot;
import io.diffserve.core.patch.Patch;
import io.diffserve.core.patch.PatchOp;

import java.io.IOException;
import java.net.URI;
import java.net.http.HttpClient;
import java.net.http.HttpRequest;
import java.net.http.HttpResponse;
import java.util.List;
import java.util.Objects;

/**
 * HTTP client for a diff server.
 *
 * pull() sends the local stateID and checksum, applies the returned patch to the
 * local data and checks the result against the server's checksum before handing
 * back the new state. The caller's state is never modified.
 */
public final class SyncClient {

    private static final TypeReference<List<PatchOp>> PATCH = new TypeReference<>() {};

    private final HttpClient http;
    private final String baseUrl;
    private final String authToken;

    public SyncClient(String baseUrl, String authToken) {
        this(HttpClient.newHttpClient(), baseUrl, authToken);
    }

    SyncClient(HttpClient http, String baseUrl, String authToken) {
        this.http = Objects.requireNonNull(http, "http");
        Objects.requireNonNull(baseUrl, "baseUrl");
        this.baseUrl = baseUrl.endsWith("/") ? baseUrl.substring(0, baseUrl.length() - 1) : baseUrl;
        this.authToken = authToken;
    }

    public ClientState pull(ClientState local) throws IOException, InterruptedException {
        ObjectNode body = CanonicalJson.nodes().objectNode();
        body.put("accountID", local.accountID());
        body.put("clientID", local.clientID());
        if (local.hasSynced()) {
            body.put("baseStateID", local.stateID());
            body.put("checksum", local.checksum().toString());
        }

        JsonNode resp = post("/pull", body);

        List<PatchOp> ops = CanonicalJson.MAPPER.convertValue(resp.path("patch"), PATCH);
        Snapshot next;
        try {
            next = Patch.of(ops).apply(local.data());
        } catch (IllegalArgumentException e) {
            throw new SyncException("patch does not apply to local state: " + e.getMessage(), e);
        }
        String expected = resp.path("checksum").asText("");
        if (!next.checksum().toString().equals(expected)) {
            throw new SyncException("checksum mismatch after applying patch: local "
                    + next.checksum() + ", server " + expected);
        }
        return new ClientState(
                local.accountID(),
                local.clientID(),
                resp.path("stateID").asText(""),
                resp.path("lastMutationID").asLong(),
                next
        );
    }

    /** POST /inject; returns the server's answer. Only works against servers started with --enable-inject. */
    public JsonNode inject(String accountID, String clientID, long lastMutationID, JsonNode clientView)
            throws IOException, InterruptedException {
        ObjectNode view = CanonicalJson.nodes().objectNode();
        view.set("clientView", clientView);
        view.put("lastMutationID", lastMutationID);
        ObjectNode body = CanonicalJson.nodes().objectNode();
        body.put("accountID", accountID);
        body.put("clientID", clientID);
        body.set("clientViewResponse", view);
        return post("/inject", body);
    }

    private JsonNode post(String path, JsonNode body) throws IOException, InterruptedException {
        HttpRequest.Builder req = HttpRequest.newBuilder()
                .uri(URI.create(baseUrl + path))
                .header("Content-Type", "application/json")
                .POST(HttpRequest.BodyPublishers.ofByteArray(CanonicalJson.MAPPER.writeValueAsBytes(body)));
        if (authToken != null && !authToken.isEmpty()) {
            req.header("Authorization", authToken);
        }

        HttpResponse<String> resp = http.send(req.build(), HttpResponse.BodyHandlers.ofString());
        if (resp.statusCode() != 200) {
            throw new SyncException(path.substring(1) + " failed (" + resp.statusCode() + "): " + resp.body());
        }
        return CanonicalJson.MAPPER.readTree(resp.body());
    }

    /** The server refused the request or its answer was unusable. */
    public static final class SyncException extends RuntimeException {
        SyncException(String msg) {
            super(msg);
        }

        SyncException(String msg, Throwable cause) {
            super(msg, cause);
        }
    }
}

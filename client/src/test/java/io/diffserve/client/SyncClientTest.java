// file: client/src/test/java/io/diffserve/client/SyncClientTest.java
package io.diffserve.client;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.ObjectNode;
import io.diffserve.core.CanonicalJson;
import io.diffserve.core.Snapshot;
import io.diffserve.core.patch.Patch;
import io.diffserve.core.patch.SnapshotDiff;
import io.undertow.Undertow;
import io.undertow.server.handlers.BlockingHandler;
import io.undertow.util.Headers;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Client against a stand-in server that diffs a settable snapshot against the
 * last state it handed out.
 */
class SyncClientTest {

    private static final int PORT = 18191;

    @TempDir Path dir;

    private Undertow server;
    private volatile Snapshot current = Snapshot.empty();
    private volatile Snapshot served;
    private volatile String servedID;
    private volatile int version;
    private volatile boolean corruptChecksum;
    private volatile String seenAuth;

    @BeforeEach
    void startServer() {
        server = Undertow.builder()
                .addHttpListener(PORT, "localhost")
                .setHandler(new BlockingHandler(ex -> {
                    JsonNode req = CanonicalJson.MAPPER.readTree(ex.getInputStream());
                    seenAuth = ex.getRequestHeaders().getFirst(Headers.AUTHORIZATION);
                    String base = req.path("baseStateID").asText("");

                    Snapshot target = current;
                    Patch patch = base.equals(servedID) && served != null
                            ? SnapshotDiff.diff(served, target)
                            : SnapshotDiff.diff(null, target);
                    served = target;
                    servedID = String.format("%032d", ++version);

                    ObjectNode resp = CanonicalJson.nodes().objectNode();
                    resp.put("stateID", servedID);
                    resp.put("lastMutationID", version);
                    resp.set("patch", CanonicalJson.MAPPER.valueToTree(patch));
                    resp.put("checksum", corruptChecksum
                            ? Snapshot.empty().checksum().toString()
                            : target.checksum().toString());

                    ex.getResponseHeaders().put(Headers.CONTENT_TYPE, "application/json");
                    ex.getResponseSender().send(CanonicalJson.MAPPER.writeValueAsString(resp), StandardCharsets.UTF_8);
                }))
                .build();
        server.start();
    }

    @AfterEach
    void stopServer() {
        server.stop();
    }

    private SyncClient client() {
        return new SyncClient("http://localhost:" + PORT + "/", "Bearer t");
    }

    private static JsonNode text(String s) {
        return CanonicalJson.nodes().textNode(s);
    }

    @Test
    void first_pull_bootstraps_and_saves_state() throws Exception {
        current = Snapshot.empty().with("foo", text("bar"));
        Path state = dir.resolve("state.json");

        ClientState s = Cli.pull(client(), state, "sandbox", "c1");

        assertEquals(current, s.data());
        assertEquals(1, s.lastMutationID());
        assertEquals("Bearer t", seenAuth);

        ClientState loaded = ClientState.load(state);
        assertEquals(s, loaded);
    }

    @Test
    void later_pulls_apply_deltas_on_top_of_local_state() throws Exception {
        Path state = dir.resolve("state.json");
        current = Snapshot.empty().with("a", text("1")).with("b", text("1"));
        Cli.pull(client(), state, "sandbox", "c1");

        current = current.without("a").with("b", text("2")).with("c", text("3"));
        ClientState s = Cli.pull(client(), state, "sandbox", "c1");

        assertEquals(current, s.data());
        assertEquals(2, s.lastMutationID());
    }

    @Test
    void checksum_mismatch_is_refused_and_state_is_kept() throws Exception {
        Path state = dir.resolve("state.json");
        current = Snapshot.empty().with("a", text("1"));
        ClientState before = Cli.pull(client(), state, "sandbox", "c1");

        current = current.with("b", text("2"));
        corruptChecksum = true;
        assertThrows(SyncClient.SyncException.class, () -> Cli.pull(client(), state, "sandbox", "c1"));

        assertEquals(before, ClientState.load(state));
    }

    @Test
    void state_of_another_client_is_not_reused() throws Exception {
        Path state = dir.resolve("state.json");
        current = Snapshot.empty().with("a", text("1"));
        ClientState.initial("sandbox", "other").save(state);

        ClientState s = Cli.pull(client(), state, "sandbox", "c1");

        assertEquals("c1", s.clientID());
        assertEquals(current, s.data());
    }

    @Test
    void corrupt_state_file_is_detected() throws Exception {
        Path state = dir.resolve("state.json");
        Files.writeString(state, """
                {"accountID":"sandbox","clientID":"c1","stateID":"x","lastMutationID":1,
                 "checksum":"0000000000000000000000000000000000000000000000000000000000000000",
                 "data":{"a":1}}
                """);

        assertThrows(IllegalStateException.class, () -> ClientState.load(state));
    }

    @Test
    void options_are_parsed_before_the_command() {
        Cli.Options o = Cli.Options.parse(new String[]{
                "--base-url", "http://h:1", "--auth", "tok", "--state", "s.json", "pull", "a", "c"});

        assertEquals("http://h:1", o.baseUrl);
        assertEquals("tok", o.auth);
        assertEquals(Path.of("s.json"), o.stateFile);
        assertEquals(java.util.List.of("pull", "a", "c"), o.rest);
        assertThrows(Cli.CliException.class, () -> Cli.Options.parse(new String[]{"--bogus", "x"}));
    }
}

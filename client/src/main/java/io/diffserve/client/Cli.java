// file: client/src/main/java/io/diffserve/client/Cli.java
package io.diffserve.client;

import com.fasterxml.jackson.databind.JsonNode;
import io.diffserve.core.CanonicalJson;

import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;

/**
 * Simple CLI that keeps a local replica in sync with a running diff server.
 *
 * Usage:
 *   diffserve-cli [--base-url URL] [--auth TOKEN] [--state FILE] pull <accountID> <clientID>
 *   diffserve-cli [--state FILE] show
 *   diffserve-cli [--base-url URL] inject <accountID> <clientID> <lastMutationID> <view.json>
 *
 * Examples:
 *   diffserve-cli inject sandbox c1 1 view.json
 *   diffserve-cli pull sandbox c1
 *   diffserve-cli show
 */
public final class Cli {

    private static final String DEFAULT_BASE_URL = "http://localhost:8080";
    private static final String DEFAULT_STATE_FILE = ".diffserve-state.json";

    private Cli() {
    }

    public static void main(String[] args) {
        try {
            Options opts = Options.parse(args);
            if (opts.rest.isEmpty()) {
                usageAndExit("missing command");
            }

            String cmd = opts.rest.get(0);
            List<String> rest = opts.rest;
            SyncClient client = new SyncClient(opts.baseUrl, opts.auth);

            switch (cmd) {
                case "pull" -> {
                    if (rest.size() != 3) {
                        usageAndExit("pull requires <accountID> <clientID>");
                    }
                    ClientState after = pull(client, opts.stateFile, rest.get(1), rest.get(2));
                    System.out.printf("%s lastMutationID=%d keys=%d checksum=%s%n",
                            after.stateID(), after.lastMutationID(), after.data().size(), after.checksum());
                }
                case "show" -> {
                    ClientState s = ClientState.load(opts.stateFile);
                    if (s == null) {
                        System.out.println("(no local state)");
                    } else {
                        System.out.println(CanonicalJson.MAPPER.writerWithDefaultPrettyPrinter()
                                .writeValueAsString(s.data().toJson()));
                    }
                }
                case "inject" -> {
                    if (rest.size() != 5) {
                        usageAndExit("inject requires <accountID> <clientID> <lastMutationID> <view.json>");
                    }
                    long lastMutationID;
                    try {
                        lastMutationID = Long.parseLong(rest.get(3));
                    } catch (NumberFormatException e) {
                        throw new CliException("lastMutationID must be a number: " + rest.get(3));
                    }
                    JsonNode view = CanonicalJson.MAPPER.readTree(Path.of(rest.get(4)).toFile());
                    JsonNode resp = client.inject(rest.get(1), rest.get(2), lastMutationID, view);
                    System.out.println(resp);
                }
                default -> usageAndExit("unknown command: " + cmd);
            }
        } catch (CliException | SyncClient.SyncException e) {
            System.err.println("error: " + e.getMessage());
            System.exit(1);
        } catch (Exception e) {
            e.printStackTrace(System.err);
            System.exit(2);
        }
    }

    /**
     * Pull into the given state file. A state file of another client is ignored and
     * replaced, as is a missing one.
     */
    static ClientState pull(SyncClient client, Path stateFile, String accountID, String clientID) throws Exception {
        ClientState local = ClientState.load(stateFile);
        if (local == null || !local.belongsTo(accountID, clientID)) {
            local = ClientState.initial(accountID, clientID);
        }
        ClientState after = client.pull(local);
        after.save(stateFile);
        return after;
    }

    static final class Options {
        String baseUrl = DEFAULT_BASE_URL;
        String auth;
        Path stateFile = Path.of(DEFAULT_STATE_FILE);
        final List<String> rest = new ArrayList<>();

        static Options parse(String[] args) {
            Options o = new Options();
            int i = 0;
            for (; i < args.length && args[i].startsWith("--"); i++) {
                if (i + 1 >= args.length) {
                    throw new CliException(args[i] + " requires a value");
                }
                switch (args[i]) {
                    case "--base-url" -> o.baseUrl = args[++i];
                    case "--auth" -> o.auth = args[++i];
                    case "--state" -> o.stateFile = Path.of(args[++i]);
                    default -> throw new CliException("unknown option: " + args[i]);
                }
            }
            for (; i < args.length; i++) {
                o.rest.add(args[i]);
            }
            return o;
        }
    }

    private static void usageAndExit(String msg) {
        if (msg != null && !msg.isBlank()) {
            System.err.println("error: " + msg);
        }
        System.err.println("""
                Usage:
                  diffserve-cli [--base-url URL] [--auth TOKEN] [--state FILE] pull <accountID> <clientID>
                  diffserve-cli [--state FILE] show
                  diffserve-cli [--base-url URL] inject <accountID> <clientID> <lastMutationID> <view.json>
                """);
        System.exit(1);
    }

    static final class CliException extends RuntimeException {
        CliException(String msg) {
            super(msg);
        }
    }
}

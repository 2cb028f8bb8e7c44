// file: server/src/main/java/io/diffserve/server/ServerConfig.java
package io.diffserve.server;

/**
 * Server configuration parsed from CLI args.
 *
 * Supports:
 *  - httpPort:       HTTP API port
 *  - dataDir:        root directory of the per-account content stores, or "mem"
 *  - accountsPath:   optional JSON accounts file; null selects the built-in sandbox account
 *  - enableInject:   expose POST /inject (test setups only)
 *  - fetchTimeoutMs: connect and request timeout for client view fetches
 */
public record ServerConfig(
        int httpPort,
        String dataDir,
        String accountsPath,
        boolean enableInject,
        long fetchTimeoutMs
) {
    public static final String IN_MEMORY = "mem";

    public boolean inMemory() {
        return IN_MEMORY.equals(dataDir);
    }

    /**
     * Very small CLI parser.
     *
     * Supported flags:
     *   --http-port, -p   <port>
     *   --data-dir,  -d   <path|mem>
     *   --accounts,  -a   <path>
     *   --enable-inject
     *   --fetch-timeout-ms <millis>
     *   --help,      -h
     *
     * All flags are optional; defaults are reasonable for local dev.
     */
    public static ServerConfig fromArgs(String[] args) {
        int httpPort = 8080;
        String dataDir = "./data";
        String accountsPath = null;
        boolean enableInject = false;
        long fetchTimeoutMs = 5000;

        for (int i = 0; i < args.length; i++) {
            switch (args[i]) {
                case "--help", "-h" -> printHelpAndExit();

                case "--http-port", "-p" -> {
                    ensureValue(args, i);
                    httpPort = parseLong(args[++i], "http-port").intValue();
                }

                case "--data-dir", "-d" -> {
                    ensureValue(args, i);
                    dataDir = args[++i];
                }

                case "--accounts", "-a" -> {
                    ensureValue(args, i);
                    accountsPath = args[++i];
                }

                case "--enable-inject" -> enableInject = true;

                case "--fetch-timeout-ms" -> {
                    ensureValue(args, i);
                    fetchTimeoutMs = parseLong(args[++i], "fetch-timeout-ms");
                }

                default -> {
                    System.err.println("Unknown option: " + args[i]);
                    printHelpAndExit();
                }
            }
        }
        if (fetchTimeoutMs <= 0) {
            System.err.println("fetch-timeout-ms must be > 0");
            System.exit(1);
        }
        return new ServerConfig(httpPort, dataDir, accountsPath, enableInject, fetchTimeoutMs);
    }

    private static Long parseLong(String raw, String flag) {
        try {
            return Long.parseLong(raw);
        } catch (NumberFormatException e) {
            System.err.println("Invalid " + flag + ": " + raw);
            System.exit(1);
            return null;
        }
    }

    private static void ensureValue(String[] args, int i) {
        if (i + 1 >= args.length) {
            System.err.println("Missing value for option: " + args[i]);
            System.exit(1);
        }
    }

    private static void printHelpAndExit() {
        System.out.println("""
            Usage: diffserve [options]

            Options:
              --http-port,      -p   HTTP port (default: 8080)
              --data-dir,       -d   Data directory, or "mem" for an in-memory store (default: ./data)
              --accounts,       -a   Path to JSON accounts file (default: built-in "sandbox" account)
              --enable-inject        Enable POST /inject for tests
              --fetch-timeout-ms     Client view fetch timeout in ms (default: 5000)
              --help,           -h   Show this help message
            """);
        System.exit(0);
    }
}

// file: server/src/main/java/io/diffserve/server/Main.java
package io.diffserve.server;

import io.diffserve.server.account.AccountRegistry;
import io.diffserve.server.clientview.HttpClientViewFetcher;
import io.diffserve.storage.CommitLogs;

import java.nio.file.Path;
import java.time.Duration;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * Entry point for a diff server.
 *
 * Responsibilities:
 *  - Parse configuration from CLI.
 *  - Load accounts.
 *  - Wire the commit logs (on disk or in memory), the client view fetcher and SyncService.
 *  - Start the HTTP server and close everything on shutdown.
 */
public final class Main {
    private static final Logger log = Logger.getLogger(Main.class.getName());

    private Main() {
        // no-op
    }

    public static void main(String[] args) {
        var cfg = ServerConfig.fromArgs(args);

        // ------ Accounts ------
        AccountRegistry accounts = cfg.accountsPath() == null
                ? AccountRegistry.defaultRegistry()
                : AccountRegistry.fromJsonFile(Path.of(cfg.accountsPath()));

        // ------ Storage Layer -------
        CommitLogs logs = cfg.inMemory()
                ? CommitLogs.inMemory()
                : CommitLogs.onDisk(Path.of(cfg.dataDir()));

        // ------ Sync ------
        var fetcher = new HttpClientViewFetcher(Duration.ofMillis(cfg.fetchTimeoutMs()));
        var sync = new SyncService(accounts, logs, fetcher);

        // ------ HTTP layer ------
        var web = new WebServer(cfg.httpPort(), sync, cfg.enableInject());
        web.start();

        System.out.printf(
                "diffserve listening on http://%s:%d (data=%s, accounts=%d%s)%n",
                "localhost", cfg.httpPort(),
                cfg.inMemory() ? "in-memory" : cfg.dataDir(),
                accounts.accounts().size(),
                cfg.enableInject() ? ", inject enabled" : ""
        );

        // Shutdown hook
        Runtime.getRuntime().addShutdownHook(new Thread(() -> {
            try {
                web.stop();
            } catch (RuntimeException e) {
                log.log(Level.WARNING, "Failed to stop HTTP server", e);
            }
            logs.close();
        }));
    }
}

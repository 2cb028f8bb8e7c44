// file: storage/src/main/java/io/diffserve/storage/CommitLogs.java
package io.diffserve.storage;

import io.diffserve.core.Hash;

import java.nio.charset.StandardCharsets;
import java.nio.file.Path;
import java.util.HexFormat;
import java.util.Map;
import java.util.Objects;
import java.util.concurrent.ConcurrentHashMap;
import java.util.function.Function;
import java.util.logging.Level;
import java.util.logging.Logger;
import java.util.regex.Pattern;

/**
 * Process-wide registry of open commit logs.
 * <p>
 *  - one {@link ContentStore} per account, created on first use by the factory,
 *  - one {@link CommitLog} per (accountID, clientID), created on first open,
 *  - both caches initialize each key once and never evict.
 */
public final class CommitLogs implements AutoCloseable {
    private static final Logger log = Logger.getLogger(CommitLogs.class.getName());

    private static final Pattern SAFE_DIR_NAME = Pattern.compile("^[A-Za-z0-9._-]{1,128}$");
    private static final int MAX_HEX_ENCODED_BYTES = 100;

    private final Function<String, ContentStore> storeFactory;
    private final Map<String, ContentStore> stores = new ConcurrentHashMap<>();
    private final Map<ClientKey, CommitLog> logs = new ConcurrentHashMap<>();

    public CommitLogs(Function<String, ContentStore> storeFactory) {
        this.storeFactory = Objects.requireNonNull(storeFactory, "storeFactory");
    }

    /** Every account gets a fresh {@link InMemoryContentStore}. */
    public static CommitLogs inMemory() {
        return new CommitLogs(accountID -> new InMemoryContentStore());
    }

    /** Every account gets a {@link FileContentStore} under root/{@link #directoryFor(String) dir}. */
    public static CommitLogs onDisk(Path root) {
        Objects.requireNonNull(root, "root");
        return new CommitLogs(accountID -> FileContentStore.open(root.resolve(directoryFor(accountID))));
    }

    /** Open (or create) the log of one client. Idempotent and thread-safe. */
    public CommitLog open(String accountID, String clientID) {
        Objects.requireNonNull(accountID, "accountID");
        Objects.requireNonNull(clientID, "clientID");
        return logs.computeIfAbsent(new ClientKey(accountID, clientID),
                k -> new CommitLog(store(k.accountID()), k.accountID(), k.clientID()));
    }

    ContentStore store(String accountID) {
        return stores.computeIfAbsent(accountID, storeFactory);
    }

    @Override
    public void close() {
        for (Map.Entry<String, ContentStore> e : stores.entrySet()) {
            try {
                e.getValue().close();
            } catch (RuntimeException ex) {
                log.log(Level.WARNING, "Failed to close store of account " + e.getKey(), ex);
            }
        }
    }

    /**
     * Directory name of an account. Plain names ([A-Za-z0-9._-], up to 128 chars,
     * not "." or "..") are used as is. Anything else becomes "~" + hex of its UTF-8
     * bytes, or "~~" + its hash when that would be too long. '~' never appears in a
     * plain name or in hex, so distinct accounts never share a directory.
     */
    static String directoryFor(String accountID) {
        if (SAFE_DIR_NAME.matcher(accountID).matches() && !accountID.equals(".") && !accountID.equals("..")) {
            return accountID;
        }
        byte[] utf8 = accountID.getBytes(StandardCharsets.UTF_8);
        if (utf8.length <= MAX_HEX_ENCODED_BYTES) {
            return "~" + HexFormat.of().formatHex(utf8);
        }
        return "~~" + Hash.of(utf8);
    }

    private record ClientKey(String accountID, String clientID) {}
}

// file: server/src/main/java/io/diffserve/server/SyncService.java
package io.diffserve.server;

import io.diffserve.core.Checksum;
import io.diffserve.core.Hash;
import io.diffserve.core.Snapshot;
import io.diffserve.core.patch.Patch;
import io.diffserve.core.patch.SnapshotDiff;
import io.diffserve.server.account.Account;
import io.diffserve.server.account.AccountRegistry;
import io.diffserve.server.clientview.ClientViewException;
import io.diffserve.server.clientview.ClientViewFetcher;
import io.diffserve.server.dto.ClientViewRequest;
import io.diffserve.server.dto.ClientViewResponse;
import io.diffserve.server.dto.InjectRequest;
import io.diffserve.server.dto.InjectResponse;
import io.diffserve.server.dto.PullRequest;
import io.diffserve.server.dto.PullResponse;
import io.diffserve.storage.Commit;
import io.diffserve.storage.CommitLog;
import io.diffserve.storage.CommitLogs;
import io.diffserve.storage.StaleMutationException;
import io.diffserve.storage.UnknownStateException;

import java.util.Objects;
import java.util.Optional;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * Pull orchestration: validate, fetch the client view, commit it, diff against the
 * client's base and answer with the patch.
 *
 * Failure handling:
 *  - validation problems throw IllegalArgumentException before any I/O (HTTP 400),
 *  - an unusable upstream view is logged and the current head is served again,
 *  - an unknown or mismatching base degrades to a full bootstrap patch,
 *  - StorageException propagates (HTTP 500); the client's head is unchanged by it.
 */
public final class SyncService {
    private static final Logger log = Logger.getLogger(SyncService.class.getName());

    private final AccountRegistry accounts;
    private final CommitLogs logs;
    private final ClientViewFetcher fetcher;

    public SyncService(AccountRegistry accounts, CommitLogs logs, ClientViewFetcher fetcher) {
        this.accounts = Objects.requireNonNull(accounts, "accounts");
        this.logs = Objects.requireNonNull(logs, "logs");
        this.fetcher = Objects.requireNonNull(fetcher, "fetcher");
    }

    /**
     * Bring a client from its base state to the latest state.
     *
     * @param authToken Authorization header of the caller, forwarded to the data layer; may be null
     */
    public PullResponse pull(PullRequest req, String authToken) {
        // ---- 1) validation, cheapest first ----
        if (req.accountID().isEmpty()) {
            throw new IllegalArgumentException("Missing accountID");
        }
        if (req.clientID().isEmpty()) {
            throw new IllegalArgumentException("Missing clientID");
        }
        Optional<Hash> baseStateID = Optional.empty();
        if (req.baseStateID().isPresent() && !req.baseStateID().get().isEmpty()) {
            if (!Hash.isValid(req.baseStateID().get())) {
                throw new IllegalArgumentException("Invalid baseStateID");
            }
            baseStateID = Optional.of(Hash.parse(req.baseStateID().get()));
        }
        Optional<Checksum> clientChecksum = Optional.empty();
        if (req.checksum().isPresent()) {
            if (!Checksum.isValid(req.checksum().get())) {
                throw new IllegalArgumentException("Invalid checksum");
            }
            clientChecksum = Optional.of(Checksum.parse(req.checksum().get()));
        }
        Account account = accounts.lookup(req.accountID())
                .orElseThrow(() -> new IllegalArgumentException("Unknown accountID"));

        // ---- 2) latest state ----
        CommitLog clog = logs.open(account.id(), req.clientID());
        Commit head = refresh(account, clog, authToken);

        // ---- 3) base ----
        Commit base = resolveBase(clog, baseStateID, clientChecksum);

        // ---- 4) diff ----
        Patch patch = SnapshotDiff.diff(base == null ? null : base.snapshot(), head.snapshot());

        PullResponse out = new PullResponse();
        out.stateID = head.stateID().toString();
        out.lastMutationID = head.lastMutationID();
        out.patch = patch;
        out.checksum = head.checksum().toString();
        return out;
    }

    /**
     * Store a client view as if it had been fetched. Only reachable when /inject is enabled.
     */
    public InjectResponse inject(InjectRequest req) {
        if (req.accountID == null || req.accountID.isEmpty()) {
            throw new IllegalArgumentException("Missing accountID");
        }
        Account account = accounts.lookup(req.accountID)
                .orElseThrow(() -> new IllegalArgumentException("Unknown accountID"));
        if (req.clientID == null || req.clientID.isEmpty()) {
            throw new IllegalArgumentException("Missing clientID");
        }
        if (req.clientViewResponse == null) {
            throw new IllegalArgumentException("Missing clientViewResponse");
        }
        Snapshot snapshot = snapshotOf(req.clientViewResponse);

        CommitLog clog = logs.open(account.id(), req.clientID);
        Commit c;
        try {
            c = clog.append(snapshot, snapshot.checksum(), req.clientViewResponse.lastMutationID);
        } catch (StaleMutationException e) {
            throw new IllegalArgumentException(e.getMessage(), e);
        }

        InjectResponse out = new InjectResponse();
        out.stateID = c.stateID().toString();
        out.lastMutationID = c.lastMutationID();
        out.checksum = c.checksum().toString();
        return out;
    }

    /** Fetch and commit the upstream view; on any upstream problem keep the current head. */
    private Commit refresh(Account account, CommitLog clog, String authToken) {
        if (!account.hasClientView()) {
            return clog.head();
        }
        ClientViewResponse view;
        Snapshot snapshot;
        try {
            view = fetcher.fetch(account, new ClientViewRequest(clog.clientID()), authToken);
            snapshot = snapshotOf(view);
        } catch (ClientViewException | IllegalArgumentException e) {
            log.log(Level.WARNING, "Client view fetch for " + account.id() + "/" + clog.clientID()
                    + " failed, serving current head", e);
            return clog.head();
        }
        try {
            return clog.append(snapshot, snapshot.checksum(), view.lastMutationID);
        } catch (StaleMutationException e) {
            log.warning(() -> "Ignoring stale client view for " + account.id() + "/" + clog.clientID()
                    + ": " + e.getMessage());
            return clog.head();
        }
    }

    private Commit resolveBase(CommitLog clog, Optional<Hash> baseStateID, Optional<Checksum> clientChecksum) {
        if (baseStateID.isEmpty()) {
            return null;
        }
        Commit base;
        try {
            base = clog.lookup(baseStateID.get());
        } catch (UnknownStateException e) {
            log.fine(() -> "Unknown base " + e.stateID() + " for " + clog.accountID() + "/" + clog.clientID()
                    + ", sending full state");
            return null;
        }
        if (clientChecksum.isPresent() && !clientChecksum.get().equals(base.checksum())) {
            log.warning(() -> "Client " + clog.accountID() + "/" + clog.clientID() + " reports checksum "
                    + clientChecksum.get() + " for base " + base.stateID() + " (expected " + base.checksum()
                    + "), sending full state");
            return null;
        }
        return base;
    }

    static Snapshot snapshotOf(ClientViewResponse view) {
        if (view.clientView == null || !view.clientView.isObject()) {
            throw new IllegalArgumentException("Missing clientView");
        }
        if (view.lastMutationID == null || view.lastMutationID < 0) {
            throw new IllegalArgumentException("Missing lastMutationID");
        }
        return Snapshot.fromJson(view.clientView);
    }
}

// file: server/src/main/java/io/diffserve/server/account/AccountRegistry.java
package io.diffserve.server.account;

import com.fasterxml.jackson.databind.ObjectMapper;
import io.diffserve.server.dto.AccountsJson;

import java.io.IOException;
import java.nio.file.Path;
import java.util.Collection;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/** Immutable set of known accounts, keyed by id. */
public final class AccountRegistry {

    public static final String SANDBOX_ID = "sandbox";

    private final Map<String, Account> byId;

    public AccountRegistry(List<Account> accounts) {
        if (accounts == null || accounts.isEmpty()) {
            throw new IllegalArgumentException("accounts must not be empty");
        }
        Map<String, Account> m = new LinkedHashMap<>();
        for (Account a : accounts) {
            if (m.putIfAbsent(a.id(), a) != null) {
                throw new IllegalArgumentException("duplicate account id: " + a.id());
            }
        }
        this.byId = Map.copyOf(m);
    }

    /** Single "sandbox" account without an upstream; views arrive through /inject. */
    public static AccountRegistry defaultRegistry() {
        return new AccountRegistry(List.of(new Account(SANDBOX_ID, "Sandbox", null)));
    }

    public static AccountRegistry fromJsonFile(Path path) {
        ObjectMapper mapper = new ObjectMapper();
        try {
            AccountsJson cfg = mapper.readValue(path.toFile(), AccountsJson.class);
            if (cfg.accounts == null) {
                throw new IllegalArgumentException("accounts file has no \"accounts\" array: " + path);
            }
            List<Account> accounts = cfg.accounts.stream()
                    .map(a -> new Account(a.id, a.name, a.clientViewURL))
                    .toList();
            return new AccountRegistry(accounts);
        } catch (IOException e) {
            throw new RuntimeException("Failed to load accounts from " + path, e);
        }
    }

    public Optional<Account> lookup(String accountID) {
        return Optional.ofNullable(byId.get(accountID));
    }

    public Collection<Account> accounts() {
        return byId.values();
    }
}

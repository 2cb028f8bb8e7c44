// file: server/src/test/java/io/diffserve/server/account/AccountRegistryTest.java
package io.diffserve.server.account;

import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class AccountRegistryTest {

    @TempDir Path dir;

    @Test
    void loads_accounts_file() throws Exception {
        Path file = dir.resolve("accounts.json");
        Files.writeString(file, """
                {
                  "accounts": [
                    { "id": "acme", "name": "Acme", "clientViewURL": "https://acme.example/view" },
                    { "id": "local" }
                  ]
                }
                """);

        AccountRegistry reg = AccountRegistry.fromJsonFile(file);

        Account acme = reg.lookup("acme").orElseThrow();
        assertEquals("Acme", acme.name());
        assertTrue(acme.hasClientView());
        Account local = reg.lookup("local").orElseThrow();
        assertEquals("local", local.name());
        assertFalse(local.hasClientView());
        assertTrue(reg.lookup("other").isEmpty());
    }

    @Test
    void default_registry_has_only_the_sandbox() {
        AccountRegistry reg = AccountRegistry.defaultRegistry();

        assertEquals(1, reg.accounts().size());
        assertFalse(reg.lookup(AccountRegistry.SANDBOX_ID).orElseThrow().hasClientView());
    }

    @Test
    void duplicate_ids_are_rejected() {
        assertThrows(IllegalArgumentException.class, () -> new AccountRegistry(List.of(
                new Account("a", null, null),
                new Account("a", null, "http://x"))));
    }

    @Test
    void unreadable_file_fails_loudly() {
        assertThrows(RuntimeException.class, () -> AccountRegistry.fromJsonFile(dir.resolve("missing.json")));
    }
}

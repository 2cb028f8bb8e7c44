// file: server/src/main/java/io/diffserve/server/dto/AccountsJson.java
package io.diffserve.server.dto;

import java.util.List;

/**
 * Accounts file layout.
 * Example:
 *   {
 *     "accounts": [
 *       { "id": "acme", "name": "Acme", "clientViewURL": "https://acme.example/replicache-client-view" }
 *     ]
 *   }
 */
public class AccountsJson {
    public List<Entry> accounts;

    public static class Entry {
        public String id;
        public String name;
        public String clientViewURL; // optional
    }
}

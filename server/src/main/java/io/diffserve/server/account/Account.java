// file: server/src/main/java/io/diffserve/server/account/Account.java
package io.diffserve.server.account;

import java.util.Objects;

/**
 * A tenant of the server.
 *
 * @param clientViewURL upstream endpoint serving client views; null when the account
 *                      has no data layer and its clients only see injected views
 */
public record Account(String id, String name, String clientViewURL) {

    public Account {
        Objects.requireNonNull(id, "id");
        if (id.isBlank()) throw new IllegalArgumentException("account id must not be blank");
        if (name == null || name.isBlank()) name = id;
        if (clientViewURL != null && clientViewURL.isBlank()) clientViewURL = null;
    }

    public boolean hasClientView() {
        return clientViewURL != null;
    }
}

// file: server/src/main/java/io/diffserve/server/clientview/ClientViewFetcher.java
package io.diffserve.server.clientview;

import io.diffserve.server.account.Account;
import io.diffserve.server.dto.ClientViewRequest;
import io.diffserve.server.dto.ClientViewResponse;

/**
 * Obtains the current client view of one client from the account's data layer.
 * Implementations must be thread-safe; the sync service calls them from many
 * request threads at once and outside any commit log lock.
 */
public interface ClientViewFetcher {

    /**
     * @param authToken value of the caller's Authorization header, forwarded verbatim;
     *                  null or empty when the caller sent none
     * @return a response whose clientView is a JSON object and whose lastMutationID is set
     * @throws ClientViewException on network errors, timeouts, non-2xx answers and
     *                             malformed or incomplete bodies
     */
    ClientViewResponse fetch(Account account, ClientViewRequest request, String authToken)
            throws ClientViewException;
}

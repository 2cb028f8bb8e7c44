// file: server/src/main/java/io/diffserve/server/clientview/HttpClientViewFetcher.java
package io.diffserve.server.clientview;

import com.fasterxml.jackson.databind.ObjectMapper;
import io.diffserve.server.account.Account;
import io.diffserve.server.dto.ClientViewRequest;
import io.diffserve.server.dto.ClientViewResponse;

import java.io.IOException;
import java.net.URI;
import java.net.http.HttpClient;
import java.net.http.HttpRequest;
import java.net.http.HttpResponse;
import java.time.Duration;
import java.util.Objects;

/**
 * ClientViewFetcher over HTTP.
 *
 * Talks to the account's data layer:
 *
 *   POST {clientViewURL}
 *   Authorization: {token of the syncing client}
 *   { "clientID": "..." }
 *
 * Response JSON:
 *
 *   { "clientView": { ... }, "lastMutationID": 2 }
 *
 * This class:
 *   - performs the HTTP POST with a bounded connect and request timeout,
 *   - treats any non-2xx status as a failure,
 *   - parses JSON with Jackson and checks both members are present.
 */
public final class HttpClientViewFetcher implements ClientViewFetcher {

    private static final ObjectMapper MAPPER = new ObjectMapper();

    private final HttpClient client;
    private final Duration timeout;

    public HttpClientViewFetcher(Duration timeout) {
        this.timeout = Objects.requireNonNull(timeout, "timeout");
        this.client = HttpClient.newBuilder()
                .connectTimeout(timeout)
                .build();
    }

    @Override
    public ClientViewResponse fetch(Account account, ClientViewRequest request, String authToken)
            throws ClientViewException {
        if (!account.hasClientView()) {
            throw new ClientViewException("account " + account.id() + " has no client view URL");
        }
        String url = account.clientViewURL();

        HttpResponse<byte[]> resp;
        try {
            HttpRequest.Builder b = HttpRequest.newBuilder(URI.create(url))
                    .timeout(timeout)
                    .header("Content-Type", "application/json")
                    .POST(HttpRequest.BodyPublishers.ofByteArray(MAPPER.writeValueAsBytes(request)));
            if (authToken != null && !authToken.isEmpty()) {
                b.header("Authorization", authToken);
            }
            resp = client.send(b.build(), HttpResponse.BodyHandlers.ofByteArray());
        } catch (IllegalArgumentException e) {
            throw new ClientViewException("invalid client view URL " + url, e);
        } catch (IOException e) {
            throw new ClientViewException("client view fetch from " + url + " failed", e);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new ClientViewException("interrupted fetching client view from " + url, e);
        }

        if (resp.statusCode() < 200 || resp.statusCode() >= 300) {
            throw new ClientViewException("client view fetch from " + url + " returned HTTP " + resp.statusCode());
        }

        ClientViewResponse view;
        try {
            view = MAPPER.readValue(resp.body(), ClientViewResponse.class);
        } catch (IOException e) {
            throw new ClientViewException("malformed client view from " + url, e);
        }
        if (view == null) {
            throw new ClientViewException("empty client view response from " + url);
        }
        if (view.lastMutationID == null) {
            throw new ClientViewException("client view from " + url + " is missing lastMutationID");
        }
        if (view.lastMutationID < 0) {
            throw new ClientViewException("client view from " + url + " has negative lastMutationID");
        }
        if (view.clientView == null || !view.clientView.isObject()) {
            throw new ClientViewException("client view from " + url + " is missing clientView");
        }
        return view;
    }
}

// file: server/src/main/java/io/diffserve/server/dto/ClientViewResponse.java
package io.diffserve.server.dto;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.databind.JsonNode;

/**
 * Upstream answer to a {@link ClientViewRequest}, also embedded in /inject bodies.
 * Example:
 *   { "clientView": { "key": "value" }, "lastMutationID": 2 }
 * <p>
 * Both members are required; they are nullable here so that absence can be detected.
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public class ClientViewResponse {
    public JsonNode clientView;
    public Long lastMutationID;

    public ClientViewResponse() {
    }

    public ClientViewResponse(JsonNode clientView, Long lastMutationID) {
        this.clientView = clientView;
        this.lastMutationID = lastMutationID;
    }
}

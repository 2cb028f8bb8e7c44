// file: server/src/main/java/io/diffserve/server/dto/PullRequest.java
package io.diffserve.server.dto;

import com.fasterxml.jackson.databind.JsonNode;

import java.util.Objects;
import java.util.Optional;

/**
 * JSON body for POST /pull.
 * Example:
 *   {
 *     "accountID": "sandbox",
 *     "clientID": "c1",
 *     "baseStateID": "o4f5kd0sa2qdbi4fvm0q1jcc5ck5k4hf",
 *     "checksum": "3e6f...c1"
 *   }
 * <p>
 * baseStateID and checksum are three-state: Optional.empty() when the member is absent
 * or null, Optional.of("") when present but empty, otherwise the value.
 * accountID and clientID collapse absent to "".
 */
public record PullRequest(
        String accountID,
        String clientID,
        Optional<String> baseStateID,
        Optional<String> checksum
) {
    public PullRequest {
        Objects.requireNonNull(accountID, "accountID");
        Objects.requireNonNull(clientID, "clientID");
        Objects.requireNonNull(baseStateID, "baseStateID");
        Objects.requireNonNull(checksum, "checksum");
    }

    /**
     * Read a request from a parsed JSON tree.
     *
     * @throws IllegalArgumentException "Bad request payload" if the body is not an object
     *                                  or a member is not a string
     */
    public static PullRequest fromJson(JsonNode body) {
        if (body == null || !body.isObject()) {
            throw new IllegalArgumentException("Bad request payload");
        }
        return new PullRequest(
                text(body, "accountID").orElse(""),
                text(body, "clientID").orElse(""),
                text(body, "baseStateID"),
                text(body, "checksum")
        );
    }

    private static Optional<String> text(JsonNode body, String field) {
        JsonNode v = body.get(field);
        if (v == null || v.isNull()) {
            return Optional.empty();
        }
        if (!v.isTextual()) {
            throw new IllegalArgumentException("Bad request payload: " + field + " must be a string");
        }
        return Optional.of(v.asText());
    }
}

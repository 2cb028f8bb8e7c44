// file: server/src/main/java/io/diffserve/server/dto/PullResponse.java
package io.diffserve.server.dto;

import com.fasterxml.jackson.annotation.JsonPropertyOrder;
import io.diffserve.core.patch.Patch;

/**
 * Response for POST /pull.
 * Example:
 *   {
 *     "stateID": "o4f5kd0sa2qdbi4fvm0q1jcc5ck5k4hf",
 *     "lastMutationID": 2,
 *     "patch": [ { "op": "add", "path": "/baz", "value": "qux" } ],
 *     "checksum": "3e6f...c1"
 *   }
 */
@JsonPropertyOrder({"stateID", "lastMutationID", "patch", "checksum"})
public class PullResponse {
    public String stateID;
    public long lastMutationID;
    public Patch patch;
    public String checksum;
}

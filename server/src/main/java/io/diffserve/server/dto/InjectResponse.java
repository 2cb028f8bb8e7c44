// file: server/src/main/java/io/diffserve/server/dto/InjectResponse.java
package io.diffserve.server.dto;

import com.fasterxml.jackson.annotation.JsonPropertyOrder;

/** Response for POST /inject: the commit the injected view became. */
@JsonPropertyOrder({"stateID", "lastMutationID", "checksum"})
public class InjectResponse {
    public String stateID;
    public long lastMutationID;
    public String checksum;
}

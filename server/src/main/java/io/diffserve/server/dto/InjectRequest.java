// file: server/src/main/java/io/diffserve/server/dto/InjectRequest.java
package io.diffserve.server.dto;

/**
 * JSON body for POST /inject.
 * Example:
 *   {
 *     "accountID": "sandbox",
 *     "clientID": "c1",
 *     "clientViewResponse": { "clientView": { "foo": "bar" }, "lastMutationID": 1 }
 *   }
 */
public class InjectRequest {
    public String accountID;
    public String clientID;
    public ClientViewResponse clientViewResponse;
}

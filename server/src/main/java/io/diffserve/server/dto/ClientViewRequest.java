// file: server/src/main/java/io/diffserve/server/dto/ClientViewRequest.java
package io.diffserve.server.dto;

/** Body POSTed to an account's client view URL. */
public class ClientViewRequest {
    public String clientID;

    public ClientViewRequest() {
    }

    public ClientViewRequest(String clientID) {
        this.clientID = clientID;
    }
}

// file: server/src/main/java/io/diffserve/server/clientview/ClientViewException.java
package io.diffserve.server.clientview;

/** The upstream client view could not be obtained or was unusable. */
public class ClientViewException extends Exception {

    public ClientViewException(String message) {
        super(message);
    }

    public ClientViewException(String message, Throwable cause) {
        super(message, cause);
    }
}

// file: storage/src/main/java/io/diffserve/storage/UnknownStateException.java
package io.diffserve.storage;

import io.diffserve.core.Hash;

/** A stateID that is not part of the commit log's history. */
public class UnknownStateException extends RuntimeException {
    private final Hash stateID;

    public UnknownStateException(String dataset, Hash stateID) {
        super("unknown state " + stateID + " in " + dataset);
        this.stateID = stateID;
    }

    public Hash stateID() {
        return stateID;
    }
}

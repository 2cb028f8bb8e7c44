// file: storage/src/main/java/io/diffserve/storage/StaleMutationException.java
package io.diffserve.storage;

/** An append whose lastMutationID is lower than the current head's. */
public class StaleMutationException extends RuntimeException {

    public StaleMutationException(String dataset, long headMutationID, long offered) {
        super("lastMutationID regressed in " + dataset + ": head=" + headMutationID + ", offered=" + offered);
    }
}

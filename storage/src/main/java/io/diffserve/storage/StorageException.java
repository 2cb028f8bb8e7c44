// file: storage/src/main/java/io/diffserve/storage/StorageException.java
package io.diffserve.storage;

/**
 * The content store could not durably record or read data.
 * Fatal for the request that hit it; never leaves a commit log half-advanced.
 */
public class StorageException extends RuntimeException {

    public StorageException(String message) {
        super(message);
    }

    public StorageException(String message, Throwable cause) {
        super(message, cause);
    }
}

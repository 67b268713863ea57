package com.respkv.core;

/**
 * Thrown when a storage backend fails in a way the caller cannot recover from.
 */
public class StorageException extends RuntimeException {

    public StorageException(String message) {
        super(message);
    }

    public StorageException(String message, Throwable cause) {
        super(message, cause);
    }
}

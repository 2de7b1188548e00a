package com.id.swl.exceptions;

/**
 * The storage could not be reached or the write transaction did not commit.
 * Callers may retry: every write is an upsert on the natural key.
 */
public class StorageUnavailableException extends RuntimeException {

    public StorageUnavailableException(String message, Throwable cause) {
        super(message, cause);
    }
}

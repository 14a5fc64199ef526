package com.graysky.api.exception;

/**
 * The backing store could not be read or written. Never shown verbatim to callers.
 */
public class StorageException extends RuntimeException {

    public StorageException(String message) {
        super(message);
    }

    public StorageException(String message, Throwable cause) {
        super(message, cause);
    }
}

package com.example.chatrelay.store;

/**
 * Raised for any backend fault while talking to a table. Always carries the
 * original cause when one exists; callers treat it as retryable.
 */
public class StorageException extends RuntimeException {

    public StorageException(String message) {
        super(message);
    }

    public StorageException(String message, Throwable cause) {
        super(message, cause);
    }
}

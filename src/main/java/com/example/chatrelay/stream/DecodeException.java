package com.example.chatrelay.stream;

/**
 * A change image that cannot be turned into a chat event. Such records are
 * skipped, never retried.
 */
public class DecodeException extends RuntimeException {

    public DecodeException(String message) {
        super(message);
    }

    public DecodeException(String message, Throwable cause) {
        super(message, cause);
    }
}

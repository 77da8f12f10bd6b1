package com.example.chatrelay.transport;

/**
 * The gateway no longer knows the connection; the subscriber has gone away.
 */
public class TransportGoneException extends TransportException {

    public TransportGoneException(String connectionId) {
        super(connectionId, "Connection " + connectionId + " is gone");
    }

    public TransportGoneException(String connectionId, Throwable cause) {
        super(connectionId, "Connection " + connectionId + " is gone", cause);
    }
}

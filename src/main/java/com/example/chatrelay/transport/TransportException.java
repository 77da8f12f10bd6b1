package com.example.chatrelay.transport;

/**
 * A push to a connection failed for a reason other than the peer being gone.
 */
public class TransportException extends Exception {

    private final String connectionId;

    public TransportException(String connectionId, String message) {
        super(message);
        this.connectionId = connectionId;
    }

    public TransportException(String connectionId, String message, Throwable cause) {
        super(message, cause);
        this.connectionId = connectionId;
    }

    public String getConnectionId() {
        return connectionId;
    }
}

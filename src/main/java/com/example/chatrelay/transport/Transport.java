package com.example.chatrelay.transport;

/**
 * Pushes a payload to one subscriber connection.
 */
public interface Transport {

    /**
     * @throws TransportGoneException when the connection no longer exists
     * @throws TransportException     for any other delivery fault
     */
    void push(String connectionId, byte[] payload) throws TransportException;
}

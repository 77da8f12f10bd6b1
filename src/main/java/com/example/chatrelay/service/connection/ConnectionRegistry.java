package com.example.chatrelay.service.connection;

import com.example.chatrelay.model.Connection;

import java.util.List;

/**
 * Subscriber connections known to the service.
 *
 * <p>Connections may be tied to one channel. {@link #listConnections(String)}
 * returns the connections of that channel plus every connection that has no
 * channel association.
 */
public interface ConnectionRegistry {

    List<Connection> listConnections();

    List<Connection> listConnections(String channelId);

    void add(String connectionId, String channelId);

    void remove(String connectionId);
}

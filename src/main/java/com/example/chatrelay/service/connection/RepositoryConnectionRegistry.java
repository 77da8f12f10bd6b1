package com.example.chatrelay.service.connection;

import com.example.chatrelay.model.Connection;
import com.example.chatrelay.store.ItemKey;
import com.example.chatrelay.store.ItemRepository;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.stream.Collectors;

/**
 * Registry persisted in the connections table, keyed on {@code connectionId}.
 * Channel filtering happens after a full scan of the table.
 */
public class RepositoryConnectionRegistry implements ConnectionRegistry {

    private static final Logger logger = LoggerFactory.getLogger(RepositoryConnectionRegistry.class);

    private final ItemRepository connections;
    private final Clock clock;

    public RepositoryConnectionRegistry(ItemRepository connections, Clock clock) {
        this.connections = connections;
        this.clock = clock;
    }

    @Override
    public List<Connection> listConnections() {
        String key = connections.getTable().getPartitionKey();
        return connections.getList().stream()
                .filter(item -> item.get(key) != null)
                .map(item -> toConnection(item, key))
                .collect(Collectors.toList());
    }

    @Override
    public List<Connection> listConnections(String channelId) {
        return listConnections().stream()
                .filter(connection -> connection.isSubscribedTo(channelId))
                .collect(Collectors.toList());
    }

    @Override
    public void add(String connectionId, String channelId) {
        Map<String, Object> item = new LinkedHashMap<>();
        item.put(connections.getTable().getPartitionKey(), connectionId);
        if (channelId != null) {
            item.put("channelId", channelId);
        }
        item.put("connectedAt", clock.instant().getEpochSecond());
        connections.createIfAbsent(item);
        logger.info("Connection established: {} (channel {})", connectionId, channelId != null ? channelId : "*");
    }

    @Override
    public void remove(String connectionId) {
        connections.delete(ItemKey.of(connectionId));
        logger.info("Connection removed: {}", connectionId);
    }

    private static Connection toConnection(Map<String, Object> item, String key) {
        Object channel = item.get("channelId");
        Object connectedAt = item.get("connectedAt");
        return Connection.builder()
                .connectionId(item.get(key).toString())
                .channelId(channel != null ? channel.toString() : null)
                .connectedAt(connectedAt instanceof Number ? ((Number) connectedAt).longValue() : null)
                .build();
    }
}

package com.example.chatrelay.service.stage;

import com.example.chatrelay.model.ChatEvent;
import com.example.chatrelay.model.ChatEventPayload;
import com.example.chatrelay.model.Connection;
import com.example.chatrelay.service.connection.ConnectionRegistry;
import com.example.chatrelay.stream.ProcessingOutcome;
import com.example.chatrelay.stream.StreamStage;
import com.example.chatrelay.transport.Transport;
import com.example.chatrelay.transport.TransportException;
import com.example.chatrelay.transport.TransportGoneException;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.List;
import java.util.Set;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ExecutorService;

/**
 * Fans each new event out to the connections of its channel.
 *
 * <p>Pushes run concurrently on the delivery executor. Connections reported
 * gone are removed from the registry once every push has finished; other push
 * failures are only logged. The stage fails only when the connections cannot
 * be listed.
 */
public class DeliveryStage implements StreamStage {

    private static final Logger logger = LoggerFactory.getLogger(DeliveryStage.class);

    public static final String NAME = "delivery";

    private final ConnectionRegistry registry;
    private final Transport transport;
    private final ObjectMapper objectMapper;
    private final ExecutorService executor;

    public DeliveryStage(ConnectionRegistry registry, Transport transport, ObjectMapper objectMapper,
                         ExecutorService executor) {
        this.registry = registry;
        this.transport = transport;
        this.objectMapper = objectMapper;
        this.executor = executor;
    }

    @Override
    public String name() {
        return NAME;
    }

    @Override
    public ProcessingOutcome process(ChatEvent event) {
        deliver(event);
        return ProcessingOutcome.PROCESSED;
    }

    public DeliveryResult deliver(ChatEvent event) {
        byte[] payload = serialize(event);
        List<Connection> connections = registry.listConnections(event.getChannelId());
        if (connections.isEmpty()) {
            logger.info("No active connections for channel {}; nothing to deliver", event.getChannelId());
            return DeliveryResult.empty();
        }

        logger.info("Delivering event {} to {} connections", event.getId(), connections.size());
        DeliveryResult result = fanOut(payload, connections);
        prune(result.getStale());

        if (!result.getFailed().isEmpty()) {
            logger.warn("Some sends failed for event {}: failed connections {}", event.getId(), result.getFailed());
        }
        return result;
    }

    private DeliveryResult fanOut(byte[] payload, List<Connection> connections) {
        Set<String> delivered = ConcurrentHashMap.newKeySet();
        Set<String> stale = ConcurrentHashMap.newKeySet();
        Set<String> failed = ConcurrentHashMap.newKeySet();

        CompletableFuture<?>[] pushes = connections.stream()
                .map(Connection::getConnectionId)
                .map(id -> CompletableFuture.runAsync(() -> {
                    try {
                        transport.push(id, payload);
                        delivered.add(id);
                    } catch (TransportGoneException e) {
                        stale.add(id);
                    } catch (TransportException | RuntimeException e) {
                        logger.error("Failed to send message to connection {}", id, e);
                        failed.add(id);
                    }
                }, executor))
                .toArray(CompletableFuture[]::new);
        CompletableFuture.allOf(pushes).join();

        return new DeliveryResult(Set.copyOf(delivered), Set.copyOf(stale), Set.copyOf(failed));
    }

    private void prune(Set<String> stale) {
        for (String connectionId : stale) {
            try {
                logger.warn("Pruning stale WebSocket connection {}", connectionId);
                registry.remove(connectionId);
            } catch (RuntimeException e) {
                logger.error("Failed to prune stale connection {}", connectionId, e);
            }
        }
    }

    private byte[] serialize(ChatEvent event) {
        try {
            return objectMapper.writeValueAsBytes(ChatEventPayload.from(event));
        } catch (JsonProcessingException e) {
            throw new IllegalStateException("Could not serialize event " + event.getId(), e);
        }
    }
}

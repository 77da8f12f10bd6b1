package com.example.chatrelay.websocket;

import com.example.chatrelay.model.ChannelMessageRequest;
import com.example.chatrelay.service.ChannelMessageService;
import com.example.chatrelay.service.connection.ConnectionRegistry;
import com.example.chatrelay.store.StorageException;
import com.example.chatrelay.transport.LocalSessionTransport;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.web.socket.CloseStatus;
import org.springframework.web.socket.TextMessage;
import org.springframework.web.socket.WebSocketSession;
import org.springframework.web.socket.handler.TextWebSocketHandler;
import org.springframework.web.util.UriComponentsBuilder;

/**
 * Subscriber endpoint. Each session is registered as a connection (optionally
 * scoped to the {@code channelId} query parameter) and attached to the local
 * transport; text frames are treated as message submissions to that channel.
 */
public class ChatWebSocketHandler extends TextWebSocketHandler {

    private static final Logger logger = LoggerFactory.getLogger(ChatWebSocketHandler.class);

    static final String CHANNEL_ATTRIBUTE = "channelId";

    private final ConnectionRegistry registry;
    private final LocalSessionTransport transport;
    private final ChannelMessageService messageService;
    private final ObjectMapper objectMapper;

    public ChatWebSocketHandler(ConnectionRegistry registry, LocalSessionTransport transport,
                                ChannelMessageService messageService, ObjectMapper objectMapper) {
        this.registry = registry;
        this.transport = transport;
        this.messageService = messageService;
        this.objectMapper = objectMapper;
    }

    @Override
    public void afterConnectionEstablished(WebSocketSession session) throws Exception {
        String channelId = session.getUri() != null
                ? UriComponentsBuilder.fromUri(session.getUri()).build().getQueryParams().getFirst(CHANNEL_ATTRIBUTE)
                : null;
        if (channelId != null) {
            session.getAttributes().put(CHANNEL_ATTRIBUTE, channelId);
        }
        // attached before it is registered: a fan-out that lists the connection must find its session
        transport.attach(session.getId(), session);
        try {
            registry.add(session.getId(), channelId);
        } catch (StorageException e) {
            logger.error("Failed to connect {}", session.getId(), e);
            transport.detach(session.getId());
            session.close(CloseStatus.SERVER_ERROR);
        }
    }

    @Override
    public void afterConnectionClosed(WebSocketSession session, CloseStatus status) {
        transport.detach(session.getId());
        try {
            registry.remove(session.getId());
        } catch (StorageException e) {
            logger.error("Failed to disconnect {}", session.getId(), e);
        }
    }

    @Override
    protected void handleTextMessage(WebSocketSession session, TextMessage message) {
        String channelId = (String) session.getAttributes().get(CHANNEL_ATTRIBUTE);
        if (channelId == null) {
            logger.warn("Ignoring message from {}: connection is not bound to a channel", session.getId());
            return;
        }
        try {
            ChannelMessageRequest request = objectMapper.readValue(message.getPayload(), ChannelMessageRequest.class);
            messageService.sendMessage(channelId, request);
        } catch (JsonProcessingException | IllegalArgumentException e) {
            logger.warn("Rejected message from {}: {}", session.getId(), e.getMessage());
        }
    }
}

package com.example.chatrelay.transport;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.web.socket.TextMessage;
import org.springframework.web.socket.WebSocketSession;
import org.springframework.web.socket.handler.ConcurrentWebSocketSessionDecorator;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Pushes to WebSocket sessions opened against this process. A connection id
 * with no open session here is reported as gone.
 */
public class LocalSessionTransport implements Transport {

    private static final Logger logger = LoggerFactory.getLogger(LocalSessionTransport.class);

    private final Map<String, WebSocketSession> sessions = new ConcurrentHashMap<>();
    private final int sendTimeLimitMs;
    private final int bufferSizeLimit;

    public LocalSessionTransport(int sendTimeLimitMs, int bufferSizeLimit) {
        this.sendTimeLimitMs = sendTimeLimitMs;
        this.bufferSizeLimit = bufferSizeLimit;
    }

    public void attach(String connectionId, WebSocketSession session) {
        sessions.put(connectionId, new ConcurrentWebSocketSessionDecorator(session, sendTimeLimitMs, bufferSizeLimit));
    }

    public void detach(String connectionId) {
        sessions.remove(connectionId);
    }

    public boolean isAttached(String connectionId) {
        return sessions.containsKey(connectionId);
    }

    @Override
    public void push(String connectionId, byte[] payload) throws TransportException {
        WebSocketSession session = sessions.get(connectionId);
        if (session == null) {
            throw new TransportGoneException(connectionId);
        }
        if (!session.isOpen()) {
            sessions.remove(connectionId);
            throw new TransportGoneException(connectionId);
        }
        try {
            session.sendMessage(new TextMessage(new String(payload, StandardCharsets.UTF_8)));
        } catch (IOException | RuntimeException e) {
            logger.debug("Send to {} failed: {}", connectionId, e.getMessage());
            throw new TransportException(connectionId, "Failed to send to connection " + connectionId, e);
        }
    }
}
